package com.sandy.netwatch.monitor.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.netwatch.monitor.vo.SeriesRsp;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every query API call with its arguments and a short description of the result. Series and list
 * payloads are summarised by size instead of being dumped.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_JSON = 1000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.netwatch.monitor.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String uri = request != null ? request.getRequestURI() : "";

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        Map<String, Object> argMap = new LinkedHashMap<>();
        String[] names = sig.getParameterNames();
        Object[] args = pjp.getArgs();
        for (int i = 0; i < args.length; i++) {
            argMap.put(names != null && i < names.length ? names[i] : "arg" + i, args[i]);
        }
        log.info("Monitor API request: uri={} handler={} args={}", uri, sig.getName(), toJson(argMap));

        try {
            Object result = pjp.proceed();
            log.info("Monitor API response: uri={} handler={} durationMs={} result={}", uri, sig.getName(),
                    System.currentTimeMillis() - start, summarize(result));
            return result;
        } catch (Throwable t) {
            log.error("Monitor API error: uri={} handler={} durationMs={} errorType={} message={}", uri, sig.getName(),
                    System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private String summarize(Object result) {
        Object body = result instanceof ResponseEntity<?> re ? re.getBody() : result;
        String status = result instanceof ResponseEntity<?> re ? "status=" + re.getStatusCode().value() + " " : "";
        if (body instanceof SeriesRsp series) {
            return status + "series key=" + series.getKey() + " points=" + (series.getPoints() == null ? 0 : series.getPoints().size());
        }
        if (body instanceof Collection<?> c) {
            return status + "items=" + c.size();
        }
        return status + toJson(body);
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            return s.length() > MAX_JSON ? s.substring(0, MAX_JSON) + "...(" + (s.length() - MAX_JSON) + " more chars)" : s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
