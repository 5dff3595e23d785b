package com.sandy.netwatch.monitor.vo;

import com.sandy.netwatch.monitor.model.Sample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesRsp {
    private String key;
    private long start;
    private long end;
    private List<PointRsp> points;

    private static final DateTimeFormatter OUT_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PointRsp {
        private long timestamp;
        private String time;
        private Double value;
    }

    public static SeriesRsp of(String key, long start, long end, List<Sample> samples) {
        List<PointRsp> points = samples == null ? new ArrayList<>() : samples.stream()
                .map(s -> new PointRsp(s.timestamp(),
                        OUT_FMT.format(Instant.ofEpochSecond(s.timestamp()).atZone(ZoneId.systemDefault())),
                        s.value()))
                .collect(Collectors.toList());
        return SeriesRsp.builder().key(key).start(start).end(end).points(points).build();
    }
}
