package com.sandy.netwatch.monitor.tools;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob matching for monitoring keys: {@code *} matches any run of characters (including {@code :}),
 * {@code ?} matches one character, everything else is literal.
 */
public final class KeyPatternMatcher {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private KeyPatternMatcher() {}

    public static boolean matches(String pattern, String key) {
        if (pattern == null || key == null) return false;
        return CACHE.computeIfAbsent(pattern, KeyPatternMatcher::compile).matcher(key).matches();
    }

    /** Number of literal characters; a higher count means a more specific pattern. */
    public static int specificity(String pattern) {
        int literal = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '*' && c != '?') literal++;
        }
        return literal;
    }

    private static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
