package com.mike.leadscout.email.extract;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns "info (at) acme [dot] com" style spellings and entity-encoded separators back into addresses.
 */
@Component
public class TextObfuscationNormalizer {

    private static final Map<Pattern, String> REWRITES = new LinkedHashMap<>();

    static {
        rewrite("&#0*64;|&#x0*40;|&commat;|\\uFF20", "@");
        rewrite("&#0*46;|&#x0*2e;|&period;", ".");
        rewrite("\\s*[(\\[{<]\\s*(?:at|@)\\s*[)\\]}>]\\s*", "@");
        rewrite("\\s*[(\\[{<]\\s*(?:dot|\\.)\\s*[)\\]}>]\\s*", ".");
        rewrite("\\s+at\\s+", "@");
        rewrite("\\s+dot\\s+", ".");
    }

    private static void rewrite(String regex, String replacement) {
        REWRITES.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    public String normalize(String input) {
        if (input == null || input.isBlank()) return input;
        String s = input;
        for (Map.Entry<Pattern, String> r : REWRITES.entrySet()) {
            s = r.getKey().matcher(s).replaceAll(r.getValue());
        }
        return s;
    }
}
