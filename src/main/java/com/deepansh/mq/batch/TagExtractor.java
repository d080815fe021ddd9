package com.deepansh.mq.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code <name>value</name>} elements in model output.
 *
 * A tag seen once maps to its trimmed value; a tag seen several times maps to a list of
 * values in order of appearance. Values may span lines. Nesting is not interpreted.
 */
public final class TagExtractor {

    private static final Pattern TAG =
            Pattern.compile("<([A-Za-z_][A-Za-z0-9_.-]*)>(.*?)</\\1>", Pattern.DOTALL);

    private TagExtractor() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> extract(String text) {
        Map<String, Object> tags = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) return tags;

        Matcher matcher = TAG.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = matcher.group(2).strip();
            Object existing = tags.get(name);
            if (existing == null) {
                tags.put(name, value);
            } else if (existing instanceof List<?> values) {
                ((List<String>) values).add(value);
            } else {
                List<String> values = new ArrayList<>();
                values.add((String) existing);
                values.add(value);
                tags.put(name, values);
            }
        }
        return tags;
    }
}
