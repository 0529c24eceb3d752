package io.fakegateway.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens raw name/value pairs (headers or query parameters, in arrival order) into the two views
 * a proxy-integration event carries.
 *
 * <p>
 * Names are kept exactly as received. Insertion order follows the first occurrence of each
 * name.
 */
public final class MultiValues {

    private MultiValues() {
        // utility class
    }

    /**
     * Single-valued view: the first occurrence of each name wins, later duplicates are dropped.
     *
     * @param pairs raw pairs in arrival order
     * @return an unmodifiable, insertion-ordered map
     */
    public static Map<String, String> firstValues(List<Map.Entry<String, String>> pairs) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : pairs) {
            out.putIfAbsent(pair.getKey(), pair.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Multi-valued view: every occurrence of each name, in arrival order.
     *
     * @param pairs raw pairs in arrival order
     * @return an unmodifiable, insertion-ordered map of unmodifiable lists
     */
    public static Map<String, List<String>> allValues(List<Map.Entry<String, String>> pairs) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : pairs) {
            out.computeIfAbsent(pair.getKey(), k -> new ArrayList<>()).add(pair.getValue());
        }
        out.replaceAll((name, values) -> Collections.unmodifiableList(values));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Expands a grouped map (as HTTP frameworks expose query strings) back into raw pairs.
     *
     * @param grouped name to values, in the framework's order
     * @return pairs in the same order
     */
    public static List<Map.Entry<String, String>> pairs(Map<String, List<String>> grouped) {
        List<Map.Entry<String, String>> out = new ArrayList<>();
        grouped.forEach((name, values) -> values.forEach(value -> out.add(Map.entry(name, value))));
        return out;
    }
}
