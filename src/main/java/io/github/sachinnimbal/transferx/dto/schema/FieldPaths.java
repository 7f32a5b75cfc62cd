package io.github.sachinnimbal.transferx.dto.schema;

import java.util.LinkedHashSet;
import java.util.Set;

final class FieldPaths {

    private FieldPaths() {
    }

    /**
     * Remainders of the dotted paths whose first segment is {@code fieldName}:
     * {@code {"a.b", "a.c.d", "x"}} filtered by {@code a} gives {@code {"b", "c.d"}}.
     */
    static Set<String> filterNested(Set<String> paths, String fieldName) {
        if (paths.isEmpty()) {
            return Set.of();
        }
        Set<String> nested = new LinkedHashSet<>();
        String prefix = fieldName + ".";
        for (String path : paths) {
            if (path.startsWith(prefix) && path.length() > prefix.length()) {
                nested.add(path.substring(prefix.length()));
            }
        }
        return nested;
    }
}
