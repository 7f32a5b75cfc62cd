package io.github.sachinnimbal.transferx.dto.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out transfer model names that are unique within one scope.
 * Thread-safe; a name is never handed out twice.
 *
 * <p>DTOs share {@link #global()}, so transfer model names are unique across
 * the process and can be published as OpenAPI components.
 */
public class TransferModelNameRegistry {

    private static final TransferModelNameRegistry GLOBAL = new TransferModelNameRegistry();

    public static TransferModelNameRegistry global() {
        return GLOBAL;
    }

    private final Set<String> names = new HashSet<>();

    /**
     * Claims the first free candidate. When every candidate is taken, the last
     * one gets a numeric suffix ({@code Name_1}, {@code Name_2}, ...).
     */
    public synchronized String claim(String... candidates) {
        for (String candidate : candidates) {
            if (names.add(candidate)) {
                return candidate;
            }
        }
        String base = candidates[candidates.length - 1];
        for (int i = 1; ; i++) {
            String name = base + "_" + i;
            if (names.add(name)) {
                return name;
            }
        }
    }

    public synchronized boolean isClaimed(String name) {
        return names.contains(name);
    }

    public synchronized int size() {
        return names.size();
    }

    public synchronized void clear() {
        names.clear();
    }
}
