package io.github.sachinnimbal.transferx.dto.introspect;

import java.util.Map;

final class Primitives {

    private static final Map<Class<?>, Object> DEFAULTS = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d,
            char.class, '\0'
    );

    private Primitives() {
    }

    static Object defaultValue(Class<?> type) {
        return type.isPrimitive() ? DEFAULTS.get(type) : null;
    }
}
