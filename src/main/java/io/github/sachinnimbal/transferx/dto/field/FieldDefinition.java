package io.github.sachinnimbal.transferx.dto.field;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.Mark;
import lombok.Builder;
import lombok.Value;

import java.util.function.Supplier;

/**
 * Normalized description of one field of a domain model, produced by a
 * {@link io.github.sachinnimbal.transferx.dto.introspect.FieldIntrospector}.
 */
@Value
@Builder(toBuilder = true)
public class FieldDefinition {

    /** Sentinel for "no default value". Distinct from a {@code null} default. */
    public static final Object NO_DEFAULT = new Object() {
        @Override
        public String toString() {
            return "NO_DEFAULT";
        }
    };

    String name;
    FieldType fieldType;
    @Builder.Default
    Object defaultValue = NO_DEFAULT;
    Supplier<?> defaultFactory;
    @Builder.Default
    Mark mark = Mark.NONE;
    /** Simple name of the model that declares the field. */
    String modelName;
    /** Direction the field is restricted to, or {@code null} for both. */
    DtoDirection dtoFor;

    public boolean hasDefault() {
        return defaultValue != NO_DEFAULT || defaultFactory != null;
    }

    public Object resolveDefault() {
        if (defaultFactory != null) {
            return defaultFactory.get();
        }
        return defaultValue == NO_DEFAULT ? null : defaultValue;
    }

    public FieldDefinition withMark(Mark newMark) {
        return toBuilder().mark(newMark).build();
    }
}
