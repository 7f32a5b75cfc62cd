package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.enums.Mark;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;

import java.lang.reflect.Field;

/**
 * Introspects JPA entities and embeddables. {@link Transient} fields are
 * skipped; generated identifiers and {@link Version} columns are read-only
 * unless a mark says otherwise.
 */
public class JpaFieldIntrospector extends BeanFieldIntrospector {

    @Override
    protected boolean skipField(Field field) {
        return field.isAnnotationPresent(Transient.class);
    }

    @Override
    protected Mark refineMark(Field field, Mark declared) {
        if (declared != Mark.NONE) {
            return declared;
        }
        boolean generatedId = field.isAnnotationPresent(Id.class) && field.isAnnotationPresent(GeneratedValue.class);
        if (generatedId || field.isAnnotationPresent(Version.class)) {
            return Mark.READ_ONLY;
        }
        return Mark.NONE;
    }

    @Override
    public boolean isModelType(Class<?> type) {
        return type != null && (type.isAnnotationPresent(Entity.class) || type.isAnnotationPresent(Embeddable.class));
    }
}
