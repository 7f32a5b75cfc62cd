package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.dto.model.TransferModel;
import io.github.sachinnimbal.transferx.dto.model.TransferModelType;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import io.github.sachinnimbal.transferx.dto.schema.TransferType;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Destination and source-reading rules shared by both engines.
 */
public abstract class AbstractTransferEngine implements TransferEngine {

    protected static final Function<Map<String, Object>, Object> AS_MAP = values -> values;

    protected final TransferEngineContext context;

    protected AbstractTransferEngine(TransferEngineContext context) {
        this.context = context;
    }

    protected Function<Map<String, Object>, Object> domainDestination(Class<?> domainClass) {
        return context.getIntrospector().accessorFor(domainClass)::create;
    }

    protected Function<Map<String, Object>, Object> rootDestination(TransferMode mode) {
        if (mode.nestedAsDict()) {
            return AS_MAP;
        }
        return mode.data()
                ? domainDestination(context.getModelClass())
                : context.getTransferModelType()::newInstance;
    }

    protected Function<Map<String, Object>, Object> nestedDestination(TransferMode mode, Class<?> domainClass,
                                                                     TransferModelType model) {
        if (mode.nestedAsDict()) {
            return values -> new NestedBuiltins(model, values);
        }
        return mode.data() ? domainDestination(domainClass) : model::newInstance;
    }

    /**
     * Whether {@code value} is an instance of the nested union alternative {@code alternative}.
     * Untagged maps, e.g. builtins replaced through overrides, match the
     * first alternative that declares every key they carry.
     */
    protected static boolean matchesAlternative(Object value, TransferType.Simple alternative, TransferMode mode) {
        if (mode.sourceAccess() == SourceAccess.DOMAIN_OBJECT) {
            return alternative.fieldType().getRawClass().isInstance(value);
        }
        if (value instanceof TransferModel model) {
            return model.getType() == alternative.nested().model();
        }
        if (value instanceof NestedBuiltins builtins) {
            return builtins.getModelType() == alternative.nested().model();
        }
        if (value instanceof Map<?, ?> map) {
            Set<String> names = new HashSet<>();
            for (TransferFieldDefinition definition : alternative.nested().fieldDefinitions()) {
                names.add(mode.sourceName(definition));
            }
            return names.containsAll(map.keySet());
        }
        return false;
    }

    /**
     * {@code Optional} fields travel as plain nullable values: unwrapped when
     * read, wrapped again when a domain instance is the destination.
     */
    protected static TransferFunction optionalAware(TransferType.Union union, TransferMode mode,
                                                    TransferFunction inner) {
        if (!union.fieldType().isOptional()) {
            return TransferFunction.nullSafe(inner);
        }
        boolean wrap = mode.data() && !mode.nestedAsDict();
        return value -> {
            Object plain = value instanceof Optional<?> optional ? optional.orElse(null) : value;
            Object result = plain == null ? null : inner.apply(plain);
            return wrap ? Optional.ofNullable(result) : result;
        };
    }

    protected static boolean hasField(Object source, String name) {
        if (source instanceof TransferModel model) {
            return model.has(name);
        }
        if (source instanceof Map<?, ?> map) {
            return map.containsKey(name);
        }
        throw new IllegalStateException("Expected a transfer model or a map, got " + source.getClass().getName());
    }

    protected static Object getField(Object source, String name) {
        if (source instanceof TransferModel model) {
            return model.get(name);
        }
        return ((Map<?, ?>) source).get(name);
    }
}
