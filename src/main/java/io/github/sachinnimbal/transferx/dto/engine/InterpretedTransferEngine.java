package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.ModelAccessor;
import io.github.sachinnimbal.transferx.dto.model.Unset;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import io.github.sachinnimbal.transferx.dto.schema.TransferType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Walks the field schema on every call.
 */
public class InterpretedTransferEngine extends AbstractTransferEngine {

    public InterpretedTransferEngine(TransferEngineContext context) {
        super(context);
    }

    @Override
    public Object decode(Object transferData) {
        return transferData(transferData, context.getRootType(), TransferMode.DECODE);
    }

    @Override
    public Object decodeToBuiltins(Object transferData) {
        return transferData(transferData, context.getRootType(), TransferMode.DECODE_TO_BUILTINS);
    }

    @Override
    public Object decodeFromBuiltins(Object builtins) {
        return transferData(builtins, context.getRootType(), TransferMode.DECODE_FROM_BUILTINS);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> decodeFieldValues(Map<String, Object> builtins) {
        return (Map<String, Object>) transferInstance(builtins, context.getFieldDefinitions(),
                context.getModelClass(), TransferMode.DECODE_FROM_BUILTINS, AS_MAP);
    }

    @Override
    public Object encode(Object domainData) {
        return transferData(domainData, context.getRootType(), TransferMode.ENCODE);
    }

    private Object transferData(Object source, FieldType type, TransferMode mode) {
        if (source == null) {
            return null;
        }
        if (type.isCollection()) {
            FieldType elementType = type.getInnerType(0);
            return Containers.rebuildCollection(type, source, item -> transferData(item, elementType, mode));
        }
        return transferInstance(source, context.getFieldDefinitions(), context.getModelClass(), mode,
                rootDestination(mode));
    }

    private Object transferInstance(Object source, List<TransferFieldDefinition> definitions, Class<?> domainClass,
                                    TransferMode mode, Function<Map<String, Object>, Object> destination) {
        ModelAccessor accessor = mode.sourceAccess() == SourceAccess.DOMAIN_OBJECT
                ? context.getIntrospector().accessorFor(domainClass)
                : null;
        Map<String, Object> values = new LinkedHashMap<>();
        for (TransferFieldDefinition definition : definitions) {
            if (!mode.data() && definition.isExcluded()) {
                continue;
            }
            String sourceName = mode.sourceName(definition);
            Object value;
            if (accessor != null) {
                value = accessor.read(source, sourceName);
            } else if (hasField(source, sourceName)) {
                value = getField(source, sourceName);
            } else {
                continue;
            }
            if (mode.data() && definition.isPartial() && value == Unset.UNSET) {
                continue;
            }
            values.put(mode.destinationName(definition), transferType(value, definition.getTransferType(), mode));
        }
        return destination.apply(values);
    }

    private Object transferType(Object value, TransferType type, TransferMode mode) {
        if (type instanceof TransferType.Union union) {
            return optionalAware(union, mode, item -> transferUnion(item, union, mode)).apply(value);
        }
        if (value == null) {
            return null;
        }
        if (type instanceof TransferType.Simple simple) {
            return simple.nested() == null ? value : transferNested(value, simple, mode);
        }
        if (type instanceof TransferType.Collection collection) {
            return Containers.rebuildCollection(collection.fieldType(), value,
                    item -> transferType(item, collection.innerType(), mode));
        }
        if (type instanceof TransferType.Mapping mapping) {
            return Containers.rebuildMapping(mapping.fieldType(), value,
                    key -> transferType(key, mapping.keyType(), mode),
                    item -> transferType(item, mapping.valueType(), mode));
        }
        TransferType.Tuple tuple = (TransferType.Tuple) type;
        if (!tuple.hasNested()) {
            return value;
        }
        return Containers.rebuildTuple(value,
                key -> transferType(key, tuple.innerTypes().get(0), mode),
                item -> transferType(item, tuple.innerTypes().get(1), mode));
    }

    private Object transferUnion(Object value, TransferType.Union union, TransferMode mode) {
        if (union.hasNested()) {
            for (TransferType alternative : union.innerTypes()) {
                if (alternative instanceof TransferType.Simple simple && simple.nested() != null
                        && matchesAlternative(value, simple, mode)) {
                    return transferNested(value, simple, mode);
                }
            }
        }
        return value;
    }

    private Object transferNested(Object value, TransferType.Simple simple, TransferMode mode) {
        Class<?> domainClass = simple.fieldType().getRawClass();
        return transferInstance(value, simple.nested().fieldDefinitions(), domainClass, mode,
                nestedDestination(mode, domainClass, simple.nested().model()));
    }
}
