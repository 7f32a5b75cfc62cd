package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.model.Unset;
import io.github.sachinnimbal.transferx.dto.schema.NestedFieldInfo;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import io.github.sachinnimbal.transferx.dto.schema.TransferType;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Compiles the field schema once per operation into a tree of
 * {@link TransferFunction}s: field readers bound to MethodHandles, value
 * converters specialised per type node, destinations fixed up front.
 * Compiled trees are cached and reused by every later call.
 */
@Slf4j
public class CompiledTransferEngine extends AbstractTransferEngine {

    private enum Operation { DECODE, DECODE_TO_BUILTINS, DECODE_FROM_BUILTINS, DECODE_FIELD_VALUES, ENCODE }

    private final Map<Operation, TransferFunction> compiled = new ConcurrentHashMap<>();

    /**
     * Compiles the operations a request of this binding runs. The functions
     * behind {@code DtoData} instance creation are compiled on first use.
     */
    public CompiledTransferEngine(TransferEngineContext context) {
        super(context);
        for (Operation operation : requestOperations(context)) {
            compiled.put(operation, compile(operation));
        }
    }

    private static Set<Operation> requestOperations(TransferEngineContext context) {
        DtoDirection direction = context.getDirection();
        Set<Operation> operations = EnumSet.noneOf(Operation.class);
        if (direction != DtoDirection.RETURN) {
            if (direction == null || !context.isDtoData()) {
                operations.add(Operation.DECODE);
            }
            if (direction == null || context.isDtoData()) {
                operations.add(Operation.DECODE_TO_BUILTINS);
            }
        }
        if (direction != DtoDirection.DATA) {
            operations.add(Operation.ENCODE);
        }
        return operations;
    }

    @Override
    public Object decode(Object transferData) {
        return function(Operation.DECODE).apply(transferData);
    }

    @Override
    public Object decodeToBuiltins(Object transferData) {
        return function(Operation.DECODE_TO_BUILTINS).apply(transferData);
    }

    @Override
    public Object decodeFromBuiltins(Object builtins) {
        return function(Operation.DECODE_FROM_BUILTINS).apply(builtins);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> decodeFieldValues(Map<String, Object> builtins) {
        return (Map<String, Object>) function(Operation.DECODE_FIELD_VALUES).apply(builtins);
    }

    @Override
    public Object encode(Object domainData) {
        return function(Operation.ENCODE).apply(domainData);
    }

    private TransferFunction function(Operation operation) {
        TransferFunction fn = compiled.get(operation);
        if (fn == null) {
            fn = compiled.computeIfAbsent(operation, this::compile);
        }
        return fn;
    }

    private TransferFunction compile(Operation operation) {
        long start = System.nanoTime();
        TransferFunction fn = switch (operation) {
            case DECODE -> new Compiler(TransferMode.DECODE).compileRoot(context.getRootType());
            case DECODE_TO_BUILTINS -> new Compiler(TransferMode.DECODE_TO_BUILTINS).compileRoot(context.getRootType());
            case DECODE_FROM_BUILTINS -> new Compiler(TransferMode.DECODE_FROM_BUILTINS).compileRoot(context.getRootType());
            case DECODE_FIELD_VALUES -> new Compiler(TransferMode.DECODE_FROM_BUILTINS)
                    .compileInstance(context.getFieldDefinitions(), context.getModelClass(), AS_MAP);
            case ENCODE -> new Compiler(TransferMode.ENCODE).compileRoot(context.getRootType());
        };
        log.debug("Compiled {} transfer for {} in {}us", operation, context.getTransferModelType().getName(),
                (System.nanoTime() - start) / 1_000);
        return fn;
    }

    /**
     * Single-use compiler for one transfer mode. Not thread-safe; each call to
     * {@link #compile} owns its instance.
     */
    private final class Compiler {

        private final TransferMode mode;
        private final Map<NestedFieldInfo, TransferFunction> nestedCache = new IdentityHashMap<>();

        Compiler(TransferMode mode) {
            this.mode = mode;
        }

        TransferFunction compileRoot(FieldType type) {
            if (type.isCollection()) {
                TransferFunction element = compileRoot(type.getInnerType(0));
                return TransferFunction.nullSafe(value -> Containers.rebuildCollection(type, value, element));
            }
            return compileInstance(context.getFieldDefinitions(), context.getModelClass(), rootDestination(mode));
        }

        TransferFunction compileInstance(List<TransferFieldDefinition> definitions, Class<?> domainClass,
                                         Function<Map<String, Object>, Object> destination) {
            List<FieldStep> steps = new ArrayList<>(definitions.size());
            for (TransferFieldDefinition definition : definitions) {
                if (!mode.data() && definition.isExcluded()) {
                    continue;
                }
                steps.add(new FieldStep(
                        reader(domainClass, mode.sourceName(definition)),
                        compileType(definition.getTransferType()),
                        mode.destinationName(definition),
                        mode.data() && definition.isPartial()));
            }
            FieldStep[] plan = steps.toArray(new FieldStep[0]);
            int capacity = Math.max(16, plan.length * 2);
            return TransferFunction.nullSafe(source -> {
                Map<String, Object> values = new LinkedHashMap<>(capacity);
                for (FieldStep step : plan) {
                    step.transfer(source, values);
                }
                return destination.apply(values);
            });
        }

        private FieldReader reader(Class<?> domainClass, String name) {
            if (mode.sourceAccess() == SourceAccess.DOMAIN_OBJECT) {
                Function<Object, Object> getter = context.getIntrospector().accessorFor(domainClass).getter(name);
                return new FieldReader() {
                    @Override
                    public boolean has(Object source) {
                        return true;
                    }

                    @Override
                    public Object read(Object source) {
                        return getter.apply(source);
                    }
                };
            }
            return new FieldReader() {
                @Override
                public boolean has(Object source) {
                    return hasField(source, name);
                }

                @Override
                public Object read(Object source) {
                    return getField(source, name);
                }
            };
        }

        private TransferFunction compileType(TransferType type) {
            if (type instanceof TransferType.Simple simple) {
                return simple.nested() == null ? TransferFunction.IDENTITY : compileNested(simple);
            }
            if (type instanceof TransferType.Union union) {
                TransferFunction alternatives = union.hasNested() ? compileUnion(union) : TransferFunction.IDENTITY;
                return union.fieldType().isOptional() ? optionalAware(union, mode, alternatives) : alternatives;
            }
            if (type instanceof TransferType.Collection collection) {
                TransferFunction element = compileType(collection.innerType());
                FieldType fieldType = collection.fieldType();
                return TransferFunction.nullSafe(value -> Containers.rebuildCollection(fieldType, value, element));
            }
            if (type instanceof TransferType.Mapping mapping) {
                TransferFunction key = compileType(mapping.keyType());
                TransferFunction item = compileType(mapping.valueType());
                FieldType fieldType = mapping.fieldType();
                return TransferFunction.nullSafe(value -> Containers.rebuildMapping(fieldType, value, key, item));
            }
            TransferType.Tuple tuple = (TransferType.Tuple) type;
            if (!tuple.hasNested()) {
                return TransferFunction.IDENTITY;
            }
            TransferFunction key = compileType(tuple.innerTypes().get(0));
            TransferFunction item = compileType(tuple.innerTypes().get(1));
            return TransferFunction.nullSafe(value -> Containers.rebuildTuple(value, key, item));
        }

        private TransferFunction compileNested(TransferType.Simple simple) {
            NestedFieldInfo info = simple.nested();
            TransferFunction fn = nestedCache.get(info);
            if (fn == null) {
                Class<?> domainClass = simple.fieldType().getRawClass();
                fn = compileInstance(info.fieldDefinitions(), domainClass,
                        nestedDestination(mode, domainClass, info.model()));
                nestedCache.put(info, fn);
            }
            return fn;
        }

        private TransferFunction compileUnion(TransferType.Union union) {
            List<TransferType.Simple> alternatives = new ArrayList<>();
            List<TransferFunction> functions = new ArrayList<>();
            for (TransferType inner : union.innerTypes()) {
                if (inner instanceof TransferType.Simple simple && simple.nested() != null) {
                    alternatives.add(simple);
                    functions.add(compileNested(simple));
                }
            }
            TransferType.Simple[] candidates = alternatives.toArray(new TransferType.Simple[0]);
            TransferFunction[] transfers = functions.toArray(new TransferFunction[0]);
            return TransferFunction.nullSafe(value -> {
                for (int i = 0; i < candidates.length; i++) {
                    if (matchesAlternative(value, candidates[i], mode)) {
                        return transfers[i].apply(value);
                    }
                }
                return value;
            });
        }
    }

    private interface FieldReader {
        boolean has(Object source);

        Object read(Object source);
    }

    private record FieldStep(FieldReader reader, TransferFunction valueFn, String destinationName, boolean skipUnset) {

        void transfer(Object source, Map<String, Object> values) {
            if (!reader.has(source)) {
                return;
            }
            Object value = reader.read(source);
            if (skipUnset && value == Unset.UNSET) {
                return;
            }
            values.put(destinationName, valueFn.apply(value));
        }
    }
}
