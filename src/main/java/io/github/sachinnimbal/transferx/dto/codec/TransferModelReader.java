package io.github.sachinnimbal.transferx.dto.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.sachinnimbal.transferx.core.exception.DtoValidationException;
import io.github.sachinnimbal.transferx.core.exception.ValidationError;
import io.github.sachinnimbal.transferx.dto.engine.Containers;
import io.github.sachinnimbal.transferx.dto.engine.TransferFunction;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.model.TransferAnnotation;
import io.github.sachinnimbal.transferx.dto.model.TransferModelField;
import io.github.sachinnimbal.transferx.dto.model.TransferModelType;
import io.github.sachinnimbal.transferx.dto.model.Unset;

import java.lang.reflect.ParameterizedType;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Reads a Jackson tree into transfer model instances, checking it against a
 * {@link TransferAnnotation}. Every problem is collected before failing, so a
 * single {@link DtoValidationException} reports all of them.
 *
 * <p>References may be {@code null}; primitives may not. Missing fields take
 * their default, become {@link Unset#UNSET} on partial models, or are reported
 * as missing.
 */
public class TransferModelReader {

    private final ObjectMapper mapper;

    public TransferModelReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Object read(JsonNode root, TransferAnnotation annotation) {
        List<ValidationError> errors = new ArrayList<>();
        Object result;
        if (root == null || root.isMissingNode() || root.isNull()) {
            errors.add(new ValidationError("$", "Expected `" + expected(annotation) + "`, got `null`"));
            result = null;
        } else {
            result = read(root, annotation, "$", errors);
        }
        if (!errors.isEmpty()) {
            throw new DtoValidationException(errors);
        }
        return result;
    }

    private Object read(JsonNode node, TransferAnnotation annotation, String path, List<ValidationError> errors) {
        if (annotation instanceof TransferAnnotation.Scalar scalar) {
            return readScalar(node, scalar.fieldType(), path, errors);
        }
        if (node.isNull()) {
            return null;
        }
        if (annotation instanceof TransferAnnotation.Model model) {
            return readModel(node, model.modelType(), path, errors);
        }
        if (annotation instanceof TransferAnnotation.Collection collection) {
            if (!node.isArray()) {
                errors.add(mismatch(path, "array", node));
                return null;
            }
            List<Object> items = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                items.add(read(node.get(i), collection.element(), path + "[" + i + "]", errors));
            }
            return Containers.rebuildCollection(collection.fieldType(), items, TransferFunction.IDENTITY);
        }
        if (annotation instanceof TransferAnnotation.Mapping mapping) {
            return readMapping(node, mapping, path, errors);
        }
        if (annotation instanceof TransferAnnotation.Tuple tuple) {
            if (!node.isArray() || node.size() != tuple.elements().size()) {
                errors.add(new ValidationError(path, "Expected `array` of length " + tuple.elements().size()
                        + ", got `" + kind(node) + "`" + (node.isArray() ? " of length " + node.size() : "")));
                return null;
            }
            return Containers.entry(
                    read(node.get(0), tuple.elements().get(0), path + "[0]", errors),
                    read(node.get(1), tuple.elements().get(1), path + "[1]", errors));
        }
        if (annotation instanceof TransferAnnotation.Union union) {
            return readUnion(node, union, path, errors);
        }
        throw new IllegalStateException("Unexpected annotation " + annotation);
    }

    private Object readModel(JsonNode node, TransferModelType type, String path, List<ValidationError> errors) {
        if (!node.isObject()) {
            errors.add(mismatch(path, "object", node));
            return null;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (TransferModelField field : type.getFields()) {
            String name = field.getSerializationName();
            JsonNode child = node.get(name);
            if (child == null) {
                if (field.isPartial()) {
                    values.put(name, Unset.UNSET);
                } else if (field.isRequired()) {
                    errors.add(new ValidationError(path, "Object missing required field `" + name + "`"));
                } else {
                    values.put(name, field.resolveDefault());
                }
                continue;
            }
            values.put(name, read(child, field.getAnnotation(), path + "." + name, errors));
        }
        if (type.isForbidUnknownFields()) {
            node.fieldNames().forEachRemaining(name -> {
                if (!type.hasField(name)) {
                    errors.add(new ValidationError(path, "Object contains unknown field `" + name + "`"));
                }
            });
        }
        return type.newInstance(values);
    }

    private Object readMapping(JsonNode node, TransferAnnotation.Mapping mapping, String path,
                               List<ValidationError> errors) {
        if (!node.isObject()) {
            errors.add(mismatch(path, "object", node));
            return null;
        }
        Map<Object, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String entryPath = path + "." + entry.getKey();
            Object key = read(TextNode.valueOf(entry.getKey()), mapping.key(), entryPath, errors);
            values.put(key, read(entry.getValue(), mapping.value(), entryPath, errors));
        }
        return Containers.rebuildMapping(mapping.fieldType(), values, TransferFunction.IDENTITY,
                TransferFunction.IDENTITY);
    }

    private Object readUnion(JsonNode node, TransferAnnotation.Union union, String path,
                             List<ValidationError> errors) {
        if (union.admitsUnset()) {
            return read(node, union.alternatives().get(0), path, errors);
        }
        for (TransferAnnotation alternative : union.alternatives()) {
            if (isNone(alternative)) {
                continue;
            }
            List<ValidationError> attempt = new ArrayList<>();
            Object value = read(node, alternative, path, attempt);
            if (attempt.isEmpty()) {
                return value;
            }
        }
        errors.add(new ValidationError(path, "Expected `" + expected(union) + "`, got `" + kind(node) + "`"));
        return null;
    }

    private Object readScalar(JsonNode node, FieldType type, String path, List<ValidationError> errors) {
        if (node.isNull()) {
            if (type.isPrimitive()) {
                errors.add(mismatch(path, type.getDisplayName(), node));
            }
            return null;
        }
        if (type.isNone()) {
            errors.add(mismatch(path, "null", node));
            return null;
        }
        try {
            return mapper.convertValue(node, javaType(type));
        } catch (IllegalArgumentException e) {
            errors.add(mismatch(path, type.getDisplayName(), node));
            return null;
        }
    }

    private JavaType javaType(FieldType type) {
        if (type.getResolvableType().getType() instanceof ParameterizedType parameterized) {
            return mapper.getTypeFactory().constructType(parameterized);
        }
        return mapper.getTypeFactory().constructType(type.getRawClass());
    }

    private static boolean isNone(TransferAnnotation annotation) {
        return annotation instanceof TransferAnnotation.Scalar scalar && scalar.fieldType().isNone();
    }

    private static ValidationError mismatch(String path, String expected, JsonNode node) {
        return new ValidationError(path, "Expected `" + expected + "`, got `" + kind(node) + "`");
    }

    private static String kind(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    static String expected(TransferAnnotation annotation) {
        if (annotation instanceof TransferAnnotation.Model model) {
            return "object";
        }
        if (annotation instanceof TransferAnnotation.Scalar scalar) {
            return scalar.fieldType().isNone() ? "null" : scalar.fieldType().getDisplayName();
        }
        if (annotation instanceof TransferAnnotation.Collection || annotation instanceof TransferAnnotation.Tuple) {
            return "array";
        }
        if (annotation instanceof TransferAnnotation.Mapping) {
            return "object";
        }
        if (annotation instanceof TransferAnnotation.Union union) {
            return union.alternatives().stream()
                    .filter(alternative -> alternative != TransferAnnotation.UnsetValue.INSTANCE)
                    .map(TransferModelReader::expected)
                    .distinct()
                    .collect(Collectors.joining(" | "));
        }
        return "unset";
    }
}
