package io.github.sachinnimbal.transferx.dto.openapi;

import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.model.TransferAnnotation;
import io.github.sachinnimbal.transferx.dto.model.TransferModelField;
import io.github.sachinnimbal.transferx.dto.model.TransferModelType;
import io.swagger.v3.oas.models.media.*;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds OpenAPI schemas for transfer annotations. Every transfer model is
 * registered once as a component and referenced with {@code $ref}.
 */
@Slf4j
public class DtoSchemaCreator {

    public static final String COMPONENTS_PREFIX = "#/components/schemas/";

    private final Map<String, Schema<?>> components = new ConcurrentHashMap<>();

    public Schema<?> forAnnotation(TransferAnnotation annotation) {
        if (annotation instanceof TransferAnnotation.Model model) {
            return forModel(model.modelType());
        }
        if (annotation instanceof TransferAnnotation.Scalar scalar) {
            return forScalar(scalar.fieldType());
        }
        if (annotation instanceof TransferAnnotation.Collection collection) {
            ArraySchema schema = new ArraySchema();
            schema.setItems(forAnnotation(collection.element()));
            if (collection.fieldType().isSubclassOf(Set.class)) {
                schema.setUniqueItems(true);
            }
            return schema;
        }
        if (annotation instanceof TransferAnnotation.Mapping mapping) {
            MapSchema schema = new MapSchema();
            schema.setAdditionalProperties(forAnnotation(mapping.value()));
            return schema;
        }
        if (annotation instanceof TransferAnnotation.Tuple tuple) {
            ArraySchema schema = new ArraySchema();
            schema.setItems(oneOf(tuple.elements()));
            schema.setMinItems(tuple.elements().size());
            schema.setMaxItems(tuple.elements().size());
            return schema;
        }
        if (annotation instanceof TransferAnnotation.Union union) {
            if (union.admitsUnset()) {
                return forAnnotation(union.alternatives().get(0));
            }
            return oneOf(union.alternatives());
        }
        return new Schema<>();
    }

    private Schema<?> oneOf(List<TransferAnnotation> alternatives) {
        List<Schema> schemas = new ArrayList<>();
        boolean nullable = false;
        for (TransferAnnotation alternative : alternatives) {
            if (alternative instanceof TransferAnnotation.Scalar scalar && scalar.fieldType().isNone()) {
                nullable = true;
                continue;
            }
            schemas.add(forAnnotation(alternative));
        }
        if (schemas.size() == 1) {
            Schema<?> single = schemas.get(0);
            if (nullable && single.get$ref() == null) {
                single.setNullable(true);
                return single;
            }
        }
        ComposedSchema composed = new ComposedSchema();
        composed.setOneOf(schemas);
        if (nullable) {
            composed.setNullable(true);
        }
        return composed;
    }

    private Schema<?> forModel(TransferModelType type) {
        if (!components.containsKey(type.getName())) {
            ObjectSchema schema = new ObjectSchema();
            schema.setTitle(type.getName());
            components.put(type.getName(), schema);
            List<String> required = new ArrayList<>();
            for (TransferModelField field : type.getFields()) {
                schema.addProperty(field.getSerializationName(), forAnnotation(field.getAnnotation()));
                if (field.isRequired()) {
                    required.add(field.getSerializationName());
                }
            }
            if (!required.isEmpty()) {
                schema.setRequired(required);
            }
            log.debug("Registered OpenAPI component {}", type.getName());
        }
        return new Schema<>().$ref(COMPONENTS_PREFIX + type.getName());
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static Schema<?> forScalar(FieldType type) {
        Class<?> raw = type.getRawClass();
        if (type.isNone()) {
            Schema<?> schema = new Schema<>();
            schema.setNullable(true);
            return schema;
        }
        if (raw == String.class || raw == Character.class || raw == char.class) {
            return new StringSchema();
        }
        if (raw == Integer.class || raw == int.class || raw == Short.class || raw == short.class
                || raw == Byte.class || raw == byte.class) {
            return new IntegerSchema();
        }
        if (raw == Long.class || raw == long.class || raw == BigInteger.class) {
            return new IntegerSchema().format("int64");
        }
        if (raw == Double.class || raw == double.class || raw == BigDecimal.class) {
            return new NumberSchema();
        }
        if (raw == Float.class || raw == float.class) {
            return new NumberSchema().format("float");
        }
        if (raw == Boolean.class || raw == boolean.class) {
            return new BooleanSchema();
        }
        if (raw == UUID.class) {
            return new UUIDSchema();
        }
        if (raw == LocalDate.class) {
            return new DateSchema();
        }
        if (raw == LocalDateTime.class || raw == OffsetDateTime.class || raw == ZonedDateTime.class
                || raw == Instant.class) {
            return new DateTimeSchema();
        }
        if (raw == byte[].class) {
            return new ByteArraySchema();
        }
        if (raw.isEnum()) {
            StringSchema schema = new StringSchema();
            for (Object constant : raw.getEnumConstants()) {
                schema.addEnumItem(((Enum) constant).name());
            }
            return schema;
        }
        return new ObjectSchema();
    }

    public Map<String, Schema<?>> getComponents() {
        return Collections.unmodifiableMap(components);
    }
}
