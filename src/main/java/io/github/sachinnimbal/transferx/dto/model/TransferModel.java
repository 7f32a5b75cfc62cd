package io.github.sachinnimbal.transferx.dto.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * An instance of a {@link TransferModelType}. Values are keyed by
 * serialization name, in field order; partial fields absent from the payload
 * hold {@link Unset#UNSET}.
 */
@JsonSerialize(using = TransferModelSerializer.class)
public final class TransferModel {

    private final TransferModelType type;
    private final Map<String, Object> values;

    TransferModel(TransferModelType type, Map<String, Object> values) {
        this.type = type;
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (TransferModelField field : type.getFields()) {
            String key = field.getSerializationName();
            if (values.containsKey(key)) {
                ordered.put(key, values.get(key));
            }
        }
        for (String key : values.keySet()) {
            if (!type.hasField(key)) {
                throw new IllegalArgumentException("Transfer model " + type.getName() + " has no field '" + key + "'");
            }
        }
        this.values = Collections.unmodifiableMap(ordered);
    }

    public TransferModelType getType() {
        return type;
    }

    public boolean has(String serializationName) {
        return values.containsKey(serializationName);
    }

    public Object get(String serializationName) {
        return values.get(serializationName);
    }

    public Map<String, Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferModel other)) return false;
        return type == other.type && valuesEqual(values, other.values);
    }

    private static boolean valuesEqual(Map<String, Object> a, Map<String, Object> b) {
        if (!a.keySet().equals(b.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : a.entrySet()) {
            if (!Objects.deepEquals(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(type), values.keySet());
    }

    @Override
    public String toString() {
        return type.getName() + values;
    }
}
