package io.github.sachinnimbal.transferx.dto.model;

import lombok.Getter;

import java.util.*;

/**
 * A synthesized transfer model: the wire shape of a domain model for one
 * handler and direction. Instances are {@link TransferModel}s.
 * Compared by identity; the name is unique within its naming scope.
 */
@Getter
public final class TransferModelType {

    private final String name;
    private final List<TransferModelField> fields;
    private final boolean forbidUnknownFields;
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, TransferModelField> fieldsBySerializationName;

    public TransferModelType(String name, List<TransferModelField> fields, boolean forbidUnknownFields) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.forbidUnknownFields = forbidUnknownFields;
        Map<String, TransferModelField> byName = new LinkedHashMap<>();
        for (TransferModelField field : fields) {
            byName.put(field.getSerializationName(), field);
        }
        this.fieldsBySerializationName = Collections.unmodifiableMap(byName);
    }

    public Optional<TransferModelField> field(String serializationName) {
        return Optional.ofNullable(fieldsBySerializationName.get(serializationName));
    }

    public boolean hasField(String serializationName) {
        return fieldsBySerializationName.containsKey(serializationName);
    }

    public TransferModel newInstance(Map<String, Object> values) {
        return new TransferModel(this, values);
    }

    @Override
    public String toString() {
        return name + fieldsBySerializationName.keySet();
    }
}
