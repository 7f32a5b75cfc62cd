package io.github.sachinnimbal.transferx.dto.model;

import io.github.sachinnimbal.transferx.dto.field.FieldType;

import java.util.List;

/**
 * The wire-side type of a transfer model field: what the codec reader expects
 * and what the OpenAPI schema describes.
 */
public sealed interface TransferAnnotation {

    record Model(TransferModelType modelType) implements TransferAnnotation {
    }

    /** Leaf value converted by the codec. {@link FieldType#NONE} accepts only {@code null}. */
    record Scalar(FieldType fieldType) implements TransferAnnotation {
    }

    record Collection(FieldType fieldType, TransferAnnotation element) implements TransferAnnotation {
    }

    record Mapping(FieldType fieldType, TransferAnnotation key, TransferAnnotation value) implements TransferAnnotation {
    }

    record Tuple(FieldType fieldType, List<TransferAnnotation> elements) implements TransferAnnotation {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    record Union(FieldType fieldType, List<TransferAnnotation> alternatives) implements TransferAnnotation {
        public Union {
            alternatives = List.copyOf(alternatives);
        }

        public boolean admitsUnset() {
            return alternatives.contains(UnsetValue.INSTANCE);
        }
    }

    /** The extra alternative of a partial field. */
    enum UnsetValue implements TransferAnnotation {
        INSTANCE
    }

    static Union partial(FieldType fieldType, TransferAnnotation inner) {
        return new Union(fieldType, List.of(inner, UnsetValue.INSTANCE));
    }
}
