package io.github.sachinnimbal.transferx.dto.schema;

import io.github.sachinnimbal.transferx.dto.field.FieldType;

import java.util.List;

/**
 * Structural description of a field's type as seen by the transfer engines.
 * {@code hasNested} is true when a model appears somewhere below the node, in
 * which case the engines rebuild the value instead of passing it through.
 */
public sealed interface TransferType {

    FieldType fieldType();

    boolean hasNested();

    /** Scalar leaf, or a nested model when {@code nested} is present. */
    record Simple(FieldType fieldType, NestedFieldInfo nested) implements TransferType {
        @Override
        public boolean hasNested() {
            return nested != null;
        }
    }

    record Collection(FieldType fieldType, TransferType innerType) implements TransferType {
        @Override
        public boolean hasNested() {
            return innerType.hasNested();
        }
    }

    record Mapping(FieldType fieldType, TransferType keyType, TransferType valueType) implements TransferType {
        @Override
        public boolean hasNested() {
            return keyType.hasNested() || valueType.hasNested();
        }
    }

    /** Fixed-length, position-typed sequence ({@code Map.Entry}). */
    record Tuple(FieldType fieldType, List<TransferType> innerTypes) implements TransferType {
        public Tuple {
            innerTypes = List.copyOf(innerTypes);
        }

        @Override
        public boolean hasNested() {
            return innerTypes.stream().anyMatch(TransferType::hasNested);
        }
    }

    record Union(FieldType fieldType, List<TransferType> innerTypes) implements TransferType {
        public Union {
            innerTypes = List.copyOf(innerTypes);
        }

        @Override
        public boolean hasNested() {
            return innerTypes.stream().anyMatch(TransferType::hasNested);
        }
    }
}
