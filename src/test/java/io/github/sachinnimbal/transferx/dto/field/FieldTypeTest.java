package io.github.sachinnimbal.transferx.dto.field;

import io.github.sachinnimbal.transferx.fixtures.Models.Circle;
import io.github.sachinnimbal.transferx.fixtures.Models.Shape;
import io.github.sachinnimbal.transferx.fixtures.Models.Square;
import org.junit.jupiter.api.Test;
import org.springframework.core.ResolvableType;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class FieldTypeTest {

    @Test
    void optionalIsAUnionWithNone() {
        FieldType type = FieldType.forClassWithGenerics(Optional.class, String.class);

        assertThat(type.isOptional()).isTrue();
        assertThat(type.isUnion()).isTrue();
        assertThat(type.getInnerTypes()).hasSize(2);
        assertThat(type.getInnerType(0).getRawClass()).isEqualTo(String.class);
        assertThat(type.getInnerType(1).isNone()).isTrue();
    }

    @Test
    void sealedInterfaceIsAUnionOfPermittedSubclasses() {
        FieldType type = FieldType.of(Shape.class);

        assertThat(type.isSealedUnion()).isTrue();
        assertThat(type.getInnerTypes()).extracting(FieldType::getRawClass)
                .containsExactlyInAnyOrder(Circle.class, Square.class);
    }

    @Test
    void enumsAndPlatformTypesAreNotUnions() {
        assertThat(FieldType.of(Thread.State.class).isUnion()).isFalse();
        assertThat(FieldType.of(String.class).isUnion()).isFalse();
    }

    @Test
    void collectionsMappingsAndTuples() {
        FieldType list = FieldType.forClassWithGenerics(List.class, Integer.class);
        FieldType map = FieldType.forClassWithGenerics(Map.class, String.class, Integer.class);
        FieldType entry = FieldType.forClassWithGenerics(Map.Entry.class, String.class, Integer.class);

        assertThat(list.isCollection()).isTrue();
        assertThat(list.getInnerType(0).getRawClass()).isEqualTo(Integer.class);
        assertThat(list.getDisplayName()).isEqualTo("List<Integer>");

        assertThat(map.isMapping()).isTrue();
        assertThat(map.isCollection()).isFalse();
        assertThat(map.getInnerTypes()).extracting(FieldType::getRawClass)
                .containsExactly(String.class, Integer.class);

        assertThat(entry.isTuple()).isTrue();
        assertThat(entry.isMapping()).isFalse();
        assertThat(entry.getInnerTypes()).extracting(FieldType::getRawClass)
                .containsExactly(String.class, Integer.class);
    }

    @Test
    void arraysAreCollectionsExceptBytes() {
        FieldType ints = FieldType.of(int[].class);
        FieldType bytes = FieldType.of(byte[].class);

        assertThat(ints.isArray()).isTrue();
        assertThat(ints.isCollection()).isTrue();
        assertThat(ints.getInnerType(0).getRawClass()).isEqualTo(int.class);
        assertThat(ints.getDisplayName()).isEqualTo("int[]");

        assertThat(bytes.isArray()).isFalse();
        assertThat(bytes.isCollection()).isFalse();
    }

    @Test
    void missingGenericsResolveToAny() {
        FieldType raw = FieldType.of(List.class);

        assertThat(raw.getInnerType(0)).isEqualTo(FieldType.ANY);
        assertThat(raw.getInnerType(5)).isEqualTo(FieldType.ANY);
    }

    @Test
    void equalityFollowsTheResolvedType() {
        assertThat(FieldType.of(String.class)).isEqualTo(FieldType.of(ResolvableType.forClass(String.class)));
        assertThat(FieldType.of(String.class)).isNotEqualTo(FieldType.of(Integer.class));
    }
}
