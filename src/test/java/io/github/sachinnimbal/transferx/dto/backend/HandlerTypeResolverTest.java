package io.github.sachinnimbal.transferx.dto.backend;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.DtoData;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.fixtures.Models.Box;
import io.github.sachinnimbal.transferx.fixtures.Models.Person;
import org.junit.jupiter.api.Test;
import org.springframework.core.ResolvableType;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlerTypeResolverTest {

    @Test
    void plainModel() {
        HandlerTypeResolution resolution = HandlerTypeResolver.resolve(FieldType.of(Person.class), Person.class, DtoDirection.DATA);

        assertThat(resolution.rootType().getRawClass()).isEqualTo(Person.class);
        assertThat(resolution.modelType().getRawClass()).isEqualTo(Person.class);
        assertThat(resolution.optional()).isFalse();
        assertThat(resolution.dtoData()).isFalse();
        assertThat(resolution.wrapperAttributeName()).isNull();
    }

    @Test
    void optionalAndDtoDataAreUnwrapped() {
        HandlerTypeResolution optional = HandlerTypeResolver.resolve(
                FieldType.forClassWithGenerics(Optional.class, Person.class), Person.class, DtoDirection.RETURN);
        HandlerTypeResolution dtoData = HandlerTypeResolver.resolve(
                FieldType.forClassWithGenerics(DtoData.class, Person.class), Person.class, DtoDirection.DATA);

        assertThat(optional.optional()).isTrue();
        assertThat(optional.rootType().getRawClass()).isEqualTo(Person.class);
        assertThat(dtoData.dtoData()).isTrue();
        assertThat(dtoData.rootType().getRawClass()).isEqualTo(Person.class);
    }

    @Test
    void collectionsStayAsTheRootShape() {
        FieldType people = FieldType.forClassWithGenerics(List.class, Person.class);

        HandlerTypeResolution resolution = HandlerTypeResolver.resolve(people, Person.class, DtoDirection.RETURN);

        assertThat(resolution.rootType()).isEqualTo(people);
        assertThat(resolution.modelType().getRawClass()).isEqualTo(Person.class);
    }

    @Test
    void dtoDataMustWrapASingleModel() {
        FieldType type = FieldType.of(ResolvableType.forClassWithGenerics(DtoData.class,
                ResolvableType.forClassWithGenerics(List.class, Person.class)));

        assertThatThrownBy(() -> HandlerTypeResolver.resolve(type, Person.class, DtoDirection.DATA))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("DtoData must wrap a single model");
    }

    @Test
    void genericWrapperTargetsItsModelField() {
        FieldType boxed = FieldType.forClassWithGenerics(Box.class, Person.class);

        HandlerTypeResolution resolution = HandlerTypeResolver.resolve(boxed, Person.class, DtoDirection.RETURN);

        assertThat(resolution.wrapperAttributeName()).isEqualTo("value");
        assertThat(resolution.modelType().getRawClass()).isEqualTo(Person.class);
        assertThatThrownBy(() -> HandlerTypeResolver.resolve(boxed, Person.class, DtoDirection.DATA))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("only supported for return values");
    }

    @Test
    void mismatchedHandlerTypeIsRejected() {
        assertThatThrownBy(() -> HandlerTypeResolver.resolve(FieldType.of(String.class), Person.class,
                DtoDirection.DATA))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessage("DTO narrowed with '%s', handler type is 'String'", Person.class.getName());
    }
}
