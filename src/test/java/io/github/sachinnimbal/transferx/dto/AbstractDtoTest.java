package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.core.exception.DtoValidationException;
import io.github.sachinnimbal.transferx.core.exception.ValidationError;
import io.github.sachinnimbal.transferx.dto.backend.DtoBackend;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.engine.CompiledTransferEngine;
import io.github.sachinnimbal.transferx.dto.engine.InterpretedTransferEngine;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.model.TransferModel;
import io.github.sachinnimbal.transferx.dto.openapi.DtoSchemaCreator;
import io.github.sachinnimbal.transferx.fixtures.Models.*;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;

import static io.github.sachinnimbal.transferx.fixtures.Models.peter;
import static org.assertj.core.api.Assertions.*;

class AbstractDtoTest {

    private static final String PREFIX = "tests.AbstractDtoController.";

    static class PersonReadDto extends RecordDto<Person> {
        PersonReadDto() {
            super(DtoConfig.builder().exclude("email").build());
        }
    }

    static class SignupDto extends RecordDto<Signup> {
    }

    static class UnboundDto<T> extends RecordDto<T> {
    }

    private static HandlerContext context(String method, DtoDirection direction, FieldType type) {
        return HandlerContext.builder().handlerId(PREFIX + method).direction(direction).fieldType(type).build();
    }

    private static HandlerContext returning(String method) {
        return context(method, DtoDirection.RETURN, FieldType.of(Person.class));
    }

    @Test
    void modelTypeComesFromTheTypeArgument() {
        PersonReadDto dto = new PersonReadDto();

        assertThat(dto.getModelType().getRawClass()).isEqualTo(Person.class);
        assertThat(dto.getConfig().getExclude()).containsExactly("email");
    }

    @Test
    void unresolvableTypeArgumentIsRejected() {
        assertThatThrownBy(UnboundDto::new)
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("Cannot resolve the model type of");
    }

    @Test
    void unionsAndNonModelsAreRejected() {
        assertThatThrownBy(() -> RecordDto.of(Shape.class, DtoConfig.defaults()))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("Unions are currently not supported as type argument to DTO");
        assertThatThrownBy(() -> RecordDto.of(String.class, DtoConfig.defaults()))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("is not a model type supported by RecordDto");
        assertThatThrownBy(() -> BeanDto.of(Person.class, DtoConfig.defaults()))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("is not a model type supported by BeanDto");
    }

    @Test
    void bindingsAreCachedPerHandlerAndSharedPerType() {
        PersonReadDto dto = new PersonReadDto();

        DtoBackend first = dto.onRegistration(returning("getOne"));
        DtoBackend again = dto.onRegistration(returning("getOne"));
        DtoBackend otherHandler = dto.onRegistration(returning("getOther"));

        assertThat(again).isSameAs(first);
        assertThat(otherHandler).isSameAs(first);
        assertThat(dto.getBindingCount()).isEqualTo(1);
        assertThat(dto.getBinding(DtoDirection.RETURN, PREFIX + "getOther")).containsSame(first);
        assertThat(dto.getBinding(DtoDirection.DATA, PREFIX + "getOne")).isEmpty();

        DtoBackend data = dto.onRegistration(context("getOne", DtoDirection.DATA, FieldType.of(Person.class)));
        DtoBackend list = dto.onRegistration(context("list", DtoDirection.RETURN,
                FieldType.forClassWithGenerics(List.class, Person.class)));

        assertThat(data).isNotSameAs(first);
        assertThat(list).isNotSameAs(first);
        assertThat(dto.getBindingCount()).isEqualTo(3);

        dto.clearBindings();
        assertThat(dto.getBindingCount()).isZero();
        assertThat(dto.getBinding(DtoDirection.RETURN, PREFIX + "getOne")).isEmpty();
    }

    @Test
    @DisplayName("Concurrent registration of one handler builds a single binding")
    void concurrentRegistration() throws Exception {
        PersonReadDto dto = new PersonReadDto();
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<DtoBackend> backends = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    backends.add(dto.onRegistration(returning("concurrent")));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(backends).hasSize(1);
        assertThat(dto.getBindingCount()).isEqualTo(1);
    }

    @Test
    void mismatchedHandlerTypeFailsRegistration() {
        PersonReadDto dto = new PersonReadDto();

        assertThatThrownBy(() -> dto.onRegistration(context("wrong", DtoDirection.DATA, FieldType.of(Address.class))))
                .isInstanceOf(DtoConfigurationException.class)
                .hasMessageContaining("DTO narrowed with");
        assertThat(dto.getBindingCount()).isZero();
    }

    @Test
    void unregisteredHandlersCannotTransfer() {
        PersonReadDto dto = new PersonReadDto();

        assertThatThrownBy(() -> dto.decodeBytes(PREFIX + "nowhere", new byte[]{'{', '}'}, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not registered");
        assertThatThrownBy(() -> dto.encode(PREFIX + "nowhere", peter()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void backendModeFollowsConfigThenDefault() {
        PersonReadDto compiled = new PersonReadDto();
        PersonReadDto interpreted = new PersonReadDto();
        interpreted.setDefaultBackendMode(TransferBackendMode.INTERPRETED);
        RecordDto<Person> pinned = RecordDto.of(Person.class,
                DtoConfig.builder().backendMode(TransferBackendMode.INTERPRETED).build());
        pinned.setDefaultBackendMode(TransferBackendMode.CODEGEN);

        assertThat(compiled.onRegistration(returning("mode")).getEngine()).isInstanceOf(CompiledTransferEngine.class);
        assertThat(interpreted.onRegistration(returning("mode")).getEngine())
                .isInstanceOf(InterpretedTransferEngine.class);
        assertThat(pinned.onRegistration(returning("mode")).getEngine())
                .isInstanceOf(InterpretedTransferEngine.class);
    }

    @Test
    void encodeAndDecodeThroughRegisteredHandlers() {
        PersonReadDto dto = new PersonReadDto();
        dto.onRegistration(returning("show"));
        dto.onRegistration(context("store", DtoDirection.DATA, FieldType.of(Person.class)));

        TransferModel encoded = (TransferModel) dto.encode(PREFIX + "show", peter());
        String json = new String(dto.encodeToBytes(PREFIX + "show", peter(), "application/json"),
                StandardCharsets.UTF_8);
        Object decoded = dto.decodeBytes(PREFIX + "store", """
                {"name": "peter", "age": 30, "email": "ignored@example.com",
                 "address": {"street": "Main St", "city": "London", "country": "UK"}}
                """.getBytes(StandardCharsets.UTF_8), "application/json; charset=UTF-8");

        assertThat(encoded.has("email")).isFalse();
        assertThat(json).doesNotContain("email").contains("\"city\":\"London\"");
        assertThat(decoded).isEqualTo(new Person("peter", 30, null,
                new Address("Main St", "London", "UK")));
    }

    @Test
    void optionalHandlerTypesAreWrappedAndUnwrapped() {
        PersonReadDto dto = new PersonReadDto();
        FieldType optionalPerson = FieldType.forClassWithGenerics(Optional.class, Person.class);
        dto.onRegistration(context("maybeShow", DtoDirection.RETURN, optionalPerson));
        dto.onRegistration(context("maybeStore", DtoDirection.DATA, optionalPerson));

        Object encoded = dto.encode(PREFIX + "maybeShow", Optional.of(peter()));
        Object decoded = dto.decodeBytes(PREFIX + "maybeStore", """
                {"name": "peter", "age": 30,
                 "address": {"street": "Main St", "city": "London", "country": "UK"}}
                """.getBytes(StandardCharsets.UTF_8), "application/json");

        assertThat(encoded).isInstanceOfSatisfying(TransferModel.class,
                model -> assertThat(model.get("name")).isEqualTo("peter"));
        assertThat(dto.encode(PREFIX + "maybeShow", Optional.empty())).isNull();
        assertThat(decoded).isEqualTo(Optional.of(new Person("peter", 30, null,
                new Address("Main St", "London", "UK"))));
    }

    @Test
    void decodedInstancesAreValidated() {
        SignupDto dto = new SignupDto();
        dto.onRegistration(HandlerContext.builder().handlerId(PREFIX + "signup").direction(DtoDirection.DATA)
                .fieldType(FieldType.of(Signup.class)).build());

        DtoValidationException e = catchThrowableOfType(() -> dto.decodeBuiltins(PREFIX + "signup",
                Map.of("username", "", "email", "not-an-email")), DtoValidationException.class);

        assertThat(e.getErrors()).extracting(ValidationError::getPath)
                .containsExactlyInAnyOrder("$.username", "$.email");
        assertThat(dto.decodeBuiltins(PREFIX + "signup", Map.of("username", "ada", "email", "a@b.io")))
                .isEqualTo(new Signup("ada", "a@b.io"));
    }

    @Test
    void openApiSchemaReferencesTheTransferModel() {
        PersonReadDto dto = new PersonReadDto();
        dto.onRegistration(returning("schema"));
        DtoSchemaCreator creator = new DtoSchemaCreator();

        Schema<?> schema = dto.createOpenApiSchema(DtoDirection.RETURN, PREFIX + "schema", creator);

        String name = dto.getBinding(DtoDirection.RETURN, PREFIX + "schema").orElseThrow()
                .getTransferModelType().getName();
        assertThat(schema.get$ref()).isEqualTo(DtoSchemaCreator.COMPONENTS_PREFIX + name);
        assertThat(creator.getComponents().get(name).getProperties()).containsOnlyKeys("name", "age", "address");
    }
}
