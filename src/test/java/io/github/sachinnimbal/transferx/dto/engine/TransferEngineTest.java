package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.RenameStrategy;
import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.dto.backend.DtoBackend;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.BeanFieldIntrospector;
import io.github.sachinnimbal.transferx.dto.introspect.RecordFieldIntrospector;
import io.github.sachinnimbal.transferx.dto.model.TransferModel;
import io.github.sachinnimbal.transferx.dto.model.Unset;
import io.github.sachinnimbal.transferx.fixtures.Bindings;
import io.github.sachinnimbal.transferx.fixtures.Models.*;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.*;

import static io.github.sachinnimbal.transferx.fixtures.Models.peter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class TransferEngineTest {

    private static TransferEngine engine(Class<?> model, DtoConfig config, DtoDirection direction,
                                         TransferBackendMode mode) {
        return Bindings.record(model, config, direction, mode).getEngine();
    }

    private static Team team() {
        Person ada = new Person("ada", 36, "ada@example.com", new Address("Baker St", "London", "UK"));
        return new Team("analytics",
                List.of(peter(), ada),
                new LinkedHashSet<>(List.of("math", "engines")),
                Map.of("paris", new Address("Rue A", "Paris", "FR")),
                Map.entry("hq", new Address("High St", "Oxford", "UK")));
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void encodeSkipsExcludedFields(TransferBackendMode mode) {
        TransferEngine engine = engine(Person.class,
                DtoConfig.builder().exclude("email").exclude("address.street").build(), DtoDirection.RETURN, mode);

        TransferModel encoded = (TransferModel) engine.encode(peter());

        assertThat(encoded.getValues()).containsOnlyKeys("name", "age", "address");
        assertThat(encoded.get("age")).isEqualTo(30);
        TransferModel address = (TransferModel) encoded.get("address");
        assertThat(address.getValues()).containsExactly(Map.entry("city", "London"), Map.entry("country", "UK"));
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void nestedContainersRoundTrip(TransferBackendMode mode) {
        TransferEngine engine = engine(Team.class, DtoConfig.builder().maxNestedDepth(2).build(),
                DtoDirection.RETURN, mode);

        Object encoded = engine.encode(team());

        assertThat(((TransferModel) encoded).get("members"))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .allMatch(TransferModel.class::isInstance);
        assertThat(engine.decode(encoded)).isEqualTo(team());
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void unionAlternativesAndOptionalsRoundTrip(TransferBackendMode mode) {
        TransferEngine engine = engine(Drawing.class, DtoConfig.defaults(), DtoDirection.RETURN, mode);
        Drawing circle = new Drawing("sun", new Circle(2.0), Optional.of(new Address("Main St", "London", "UK")));
        Drawing square = new Drawing("box", new Square(1.5), Optional.empty());

        TransferModel encodedCircle = (TransferModel) engine.encode(circle);
        TransferModel encodedSquare = (TransferModel) engine.encode(square);

        assertThat(((TransferModel) encodedCircle.get("shape")).getType().getName()).contains("Shape_0");
        assertThat(((TransferModel) encodedSquare.get("shape")).getType().getName()).contains("Shape_1");
        assertThat(encodedCircle.get("location")).isInstanceOf(TransferModel.class);
        assertThat(encodedSquare.get("location")).isNull();
        assertThat(engine.decode(encodedCircle)).isEqualTo(circle);
        assertThat(engine.decode(encodedSquare)).isEqualTo(square);
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void renamedFieldsUseWireNamesOnlyOnTheWire(TransferBackendMode mode) {
        TransferEngine engine = engine(Profile.class, DtoConfig.builder().renameStrategy(RenameStrategy.CAMEL).build(),
                DtoDirection.DATA, mode);

        TransferModel encoded = (TransferModel) engine.encode(new Profile("Ada", "Lovelace"));

        assertThat(encoded.getValues()).containsOnlyKeys("firstName", "lastName");
        assertThat(engine.decodeToBuiltins(encoded))
                .isEqualTo(Map.of("first_name", "Ada", "last_name", "Lovelace"));
        assertThat(engine.decodeFromBuiltins(Map.of("first_name", "Ada", "last_name", "Lovelace")))
                .isEqualTo(new Profile("Ada", "Lovelace"));
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void unsetPartialFieldsAreDropped(TransferBackendMode mode) {
        DtoBackend backend = Bindings.record(Person.class, DtoConfig.builder().partial(true).build(),
                DtoDirection.DATA, mode);
        Map<String, Object> values = new HashMap<>();
        values.put("name", "peter");
        values.put("age", Unset.UNSET);
        values.put("email", null);
        values.put("address", Unset.UNSET);
        TransferModel payload = backend.getTransferModelType().newInstance(values);

        Map<String, Object> expected = new HashMap<>();
        expected.put("name", "peter");
        expected.put("email", null);
        assertThat(backend.getEngine().decodeToBuiltins(payload)).isEqualTo(expected);
        assertThat(backend.getEngine().decodeFieldValues(Map.of("age", 31))).isEqualTo(Map.of("age", 31));
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void arraysKeepTheirComponentType(TransferBackendMode mode) {
        TransferEngine engine = engine(Palette.class, DtoConfig.defaults(), DtoDirection.RETURN, mode);
        UUID id = UUID.randomUUID();

        TransferModel encoded = (TransferModel) engine.encode(
                new Palette(id, Color.GREEN, Optional.of("warm"), new int[]{3, 5}));
        Palette decoded = (Palette) engine.decode(encoded);

        assertThat(encoded.get("weights")).isEqualTo(new int[]{3, 5});
        assertThat(encoded.get("note")).isEqualTo("warm");
        assertThat(decoded.id()).isEqualTo(id);
        assertThat(decoded.primary()).isEqualTo(Color.GREEN);
        assertThat(decoded.note()).contains("warm");
        assertThat(decoded.weights()).containsExactly(3, 5);
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void rootCollectionsAreRebuilt(TransferBackendMode mode) {
        DtoBackend backend = Bindings.backend(FieldType.forClassWithGenerics(List.class, Person.class), Person.class,
                DtoConfig.builder().exclude("email").build(), DtoDirection.RETURN, mode, Bindings.RECORDS);

        Object encoded = backend.getEngine().encode(List.of(peter(), peter()));

        assertThat(encoded).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(2)
                .allSatisfy(item -> assertThat(((TransferModel) item).has("email")).isFalse());
    }

    @Test
    @DisplayName("Interpreted and compiled engines produce equal output")
    void enginesAreEquivalent() {
        DtoBackend backend = Bindings.record(Team.class, DtoConfig.builder().maxNestedDepth(2).exclude("name").build(),
                DtoDirection.RETURN, TransferBackendMode.INTERPRETED);
        TransferEngine interpreted = new InterpretedTransferEngine(Bindings.engineContext(backend));
        TransferEngine compiled = new CompiledTransferEngine(Bindings.engineContext(backend));

        Object fromInterpreted = interpreted.encode(team());
        Object fromCompiled = compiled.encode(team());

        assertThat(fromCompiled).isEqualTo(fromInterpreted);
        assertThat(compiled.decodeToBuiltins(fromCompiled)).isEqualTo(interpreted.decodeToBuiltins(fromInterpreted));
        assertThat(compiled.decode(fromCompiled)).isEqualTo(interpreted.decode(fromInterpreted));
    }

    @ParameterizedTest
    @EnumSource(TransferBackendMode.class)
    void excludedFieldsAreNeverRead(TransferBackendMode mode) {
        DtoBackend backend = Bindings.backend(FieldType.of(Customer.class), Customer.class,
                DtoConfig.builder().exclude("email").build(), DtoDirection.RETURN, mode, new BeanFieldIntrospector());
        Customer customer = spy(new Customer("peter", "peter@example.com"));

        TransferModel encoded = (TransferModel) backend.getEngine().encode(customer);

        assertThat(encoded.getValues()).containsOnlyKeys("name");
        verify(customer).getName();
        verify(customer, never()).getEmail();
    }

    @Test
    void compiledEngineBuildsItsFunctionsUpFront() {
        DtoBackend backend = Bindings.record(Person.class, DtoConfig.builder().build(),
                DtoDirection.RETURN, TransferBackendMode.INTERPRETED);
        RecordFieldIntrospector introspector = spy(new RecordFieldIntrospector());
        TransferEngineContext context = TransferEngineContext.builder()
                .fieldDefinitions(backend.getParsedFieldDefinitions())
                .rootType(backend.getContext().getResolution().rootType())
                .modelClass(Person.class)
                .transferModelType(backend.getTransferModelType())
                .introspector(introspector)
                .direction(DtoDirection.RETURN)
                .build();

        new InterpretedTransferEngine(context);
        verifyNoInteractions(introspector);

        TransferEngine compiled = new CompiledTransferEngine(context);
        verify(introspector, atLeastOnce()).accessorFor(Person.class);

        clearInvocations(introspector);
        TransferModel encoded = (TransferModel) compiled.encode(peter());
        assertThat(encoded.get("name")).isEqualTo("peter");
        verifyNoInteractions(introspector);
    }
}
