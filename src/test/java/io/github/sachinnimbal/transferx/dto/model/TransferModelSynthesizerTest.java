package io.github.sachinnimbal.transferx.dto.model;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.schema.SchemaBuilder;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import io.github.sachinnimbal.transferx.fixtures.Models.Person;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static io.github.sachinnimbal.transferx.fixtures.Bindings.RECORDS;
import static org.assertj.core.api.Assertions.assertThat;

class TransferModelSynthesizerTest {

    private static final String HANDLER = "com.example.PeopleController.getPerson";

    private final TransferModelNameRegistry registry = new TransferModelNameRegistry();

    private static List<TransferFieldDefinition> personFields(DtoConfig config, DtoDirection direction) {
        TransferModelSynthesizer scratch =
                new TransferModelSynthesizer(HANDLER, direction, false, new TransferModelNameRegistry());
        return new SchemaBuilder(config, RECORDS, direction, scratch).parseModel(FieldType.of(Person.class));
    }

    @Test
    void namesFallBackFromShortToQualifiedToNumbered() {
        TransferModelSynthesizer synthesizer =
                new TransferModelSynthesizer(HANDLER, DtoDirection.RETURN, false, registry);
        List<TransferFieldDefinition> fields = personFields(DtoConfig.defaults(), DtoDirection.RETURN);

        assertThat(synthesizer.createTransferModelType("Person", fields).getName())
                .isEqualTo("GetPersonPersonResponseBody");
        assertThat(synthesizer.createTransferModelType("Person", fields).getName())
                .isEqualTo("ComExamplePeopleControllerGetPersonPersonResponseBody");
        assertThat(synthesizer.createTransferModelType("Person", fields).getName())
                .isEqualTo("ComExamplePeopleControllerGetPersonPersonResponseBody_1");
        assertThat(synthesizer.createTransferModelType("Person", fields).getName())
                .isEqualTo("ComExamplePeopleControllerGetPersonPersonResponseBody_2");
    }

    @Test
    void dataDirectionUsesRequestBodySuffixAndIgnoresHandlerQualifier() {
        TransferModelSynthesizer synthesizer =
                new TransferModelSynthesizer(HANDLER + "::post", DtoDirection.DATA, false, registry);

        TransferModelType type = synthesizer.createTransferModelType("Person",
                personFields(DtoConfig.defaults(), DtoDirection.DATA));

        assertThat(type.getName()).isEqualTo("GetPersonPersonRequestBody");
    }

    @Test
    void excludedFieldsAreLeftOut() {
        TransferModelSynthesizer synthesizer =
                new TransferModelSynthesizer(HANDLER, DtoDirection.RETURN, true, registry);

        TransferModelType type = synthesizer.createTransferModelType("Person",
                personFields(DtoConfig.builder().exclude("email").build(), DtoDirection.RETURN));

        assertThat(type.getFields()).extracting(TransferModelField::getSerializationName)
                .containsExactly("name", "age", "address");
        assertThat(type.hasField("email")).isFalse();
        assertThat(type.isForbidUnknownFields()).isTrue();
        assertThat(type.getFields()).allMatch(TransferModelField::isRequired);
    }

    @Test
    void fieldAnnotationsDescribeTheWireShape() {
        TransferModelSynthesizer synthesizer =
                new TransferModelSynthesizer(HANDLER, DtoDirection.RETURN, false, registry);

        TransferModelType type = synthesizer.createTransferModelType("Person",
                personFields(DtoConfig.defaults(), DtoDirection.RETURN));

        assertThat(type.field("age").orElseThrow().getAnnotation()).isInstanceOf(TransferAnnotation.Scalar.class);
        TransferAnnotation address = type.field("address").orElseThrow().getAnnotation();
        assertThat(address).isInstanceOf(TransferAnnotation.Model.class);
        assertThat(((TransferAnnotation.Model) address).modelType().getFields())
                .extracting(TransferModelField::getName).containsExactly("street", "city", "country");
    }

    @Test
    void partialFieldsAdmitUnset() {
        TransferModelSynthesizer synthesizer =
                new TransferModelSynthesizer(HANDLER, DtoDirection.DATA, false, registry);

        TransferModelType type = synthesizer.createTransferModelType("Person",
                personFields(DtoConfig.builder().partial(true).build(), DtoDirection.DATA));

        for (TransferModelField field : type.getFields()) {
            assertThat(field.isPartial()).isTrue();
            assertThat(field.isRequired()).isFalse();
            assertThat(field.getAnnotation()).isInstanceOfSatisfying(TransferAnnotation.Union.class,
                    union -> assertThat(union.admitsUnset()).isTrue());
        }
    }

    @Test
    void concurrentClaimsNeverShareAName() throws Exception {
        int threads = 8;
        int claimsPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> names = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < claimsPerThread; i++) {
                        names.add(registry.claim("Short", "Long"));
                    }
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

        assertThat(names).hasSize(threads * claimsPerThread).contains("Short", "Long", "Long_1");
        assertThat(registry.size()).isEqualTo(threads * claimsPerThread);
    }
}
