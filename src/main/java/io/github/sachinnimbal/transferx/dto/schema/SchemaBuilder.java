package io.github.sachinnimbal.transferx.dto.schema;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.Mark;
import io.github.sachinnimbal.transferx.core.enums.RenameStrategy;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.FieldIntrospector;
import io.github.sachinnimbal.transferx.dto.model.TransferModelSynthesizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a domain model type into the field schema of one DTO binding:
 * applies exclude/include paths, marks, renames and the nesting depth
 * limit, and synthesizes a transfer model for every nested model reached.
 */
@Slf4j
public class SchemaBuilder {

    private final DtoConfig config;
    private final FieldIntrospector introspector;
    private final DtoDirection direction;
    private final TransferModelSynthesizer synthesizer;

    public SchemaBuilder(DtoConfig config, FieldIntrospector introspector, DtoDirection direction,
                         TransferModelSynthesizer synthesizer) {
        this.config = config;
        this.introspector = introspector;
        this.direction = direction;
        this.synthesizer = synthesizer;
    }

    public List<TransferFieldDefinition> parseModel(FieldType modelType) {
        return parseModel(modelType, config.getExclude(), config.getInclude(), 0);
    }

    List<TransferFieldDefinition> parseModel(FieldType modelType, Set<String> exclude, Set<String> include,
                                             int nestedDepth) {
        List<TransferFieldDefinition> definitions = new ArrayList<>();
        for (FieldDefinition definition : introspector.generateFieldDefinitions(modelType)) {
            if (definition.getDtoFor() != null && definition.getDtoFor() != direction) {
                continue;
            }
            if (shouldMarkPrivate(definition)) {
                definition = definition.withMark(Mark.PRIVATE);
            }

            TransferType transferType;
            try {
                transferType = createTransferType(definition.getFieldType(), exclude, include,
                        definition.getName(), uniqueName(definition), nestedDepth);
            } catch (NestingDepthReached e) {
                log.debug("Dropping field '{}' of {}: max nested depth {} reached",
                        definition.getName(), definition.getModelName(), config.getMaxNestedDepth());
                continue;
            }

            definitions.add(TransferFieldDefinition.builder()
                    .fieldDefinition(definition)
                    .serializationName(serializationName(definition.getName()))
                    .partial(config.isPartial())
                    .excluded(shouldExclude(definition, exclude, include))
                    .transferType(transferType)
                    .build());
        }
        return List.copyOf(definitions);
    }

    private TransferType createTransferType(FieldType fieldType, Set<String> exclude, Set<String> include,
                                            String fieldName, String uniqueName, int nestedDepth) {
        Set<String> nestedExclude = FieldPaths.filterNested(exclude, fieldName);
        Set<String> nestedInclude = FieldPaths.filterNested(include, fieldName);

        if (fieldType.isUnion()) {
            return new TransferType.Union(fieldType,
                    positional(fieldType, nestedExclude, nestedInclude, uniqueName, nestedDepth));
        }
        if (fieldType.isTuple()) {
            return new TransferType.Tuple(fieldType,
                    positional(fieldType, nestedExclude, nestedInclude, uniqueName, nestedDepth));
        }
        if (fieldType.isCollection()) {
            return new TransferType.Collection(fieldType, createTransferType(fieldType.getInnerType(0),
                    nestedExclude, nestedInclude, "0", uniqueName + "_0", nestedDepth));
        }
        if (fieldType.isMapping()) {
            return new TransferType.Mapping(fieldType,
                    createTransferType(fieldType.getInnerType(0), nestedExclude, nestedInclude, "0",
                            uniqueName + "_0", nestedDepth),
                    createTransferType(fieldType.getInnerType(1), nestedExclude, nestedInclude, "1",
                            uniqueName + "_1", nestedDepth));
        }
        if (introspector.detectNestedField(fieldType)) {
            if (nestedDepth == config.getMaxNestedDepth()) {
                throw NestingDepthReached.INSTANCE;
            }
            List<TransferFieldDefinition> nested = parseModel(fieldType, nestedExclude, nestedInclude, nestedDepth + 1);
            return new TransferType.Simple(fieldType,
                    new NestedFieldInfo(synthesizer.createTransferModelType(uniqueName, nested), nested));
        }
        return new TransferType.Simple(fieldType, null);
    }

    private List<TransferType> positional(FieldType fieldType, Set<String> exclude, Set<String> include,
                                          String uniqueName, int nestedDepth) {
        List<FieldType> innerTypes = fieldType.getInnerTypes();
        List<TransferType> result = new ArrayList<>(innerTypes.size());
        for (int i = 0; i < innerTypes.size(); i++) {
            result.add(createTransferType(innerTypes.get(i), exclude, include, String.valueOf(i),
                    uniqueName + "_" + i, nestedDepth));
        }
        return result;
    }

    private boolean shouldMarkPrivate(FieldDefinition definition) {
        return config.isUnderscoreFieldsPrivate()
                && definition.getMark() == Mark.NONE
                && definition.getName().startsWith("_");
    }

    private boolean shouldExclude(FieldDefinition definition, Set<String> exclude, Set<String> include) {
        String name = definition.getName();
        if (exclude.contains(name)) {
            return true;
        }
        if (!include.isEmpty() && !include.contains(name)
                && include.stream().noneMatch(path -> path.startsWith(name + "."))) {
            return true;
        }
        Mark mark = definition.getMark();
        if (mark == Mark.PRIVATE) {
            return true;
        }
        if (direction.isData()) {
            return mark == Mark.READ_ONLY;
        }
        return mark == Mark.WRITE_ONLY;
    }

    private String serializationName(String fieldName) {
        String renamed = config.getRenameFields().get(fieldName);
        if (renamed != null) {
            return renamed;
        }
        return config.getRenameStrategy() != null ? config.getRenameStrategy().apply(fieldName) : fieldName;
    }

    private static String uniqueName(FieldDefinition definition) {
        return definition.getModelName() + RenameStrategy.camelize(definition.getName(), true);
    }

    /**
     * Unwinds the type walk of a field that would nest past the depth limit.
     */
    private static final class NestingDepthReached extends RuntimeException {
        static final NestingDepthReached INSTANCE = new NestingDepthReached();

        private NestingDepthReached() {
            super("max nested depth reached", null, false, false);
        }
    }
}
