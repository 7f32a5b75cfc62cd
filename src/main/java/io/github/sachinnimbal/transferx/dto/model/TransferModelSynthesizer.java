package io.github.sachinnimbal.transferx.dto.model;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.RenameStrategy;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import io.github.sachinnimbal.transferx.dto.schema.TransferType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link TransferModelType}s for one handler binding.
 *
 * <p>Names are tried in order: {@code <Method><Model><Suffix>} (e.g.
 * {@code GetPersonPersonResponseBody}), then the fully qualified handler
 * prefix, then the qualified name with a numeric suffix.
 */
@Slf4j
public class TransferModelSynthesizer {

    private final String shortPrefix;
    private final String longPrefix;
    private final String suffix;
    private final boolean forbidUnknownFields;
    private final TransferModelNameRegistry registry;

    public TransferModelSynthesizer(String handlerId, DtoDirection direction, boolean forbidUnknownFields,
                                    TransferModelNameRegistry registry) {
        String qualified = handlerId.split("::")[0];
        String[] segments = qualified.split("\\.");
        this.shortPrefix = RenameStrategy.camelize(segments[segments.length - 1], true);
        StringBuilder longName = new StringBuilder();
        for (String segment : segments) {
            longName.append(RenameStrategy.camelize(segment, true));
        }
        this.longPrefix = longName.toString();
        this.suffix = direction.isData() ? "RequestBody" : "ResponseBody";
        this.forbidUnknownFields = forbidUnknownFields;
        this.registry = registry;
    }

    /**
     * One transfer model with a field per non-excluded definition.
     */
    public TransferModelType createTransferModelType(String modelName, List<TransferFieldDefinition> definitions) {
        String name = registry.claim(shortPrefix + modelName + suffix, longPrefix + modelName + suffix);
        List<TransferModelField> fields = new ArrayList<>();
        for (TransferFieldDefinition definition : definitions) {
            if (definition.isExcluded()) {
                continue;
            }
            TransferAnnotation annotation = annotationFor(definition.getTransferType());
            if (definition.isPartial()) {
                annotation = TransferAnnotation.partial(definition.getFieldType(), annotation);
            }
            fields.add(TransferModelField.builder()
                    .serializationName(definition.getSerializationName())
                    .name(definition.getName())
                    .annotation(annotation)
                    .partial(definition.isPartial())
                    .fieldDefinition(definition.getFieldDefinition())
                    .build());
        }
        TransferModelType type = new TransferModelType(name, fields, forbidUnknownFields);
        log.debug("Synthesized transfer model {} with {} field(s)", name, fields.size());
        return type;
    }

    public static TransferAnnotation annotationFor(TransferType transferType) {
        if (transferType instanceof TransferType.Simple simple) {
            return simple.nested() != null
                    ? new TransferAnnotation.Model(simple.nested().model())
                    : new TransferAnnotation.Scalar(simple.fieldType());
        }
        if (transferType instanceof TransferType.Collection collection) {
            return new TransferAnnotation.Collection(collection.fieldType(), annotationFor(collection.innerType()));
        }
        if (transferType instanceof TransferType.Mapping mapping) {
            return new TransferAnnotation.Mapping(mapping.fieldType(),
                    annotationFor(mapping.keyType()), annotationFor(mapping.valueType()));
        }
        if (transferType instanceof TransferType.Tuple tuple) {
            return new TransferAnnotation.Tuple(tuple.fieldType(), annotationsFor(tuple.innerTypes()));
        }
        TransferType.Union union = (TransferType.Union) transferType;
        return new TransferAnnotation.Union(union.fieldType(), annotationsFor(union.innerTypes()));
    }

    private static List<TransferAnnotation> annotationsFor(List<TransferType> types) {
        List<TransferAnnotation> annotations = new ArrayList<>(types.size());
        for (TransferType type : types) {
            annotations.add(annotationFor(type));
        }
        return annotations;
    }

    /**
     * Annotation for a handler-level type: the model itself, or the model
     * wrapped in the same collections the handler declares.
     */
    public static TransferAnnotation wrapHandlerAnnotation(FieldType handlerType, TransferModelType model) {
        if (handlerType.isCollection()) {
            return new TransferAnnotation.Collection(handlerType,
                    wrapHandlerAnnotation(handlerType.getInnerType(0), model));
        }
        return new TransferAnnotation.Model(model);
    }
}
