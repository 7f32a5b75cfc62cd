package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.core.exception.ValidationError;
import io.github.sachinnimbal.transferx.dto.backend.BackendContext;
import io.github.sachinnimbal.transferx.dto.backend.DtoBackend;
import io.github.sachinnimbal.transferx.dto.backend.HandlerTypeResolution;
import io.github.sachinnimbal.transferx.dto.backend.HandlerTypeResolver;
import io.github.sachinnimbal.transferx.dto.codec.CodecRegistry;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.FieldIntrospector;
import io.github.sachinnimbal.transferx.dto.model.TransferModelNameRegistry;
import io.github.sachinnimbal.transferx.dto.openapi.DtoSchemaCreator;
import io.swagger.v3.oas.models.media.Schema;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ResolvableType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base class of all DTOs. A DTO is declared once per model and configuration,
 * then bound to any number of handlers:
 *
 * <pre>
 * public class PersonReadDto extends RecordDto&lt;Person&gt; {
 *     public PersonReadDto() {
 *         super(DtoConfig.builder().exclude("email").build());
 *     }
 * }
 * </pre>
 *
 * <p>A binding is built the first time a (direction, handler) pair is
 * registered and reused afterwards. Handlers declaring the same type in the
 * same direction share one binding.
 *
 * @param <T> the domain model type
 */
@Slf4j
public abstract class AbstractDto<T> {

    private static final CodecRegistry DEFAULT_CODECS = CodecRegistry.defaults();

    @Getter
    private final FieldType modelType;
    @Getter
    private final DtoConfig config;
    @Getter
    private final FieldIntrospector introspector;

    private final TransferModelNameRegistry nameRegistry = TransferModelNameRegistry.global();
    private final Map<TypeBindingKey, DtoBackend> typeBackends = new ConcurrentHashMap<>();
    private final Map<HandlerBindingKey, DtoBackend> handlerBackends = new ConcurrentHashMap<>();

    private volatile TransferBackendMode defaultBackendMode = TransferBackendMode.CODEGEN;
    private volatile CodecRegistry codecRegistry = DEFAULT_CODECS;
    private volatile Validator validator;
    private volatile boolean logBindings = true;

    protected AbstractDto(DtoConfig config, FieldIntrospector introspector) {
        this.config = config;
        this.introspector = introspector;
        this.modelType = checkModelType(resolveModelType());
    }

    protected AbstractDto(Class<T> modelClass, DtoConfig config, FieldIntrospector introspector) {
        this.config = config;
        this.introspector = introspector;
        this.modelType = checkModelType(FieldType.of(modelClass));
    }

    private FieldType resolveModelType() {
        ResolvableType argument = ResolvableType.forClass(getClass()).as(AbstractDto.class).getGeneric(0);
        Class<?> resolved = argument.resolve();
        if (resolved == null || resolved == Object.class) {
            throw new DtoConfigurationException(String.format(
                    "Cannot resolve the model type of %s: declare it with a concrete type argument",
                    getClass().getName()));
        }
        return FieldType.of(argument);
    }

    private FieldType checkModelType(FieldType type) {
        if (type.isUnion()) {
            throw new DtoConfigurationException("Unions are currently not supported as type argument to DTO. Got "
                    + type.getDisplayName());
        }
        if (!introspector.isModelType(type.getRawClass())) {
            throw new DtoConfigurationException(String.format("%s is not a model type supported by %s",
                    type.getDisplayName(), getClass().getSimpleName()));
        }
        return type;
    }

    /**
     * Binds this DTO to a handler. Builds the binding on first use of the key,
     * otherwise returns the cached one.
     *
     * @throws DtoConfigurationException when the handler type does not match the model
     */
    public DtoBackend onRegistration(HandlerContext context) {
        HandlerBindingKey handlerKey = new HandlerBindingKey(context.getDirection(), context.getHandlerId());
        DtoBackend backend = handlerBackends.get(handlerKey);
        if (backend != null) {
            return backend;
        }
        return handlerBackends.computeIfAbsent(handlerKey, key -> typeBackends.computeIfAbsent(
                new TypeBindingKey(context.getDirection(), context.getFieldType().getResolvableType().toString()),
                typeKey -> createBackend(context)));
    }

    private DtoBackend createBackend(HandlerContext context) {
        HandlerTypeResolution resolution = HandlerTypeResolver.resolve(
                context.getFieldType(), modelType.getRawClass(), context.getDirection());
        TransferBackendMode mode = config.getBackendMode() != null ? config.getBackendMode() : defaultBackendMode;

        DtoBackend backend = new DtoBackend(BackendContext.builder()
                .handlerId(context.getHandlerId())
                .direction(context.getDirection())
                .resolution(resolution)
                .config(config)
                .introspector(introspector)
                .backendMode(mode)
                .codecRegistry(codecRegistry)
                .nameRegistry(nameRegistry)
                .domainValidator(this::validate)
                .build());

        if (logBindings) {
            log.info("✓ Bound {} ({}) to {} as {} [{} field(s), {} backend]",
                    getClass().getSimpleName(), context.getDirection().getValue(), context.getHandlerId(),
                    backend.getTransferModelType().getName(), backend.getTransferModelType().getFields().size(), mode);
        }
        return backend;
    }

    public Optional<DtoBackend> getBinding(DtoDirection direction, String handlerId) {
        return Optional.ofNullable(handlerBackends.get(new HandlerBindingKey(direction, handlerId)));
    }

    private DtoBackend requireBinding(DtoDirection direction, String handlerId) {
        return getBinding(direction, handlerId).orElseThrow(() -> new IllegalStateException(String.format(
                "%s is not registered for %s handler %s", getClass().getSimpleName(), direction.getValue(), handlerId)));
    }

    /**
     * Decodes a raw request body for a registered handler.
     *
     * @return domain instance(s), or a {@link DtoData} when the handler declared one
     */
    public Object decodeBytes(String handlerId, byte[] raw, String contentType) {
        return requireBinding(DtoDirection.DATA, handlerId).populateDataFromRaw(raw, contentType);
    }

    public Object decodeBuiltins(String handlerId, Object builtins) {
        return requireBinding(DtoDirection.DATA, handlerId).populateDataFromBuiltins(builtins);
    }

    /**
     * Transfers a handler's return value into its transfer model(s).
     */
    public Object encode(String handlerId, Object data) {
        return requireBinding(DtoDirection.RETURN, handlerId).encodeData(data);
    }

    public byte[] encodeToBytes(String handlerId, Object data, String contentType) {
        return requireBinding(DtoDirection.RETURN, handlerId).encodeToBytes(data, contentType);
    }

    /**
     * OpenAPI schema of the transfer model bound to a handler. Nested models
     * are registered as components of {@code schemaCreator}.
     */
    public Schema<?> createOpenApiSchema(DtoDirection direction, String handlerId, DtoSchemaCreator schemaCreator) {
        return schemaCreator.forAnnotation(requireBinding(direction, handlerId).getAnnotation());
    }

    /**
     * Drops every binding. Claimed transfer model names stay claimed until
     * {@link TransferModelNameRegistry#clear()} is called on the global registry.
     */
    public void clearBindings() {
        handlerBackends.clear();
        typeBackends.clear();
    }

    public int getBindingCount() {
        return typeBackends.size();
    }

    public void setDefaultBackendMode(TransferBackendMode defaultBackendMode) {
        this.defaultBackendMode = defaultBackendMode;
    }

    public void setCodecRegistry(CodecRegistry codecRegistry) {
        this.codecRegistry = codecRegistry;
    }

    public void setValidator(Validator validator) {
        this.validator = validator;
    }

    public void setLogBindings(boolean logBindings) {
        this.logBindings = logBindings;
    }

    /**
     * Bean Validation of a decoded instance.
     */
    protected List<ValidationError> validate(Object instance) {
        List<ValidationError> errors = new ArrayList<>();
        for (ConstraintViolation<Object> violation : validator().validate(instance)) {
            String path = violation.getPropertyPath().toString();
            errors.add(new ValidationError(path.isEmpty() ? "$" : "$." + path, violation.getMessage()));
        }
        return errors;
    }

    private Validator validator() {
        Validator current = validator;
        if (current == null) {
            current = DefaultValidatorHolder.VALIDATOR;
            validator = current;
        }
        return current;
    }

    private static final class DefaultValidatorHolder {
        static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();
    }

    /**
     * Keyed by the fully resolved type signature: {@link ResolvableType}
     * equality also compares where a type was declared.
     */
    private record TypeBindingKey(DtoDirection direction, String typeSignature) {
    }

    private record HandlerBindingKey(DtoDirection direction, String handlerId) {
    }
}
