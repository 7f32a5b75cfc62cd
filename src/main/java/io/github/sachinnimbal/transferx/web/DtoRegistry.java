package io.github.sachinnimbal.transferx.web;

import io.github.sachinnimbal.transferx.core.config.TransferXProperties;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.AbstractDto;
import io.github.sachinnimbal.transferx.dto.HandlerContext;
import io.github.sachinnimbal.transferx.dto.codec.CodecRegistry;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one instance per DTO class named in {@code @UseDto}, configured from
 * {@link TransferXProperties}.
 */
@Slf4j
public class DtoRegistry {

    private final TransferXProperties properties;
    private final CodecRegistry codecRegistry;
    private final Validator validator;
    private final Map<Class<?>, AbstractDto<?>> dtos = new ConcurrentHashMap<>();

    public DtoRegistry(TransferXProperties properties, CodecRegistry codecRegistry, Validator validator) {
        this.properties = properties;
        this.codecRegistry = codecRegistry;
        this.validator = validator;
    }

    public AbstractDto<?> getDto(Class<?> dtoClass) {
        return dtos.computeIfAbsent(dtoClass, this::instantiate);
    }

    /**
     * The DTO instance for {@code dtoClass}, bound to the handler described by {@code context}.
     */
    public AbstractDto<?> bind(Class<?> dtoClass, HandlerContext context) {
        AbstractDto<?> dto = getDto(dtoClass);
        dto.onRegistration(context);
        return dto;
    }

    private AbstractDto<?> instantiate(Class<?> dtoClass) {
        if (!AbstractDto.class.isAssignableFrom(dtoClass)) {
            throw new DtoConfigurationException(String.format(
                    "%s is not a DTO: it must extend RecordDto, BeanDto or JpaDto", dtoClass.getName()));
        }
        AbstractDto<?> dto;
        try {
            dto = (AbstractDto<?>) BeanUtils.instantiateClass(dtoClass);
        } catch (BeanInstantiationException e) {
            if (e.getCause() instanceof DtoConfigurationException configurationException) {
                throw configurationException;
            }
            throw new DtoConfigurationException("Cannot instantiate DTO " + dtoClass.getName()
                    + ": a no-argument constructor is required", e);
        }
        dto.setDefaultBackendMode(properties.getDto().getBackend());
        dto.setCodecRegistry(codecRegistry);
        dto.setLogBindings(properties.getDto().isLogBindings());
        if (validator != null) {
            dto.setValidator(validator);
        }
        log.debug("Registered DTO {} for model {}", dtoClass.getSimpleName(), dto.getModelType().getDisplayName());
        return dto;
    }

    public Collection<AbstractDto<?>> getDtos() {
        return Collections.unmodifiableCollection(dtos.values());
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("dtos", dtos.size());
        stats.put("bindings", dtos.values().stream().mapToInt(AbstractDto::getBindingCount).sum());
        stats.put("backend", properties.getDto().getBackend());
        return stats;
    }

    public void clear() {
        dtos.values().forEach(AbstractDto::clearBindings);
        dtos.clear();
        log.info("DTO registry cleared");
    }
}
