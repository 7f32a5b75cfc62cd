package io.github.sachinnimbal.transferx.dto.config;

import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable, per-DTO configuration.
 *
 * <pre>
 * DtoConfig.builder()
 *     .exclude("id")
 *     .exclude("address.street")
 *     .renameStrategy(RenameStrategy.CAMEL)
 *     .maxNestedDepth(2)
 *     .build();
 * </pre>
 *
 * Paths in {@code exclude} and {@code include} are dot-separated; positional
 * segments ({@code "0"}, {@code "1"}) address inner types of unions and tuples.
 */
@Value
public class DtoConfig {

    public static final int DEFAULT_MAX_NESTED_DEPTH = 1;

    Set<String> exclude;
    Set<String> include;
    Map<String, String> renameFields;
    /** A {@link io.github.sachinnimbal.transferx.core.enums.RenameStrategy} or any custom function. */
    UnaryOperator<String> renameStrategy;
    int maxNestedDepth;
    boolean partial;
    boolean underscoreFieldsPrivate;
    boolean forbidUnknownFields;
    /** Overrides the application-wide backend for this DTO, {@code null} to inherit. */
    TransferBackendMode backendMode;

    @Builder
    private DtoConfig(@Singular("exclude") Set<String> excludes,
                      @Singular("include") Set<String> includes,
                      @Singular("renameField") Map<String, String> renameFields,
                      UnaryOperator<String> renameStrategy,
                      Integer maxNestedDepth,
                      boolean partial,
                      Boolean underscoreFieldsPrivate,
                      boolean forbidUnknownFields,
                      TransferBackendMode backendMode) {
        if (!excludes.isEmpty() && !includes.isEmpty()) {
            throw new DtoConfigurationException(
                    "'include' and 'exclude' are mutually exclusive: configure only one of them");
        }
        int depth = maxNestedDepth == null ? DEFAULT_MAX_NESTED_DEPTH : maxNestedDepth;
        if (depth < 0) {
            throw new DtoConfigurationException("'maxNestedDepth' must not be negative, got " + depth);
        }
        this.exclude = Set.copyOf(excludes);
        this.include = Set.copyOf(includes);
        this.renameFields = Map.copyOf(renameFields);
        this.renameStrategy = renameStrategy;
        this.maxNestedDepth = depth;
        this.partial = partial;
        this.underscoreFieldsPrivate = underscoreFieldsPrivate == null || underscoreFieldsPrivate;
        this.forbidUnknownFields = forbidUnknownFields;
        this.backendMode = backendMode;
    }

    public static DtoConfig defaults() {
        return builder().build();
    }
}
