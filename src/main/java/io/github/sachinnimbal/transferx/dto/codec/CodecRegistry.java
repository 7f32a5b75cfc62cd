package io.github.sachinnimbal.transferx.dto.codec;

import io.github.sachinnimbal.transferx.core.exception.UnsupportedMediaTypeException;

import java.util.*;

/**
 * Resolves a request content type to a {@link WireCodec}. A missing content
 * type means JSON; parameters such as {@code charset} are ignored.
 */
public class CodecRegistry {

    private final Map<String, WireCodec> codecs = new LinkedHashMap<>();
    private final WireCodec defaultCodec;

    public CodecRegistry(List<WireCodec> codecs) {
        if (codecs.isEmpty()) {
            throw new IllegalArgumentException("At least one codec is required");
        }
        for (WireCodec codec : codecs) {
            for (String mediaType : codec.getMediaTypes()) {
                this.codecs.putIfAbsent(mediaType, codec);
            }
        }
        this.defaultCodec = codecs.get(0);
    }

    public static CodecRegistry defaults() {
        return new CodecRegistry(List.of(new JsonWireCodec(), new MessagePackWireCodec()));
    }

    public WireCodec json() {
        return defaultCodec;
    }

    public WireCodec forMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return defaultCodec;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        WireCodec codec = codecs.get(mediaType);
        if (codec != null) {
            return codec;
        }
        if (mediaType.endsWith("+json")) {
            return codecs.getOrDefault(JsonWireCodec.MEDIA_TYPE, defaultCodec);
        }
        throw new UnsupportedMediaTypeException(contentType);
    }

    public Set<String> getSupportedMediaTypes() {
        return Collections.unmodifiableSet(codecs.keySet());
    }
}
