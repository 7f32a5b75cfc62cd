package io.github.sachinnimbal.transferx.dto.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.sachinnimbal.transferx.core.exception.DtoValidationException;
import io.github.sachinnimbal.transferx.dto.model.TransferAnnotation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

@Slf4j
public abstract class AbstractJacksonWireCodec implements WireCodec {

    @Getter
    private final ObjectMapper objectMapper;
    @Getter
    private final List<String> mediaTypes;
    private final TransferModelReader reader;

    protected AbstractJacksonWireCodec(ObjectMapper objectMapper, List<String> mediaTypes) {
        this.objectMapper = objectMapper;
        this.mediaTypes = List.copyOf(mediaTypes);
        this.reader = new TransferModelReader(objectMapper);
    }

    @Override
    public Object decode(byte[] raw, TransferAnnotation target) {
        if (raw == null || raw.length == 0) {
            throw new DtoValidationException("$", "Input data was truncated");
        }
        JsonNode tree;
        try {
            tree = readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Malformed {} payload: {}", mediaTypes.get(0), e.getOriginalMessage());
            throw new DtoValidationException("$", "Malformed payload: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new DtoValidationException("$", "Malformed payload: " + e.getMessage());
        }
        return reader.read(tree, target);
    }

    /**
     * Parses the payload into a tree. Format-specific parse failures must
     * surface as {@link JsonProcessingException}.
     */
    protected JsonNode readTree(byte[] raw) throws IOException {
        return objectMapper.readTree(raw);
    }

    @Override
    public Object convert(Object builtins, TransferAnnotation target) {
        return reader.read(objectMapper.valueToTree(builtins), target);
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + value.getClass().getName()
                    + " as " + mediaTypes.get(0), e);
        }
    }
}
