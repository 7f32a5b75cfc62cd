package io.github.sachinnimbal.transferx.dto.codec;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

public class JsonWireCodec extends AbstractJacksonWireCodec {

    public static final String MEDIA_TYPE = "application/json";

    public JsonWireCodec() {
        this(JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
    }

    public JsonWireCodec(ObjectMapper objectMapper) {
        super(objectMapper, List.of(MEDIA_TYPE));
    }
}
