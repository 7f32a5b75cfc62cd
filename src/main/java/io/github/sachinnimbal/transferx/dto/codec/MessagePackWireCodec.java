package io.github.sachinnimbal.transferx.dto.codec;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.util.List;

/**
 * MessagePack through jackson-dataformat-msgpack. Transfer models use the
 * same serializer as JSON.
 */
public class MessagePackWireCodec extends AbstractJacksonWireCodec {

    public static final String MEDIA_TYPE = "application/x-msgpack";

    public MessagePackWireCodec() {
        super(createMapper(), List.of(MEDIA_TYPE, "application/msgpack", "application/vnd.msgpack"));
    }

    @SuppressWarnings("deprecation")
    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper(new MessagePackFactory());
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // msgpack-core reports format errors unchecked
    @Override
    protected JsonNode readTree(byte[] raw) throws IOException {
        try {
            return super.readTree(raw);
        } catch (MessagePackException e) {
            throw new JsonParseException((JsonParser) null, e.getMessage(), e);
        }
    }
}
