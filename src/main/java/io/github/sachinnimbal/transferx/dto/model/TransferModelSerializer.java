package io.github.sachinnimbal.transferx.dto.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a {@link TransferModel} as an object keyed by serialization name,
 * leaving out unset fields. Works with any Jackson generator, so the same
 * serializer drives both JSON and MessagePack output.
 */
public class TransferModelSerializer extends StdSerializer<TransferModel> {

    public TransferModelSerializer() {
        super(TransferModel.class);
    }

    @Override
    public void serialize(TransferModel model, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject(model);
        for (Map.Entry<String, Object> entry : model.getValues().entrySet()) {
            if (entry.getValue() == Unset.UNSET) {
                continue;
            }
            gen.writeFieldName(entry.getKey());
            provider.defaultSerializeValue(entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
