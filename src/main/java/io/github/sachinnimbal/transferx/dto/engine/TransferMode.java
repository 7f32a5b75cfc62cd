package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;

/**
 * Parameters of one transfer operation.
 *
 * @param data          inbound transfer: read wire names, write attribute names
 * @param readPlainNames read attribute names even though the transfer is inbound
 * @param nestedAsDict  build nested levels as maps instead of domain instances
 * @param sourceAccess  how field values are read
 */
public record TransferMode(boolean data, boolean readPlainNames, boolean nestedAsDict, SourceAccess sourceAccess) {

    static final TransferMode DECODE = new TransferMode(true, false, false, SourceAccess.FIELD_MAP);
    static final TransferMode DECODE_TO_BUILTINS = new TransferMode(true, false, true, SourceAccess.FIELD_MAP);
    static final TransferMode DECODE_FROM_BUILTINS = new TransferMode(true, true, false, SourceAccess.FIELD_MAP);
    static final TransferMode ENCODE = new TransferMode(false, false, false, SourceAccess.DOMAIN_OBJECT);

    String sourceName(TransferFieldDefinition definition) {
        return data && !readPlainNames ? definition.getSerializationName() : definition.getName();
    }

    String destinationName(TransferFieldDefinition definition) {
        return data ? definition.getName() : definition.getSerializationName();
    }
}
