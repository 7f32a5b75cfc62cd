package io.github.sachinnimbal.transferx.dto.engine;

import java.util.Map;

/**
 * Moves data between domain instances and transfer models for one binding.
 * Implementations must produce identical results for identical input.
 */
public interface TransferEngine {

    /**
     * Transfer model(s) decoded from the wire to domain instance(s).
     */
    Object decode(Object transferData);

    /**
     * Transfer model(s) to plain maps keyed by attribute name, nested levels included.
     */
    Object decodeToBuiltins(Object transferData);

    /**
     * Attribute-keyed maps (as produced by {@link #decodeToBuiltins}) to domain instance(s).
     */
    Object decodeFromBuiltins(Object builtins);

    /**
     * Attribute-keyed map to a map of top-level field values; nested levels
     * become domain instances. Used to update an existing instance.
     */
    Map<String, Object> decodeFieldValues(Map<String, Object> builtins);

    /**
     * Domain instance(s) to transfer model(s). Excluded fields are never read.
     */
    Object encode(Object domainData);
}
