package com.leaflog.event;

import java.util.Optional;

/**
 * Event-decoding table for one program.
 */
public interface EventSchema {

    ProgramRole role();

    /**
     * Decode a raw payload. An unknown discriminator yields empty;
     * a known discriminator with a malformed body throws {@link EventDecodingException}.
     */
    Optional<DecodedEvent> decode(byte[] payload);
}
