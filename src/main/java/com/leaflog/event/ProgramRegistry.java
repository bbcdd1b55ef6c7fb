package com.leaflog.event;

import java.util.Optional;

/**
 * Resolves program ids by role and decodes a program's events.
 * Injected into the dispatcher and handlers instead of being held globally.
 */
public interface ProgramRegistry {

    String programId(ProgramRole role);

    /**
     * Decode a base64 payload emitted by the given program.
     * Returns empty for an unregistered program, an unknown discriminator,
     * or a malformed payload.
     *
     * @throws UnsupportedSchemaVersionException for a leaf schema variant other than v1
     */
    Optional<DecodedEvent> decodeEvent(String programId, String base64Payload);

    default Optional<DecodedEvent> decodeEvent(ProgramRole role, String base64Payload) {
        return decodeEvent(programId(role), base64Payload);
    }
}
