package com.leaflog.event;

import org.springframework.stereotype.Component;

/**
 * Events of the compressed-asset program: new leaf (mint metadata), leaf schema,
 * and decompression.
 */
@Component
public class TokenProgramEventSchema extends DiscriminatedEventSchema {

    public TokenProgramEventSchema() {
        register(NewLeafEvent.NAME, NewLeafEvent::read);
        register(LeafSchemaEvent.NAME, LeafSchemaEvent::read);
        register(DecompressionEvent.NAME, DecompressionEvent::read);
    }

    @Override
    public ProgramRole role() {
        return ProgramRole.TOKEN;
    }
}
