package com.leaflog.event;

import org.springframework.stereotype.Component;

/**
 * Events of the merkle tree program: only the changelog.
 */
@Component
public class TreeProgramEventSchema extends DiscriminatedEventSchema {

    public TreeProgramEventSchema() {
        register(ChangeLogEvent.NAME, ChangeLogEvent::read);
    }

    @Override
    public ProgramRole role() {
        return ProgramRole.TREE;
    }
}
