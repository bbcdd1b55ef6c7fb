package com.leaflog.event;

import lombok.*;

/**
 * Leaf descriptor emitted by the token program.
 *
 * The schema is a versioned union on-chain. Only variant 0 (v1) exists today;
 * any other variant raises {@link UnsupportedSchemaVersionException} instead of
 * being guessed at.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeafSchemaEvent {

    public static final String NAME = "LeafSchemaEvent";

    static final int V1_VARIANT = 0;

    private int version;
    private LeafSchemaV1 v1;

    static LeafSchemaEvent read(BorshReader reader) {
        int version = reader.u8();
        int variant = reader.u8();
        if (variant != V1_VARIANT) {
            throw new UnsupportedSchemaVersionException(variant);
        }
        return new LeafSchemaEvent(version, LeafSchemaV1.read(reader));
    }
}
