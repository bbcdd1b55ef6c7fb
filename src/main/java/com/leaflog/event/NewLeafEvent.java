package com.leaflog.event;

import lombok.*;

import java.math.BigInteger;

/**
 * Emitted once per mint, ahead of the leaf schema event.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NewLeafEvent {

    public static final String NAME = "NewNFTEvent";

    private int version;
    private MetadataArgs metadata;
    private BigInteger nonce;

    static NewLeafEvent read(BorshReader reader) {
        int version = reader.u8();
        MetadataArgs metadata = MetadataArgs.read(reader);
        BigInteger nonce = reader.u128();
        return new NewLeafEvent(version, metadata, nonce);
    }
}
