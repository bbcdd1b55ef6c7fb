package com.leaflog.event;

import lombok.*;

import java.math.BigInteger;

/**
 * Version 1 of the leaf descriptor. Keys and hashes are Base58.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeafSchemaV1 {

    private String id;
    private String owner;
    private String delegate;
    private BigInteger nonce;
    private String dataHash;
    private String creatorHash;

    static LeafSchemaV1 read(BorshReader reader) {
        return LeafSchemaV1.builder()
                .id(reader.key())
                .owner(reader.key())
                .delegate(reader.key())
                .nonce(reader.u128())
                .dataHash(reader.key())
                .creatorHash(reader.key())
                .build();
    }
}
