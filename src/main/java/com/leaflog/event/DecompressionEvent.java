package com.leaflog.event;

import lombok.*;

import java.math.BigInteger;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DecompressionEvent {

    public static final String NAME = "NFTDecompressionEvent";

    private int version;
    private String id;
    private String treeId;
    private BigInteger nonce;

    static DecompressionEvent read(BorshReader reader) {
        return DecompressionEvent.builder()
                .version(reader.u8())
                .id(reader.key())
                .treeId(reader.key())
                .nonce(reader.u128())
                .build();
    }
}
