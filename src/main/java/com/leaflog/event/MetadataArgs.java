package com.leaflog.event;

import lombok.*;

import java.util.List;

/**
 * Asset metadata carried by a mint.
 *
 * Field order mirrors the on-chain layout:
 *   name, symbol, uri, sellerFeeBasisPoints, primarySaleHappened, isMutable,
 *   editionNonce?, tokenStandard?, collection?, uses?, tokenProgramVersion, creators[]
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MetadataArgs {

    private String name;
    private String symbol;
    private String uri;
    private int sellerFeeBasisPoints;
    private boolean primarySaleHappened;
    private boolean mutable;
    private Integer editionNonce;
    private Integer tokenStandard;
    private CollectionRef collection;
    private Uses uses;
    private int tokenProgramVersion;
    private List<Creator> creators;

    static MetadataArgs read(BorshReader reader) {
        return MetadataArgs.builder()
                .name(reader.string())
                .symbol(reader.string())
                .uri(reader.string())
                .sellerFeeBasisPoints(reader.u16())
                .primarySaleHappened(reader.bool())
                .mutable(reader.bool())
                .editionNonce(reader.option(BorshReader::u8).orElse(null))
                .tokenStandard(reader.option(BorshReader::u8).orElse(null))
                .collection(reader.option(CollectionRef::read).orElse(null))
                .uses(reader.option(Uses::read).orElse(null))
                .tokenProgramVersion(reader.u8())
                .creators(reader.vec(Creator::read))
                .build();
    }
}
