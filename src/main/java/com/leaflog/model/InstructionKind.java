package com.leaflog.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Token-program instructions the indexer knows how to reconcile.
 * Resolved once from the "Instruction: <Name>" log line; any other name is UNKNOWN.
 *
 * CREATE_TREE   → changelog only
 * MINT          → changelog + new leaf + leaf schema
 * TRANSFER, DELEGATE, BURN, REDEEM, CANCEL_REDEEM → changelog + leaf schema
 * DECOMPRESS    → decompression event only
 */
public enum InstructionKind {
    CREATE_TREE("CreateTree"),
    MINT("Mint", "MintV1"),
    TRANSFER("Transfer"),
    DELEGATE("Delegate"),
    BURN("Burn"),
    REDEEM("Redeem"),
    CANCEL_REDEEM("CancelRedeem"),
    DECOMPRESS("Decompress", "DecompressV1"),
    UNKNOWN;

    private final Set<String> logNames;

    InstructionKind(String... logNames) {
        this.logNames = Set.of(logNames);
    }

    public static InstructionKind fromLogName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(kind -> kind.logNames.contains(name))
                .findFirst()
                .orElse(UNKNOWN);
    }

    public boolean requiresChangelog() {
        return this != DECOMPRESS && this != UNKNOWN;
    }
}
