package com.leaflog.event;

/**
 * A leaf schema variant this indexer does not know how to store.
 * Unlike an unknown discriminator, this is never silently dropped.
 */
public class UnsupportedSchemaVersionException extends RuntimeException {

    private final int variant;

    public UnsupportedSchemaVersionException(int variant) {
        super("Unsupported leaf schema variant: " + variant);
        this.variant = variant;
    }

    public int getVariant() {
        return variant;
    }
}
