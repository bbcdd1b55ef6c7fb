package com.leaflog.event;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Schema table keyed by an 8-byte discriminator prefix.
 *
 * HOW IT WORKS:
 *   1. Each event name registers a body decoder
 *   2. Its discriminator is sha256("event:" + name)[0..8]
 *   3. decode() looks the prefix up and hands the rest of the payload to the decoder
 */
public abstract class DiscriminatedEventSchema implements EventSchema {

    public static final int DISCRIMINATOR_LENGTH = 8;

    private final Map<ByteBuffer, Entry> entries = new HashMap<>();

    private static final class Entry {
        final String name;
        final Function<BorshReader, Object> decoder;

        Entry(String name, Function<BorshReader, Object> decoder) {
            this.name = name;
            this.decoder = decoder;
        }
    }

    protected void register(String eventName, Function<BorshReader, Object> decoder) {
        entries.put(ByteBuffer.wrap(discriminator(eventName)), new Entry(eventName, decoder));
    }

    @Override
    public Optional<DecodedEvent> decode(byte[] payload) {
        if (payload == null || payload.length < DISCRIMINATOR_LENGTH) {
            return Optional.empty();
        }
        byte[] prefix = Arrays.copyOf(payload, DISCRIMINATOR_LENGTH);
        Entry entry = entries.get(ByteBuffer.wrap(prefix));
        if (entry == null) {
            return Optional.empty();
        }
        BorshReader reader = new BorshReader(payload, DISCRIMINATOR_LENGTH);
        return Optional.of(new DecodedEvent(entry.name, entry.decoder.apply(reader)));
    }

    public static byte[] discriminator(String eventName) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(("event:" + eventName).getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, DISCRIMINATOR_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
