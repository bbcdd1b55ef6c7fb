package com.leaflog.event;

import org.bitcoinj.core.Base58;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Sequential little-endian reader for Borsh-encoded event bodies.
 *
 * Every read advances the cursor. Running past the end of the payload raises
 * {@link EventDecodingException} rather than a buffer exception.
 */
public class BorshReader {

    static final int KEY_LENGTH = 32;
    private static final int MAX_COLLECTION_LENGTH = 1 << 16;

    private final ByteBuffer buffer;

    public BorshReader(byte[] bytes) {
        this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    public BorshReader(byte[] bytes, int offset) {
        this(bytes);
        skip(offset);
    }

    public void skip(int count) {
        if (count > buffer.remaining()) {
            throw new EventDecodingException("Cannot skip " + count + " bytes, "
                    + buffer.remaining() + " remaining");
        }
        buffer.position(buffer.position() + count);
    }

    public int remaining() {
        return buffer.remaining();
    }

    public int u8() {
        try {
            return Byte.toUnsignedInt(buffer.get());
        } catch (BufferUnderflowException e) {
            throw underflow("u8");
        }
    }

    public boolean bool() {
        int value = u8();
        if (value > 1) {
            throw new EventDecodingException("Invalid bool byte: " + value);
        }
        return value == 1;
    }

    public int u16() {
        try {
            return Short.toUnsignedInt(buffer.getShort());
        } catch (BufferUnderflowException e) {
            throw underflow("u16");
        }
    }

    public long u32() {
        try {
            return Integer.toUnsignedLong(buffer.getInt());
        } catch (BufferUnderflowException e) {
            throw underflow("u32");
        }
    }

    /**
     * u64 values that fit in a signed long. Sequence numbers and counters never
     * reach 2^63, so a larger value is treated as corrupt input.
     */
    public long u64() {
        long value;
        try {
            value = buffer.getLong();
        } catch (BufferUnderflowException e) {
            throw underflow("u64");
        }
        if (value < 0) {
            throw new EventDecodingException("u64 value exceeds signed range");
        }
        return value;
    }

    public BigInteger u128() {
        byte[] le = fixed(16);
        byte[] be = new byte[le.length];
        for (int i = 0; i < le.length; i++) {
            be[i] = le[le.length - 1 - i];
        }
        return new BigInteger(1, be);
    }

    public byte[] fixed(int length) {
        byte[] out = new byte[length];
        try {
            buffer.get(out);
        } catch (BufferUnderflowException e) {
            throw underflow(length + " bytes");
        }
        return out;
    }

    /**
     * 32-byte public key or hash, rendered as Base58.
     */
    public String key() {
        return Base58.encode(fixed(KEY_LENGTH));
    }

    public String string() {
        int length = length();
        return new String(fixed(length), StandardCharsets.UTF_8);
    }

    public <T> Optional<T> option(Function<BorshReader, T> element) {
        int tag = u8();
        return switch (tag) {
            case 0 -> Optional.empty();
            case 1 -> Optional.of(element.apply(this));
            default -> throw new EventDecodingException("Invalid option tag: " + tag);
        };
    }

    public <T> List<T> vec(Function<BorshReader, T> element) {
        int length = length();
        List<T> items = new ArrayList<>(Math.min(length, 64));
        for (int i = 0; i < length; i++) {
            items.add(element.apply(this));
        }
        return items;
    }

    private int length() {
        long length = u32();
        if (length > MAX_COLLECTION_LENGTH || length > buffer.remaining()) {
            throw new EventDecodingException("Declared length " + length
                    + " exceeds remaining payload of " + buffer.remaining() + " bytes");
        }
        return (int) length;
    }

    private EventDecodingException underflow(String what) {
        return new EventDecodingException("Payload ended while reading " + what);
    }
}
