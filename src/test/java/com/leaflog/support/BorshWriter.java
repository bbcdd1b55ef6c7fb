package com.leaflog.support;

import com.leaflog.event.DiscriminatedEventSchema;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Little-endian Borsh encoder for building event payloads in tests.
 */
public class BorshWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public static BorshWriter event(String eventName) {
        BorshWriter writer = new BorshWriter();
        writer.bytes(DiscriminatedEventSchema.discriminator(eventName));
        return writer;
    }

    public BorshWriter u8(int value) {
        out.write(value & 0xFF);
        return this;
    }

    public BorshWriter bool(boolean value) {
        return u8(value ? 1 : 0);
    }

    public BorshWriter u16(int value) {
        return bytes(ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN).putShort((short) value).array());
    }

    public BorshWriter u32(long value) {
        return bytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array());
    }

    public BorshWriter u64(long value) {
        return bytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array());
    }

    public BorshWriter u128(BigInteger value) {
        byte[] le = new byte[16];
        byte[] be = value.toByteArray();
        for (int i = 0; i < be.length && i < 16; i++) {
            le[i] = be[be.length - 1 - i];
        }
        return bytes(le);
    }

    public BorshWriter key(byte[] key) {
        if (key.length != 32) {
            throw new IllegalArgumentException("key must be 32 bytes");
        }
        return bytes(key);
    }

    public BorshWriter string(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        u32(utf8.length);
        return bytes(utf8);
    }

    public BorshWriter bytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public byte[] toBytes() {
        return out.toByteArray();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }
}
