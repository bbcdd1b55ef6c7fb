package com.leaflog.event;

import com.leaflog.support.BorshWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static com.leaflog.support.LogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EventSchemaTest {

    private final TreeProgramEventSchema treeSchema = new TreeProgramEventSchema();
    private final TokenProgramEventSchema tokenSchema = new TokenProgramEventSchema();

    @Test
    @DisplayName("discriminator is the first 8 bytes of sha256(\"event:\" + name)")
    void discriminatorIsStable() {
        byte[] first = DiscriminatedEventSchema.discriminator("ChangeLogEvent");
        byte[] second = DiscriminatedEventSchema.discriminator("ChangeLogEvent");

        assertEquals(8, first.length);
        assertArrayEquals(first, second);
        assertFalse(java.util.Arrays.equals(first, DiscriminatedEventSchema.discriminator("LeafSchemaEvent")));
    }

    @Test
    @DisplayName("decodes a changelog with leaf-to-root path")
    void decodesChangelog() {
        DecodedEvent event = treeSchema.decode(changelog(7, 12, 3, 2).toBytes()).orElseThrow();
        ChangeLogEvent changelog = event.dataAs(ChangeLogEvent.class);

        assertEquals(ChangeLogEvent.NAME, event.getName());
        assertEquals(keyB58(7), changelog.getTreeId());
        assertEquals(12, changelog.getSeq());
        assertEquals(3, changelog.getIndex());
        assertEquals(3, changelog.getPath().size());
        assertEquals(keyB58(12), changelog.leafHash());
        assertEquals(7, changelog.getPath().get(0).getIndex());
        assertEquals(1, changelog.getPath().get(2).getIndex());
    }

    @Test
    @DisplayName("token-program payload is not a tree event")
    void foreignDiscriminator() {
        assertTrue(treeSchema.decode(leafSchema(1, 2, 3).toBytes()).isEmpty());
    }

    @Test
    @DisplayName("payload shorter than a discriminator is not an event")
    void tooShort() {
        assertTrue(treeSchema.decode(new byte[]{1, 2, 3}).isEmpty());
    }

    @Test
    @DisplayName("known discriminator with a cut-off body is a decoding error")
    void truncatedBody() {
        byte[] full = changelog(7, 12, 3, 2).toBytes();
        byte[] cut = java.util.Arrays.copyOf(full, full.length - 5);

        assertThrows(EventDecodingException.class, () -> treeSchema.decode(cut));
    }

    @Test
    @DisplayName("changelog with an empty path is a decoding error, never a null leaf hash")
    void emptyPath() {
        byte[] payload = BorshWriter.event(ChangeLogEvent.NAME)
                .key(key(7))
                .u32(0)
                .u64(12)
                .u32(3)
                .toBytes();

        assertThrows(EventDecodingException.class, () -> treeSchema.decode(payload));
    }

    @Test
    @DisplayName("decodes a v1 leaf schema")
    void leafSchemaV1() {
        LeafSchemaEvent event = tokenSchema.decode(leafSchema(9, 4, 77).toBytes())
                .orElseThrow().dataAs(LeafSchemaEvent.class);

        assertEquals(keyB58(9), event.getV1().getId());
        assertEquals(keyB58(4), event.getV1().getOwner());
        assertEquals(BigInteger.valueOf(77), event.getV1().getNonce());
    }

    @Test
    @DisplayName("unknown leaf schema variant is an explicit error")
    void unknownVariant() {
        UnsupportedSchemaVersionException e = assertThrows(UnsupportedSchemaVersionException.class,
                () -> tokenSchema.decode(leafSchemaVariant(1, 9, 4, 77).toBytes()));

        assertEquals(1, e.getVariant());
    }

    @Test
    @DisplayName("decodes mint metadata with optional fields and creators")
    void decodesNewLeaf() {
        NewLeafEvent event = tokenSchema.decode(newLeaf("Leaf #5", 5, 0x33).toBytes())
                .orElseThrow().dataAs(NewLeafEvent.class);

        MetadataArgs metadata = event.getMetadata();
        assertEquals("Leaf #5", metadata.getName());
        assertEquals(500, metadata.getSellerFeeBasisPoints());
        assertTrue(metadata.isMutable());
        assertEquals(254, metadata.getEditionNonce());
        assertNull(metadata.getTokenStandard());
        assertEquals(keyB58(0x44), metadata.getCollection().getKey());
        assertNull(metadata.getUses());
        assertEquals(1, metadata.getCreators().size());
        assertEquals(100, metadata.getCreators().get(0).getShare());
        assertEquals(BigInteger.valueOf(5), event.getNonce());
    }

    @Test
    @DisplayName("decodes a decompression event")
    void decodesDecompression() {
        Optional<DecodedEvent> event = tokenSchema.decode(decompression(9, 7, 1).toBytes());

        assertTrue(event.orElseThrow().isA(DecompressionEvent.class));
        assertEquals(keyB58(9), event.get().dataAs(DecompressionEvent.class).getId());
    }

    @Test
    @DisplayName("declared string length beyond the payload is a decoding error")
    void oversizedString() {
        byte[] payload = BorshWriter.event(NewLeafEvent.NAME).u8(1).u32(1_000_000).toBytes();

        assertThrows(EventDecodingException.class, () -> tokenSchema.decode(payload));
    }
}
