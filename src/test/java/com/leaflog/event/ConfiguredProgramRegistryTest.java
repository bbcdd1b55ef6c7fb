package com.leaflog.event;

import com.leaflog.config.LeafLogProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.leaflog.support.LogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ConfiguredProgramRegistryTest {

    private final ProgramRegistry registry = registry();

    @Test
    @DisplayName("resolves program ids by role from configuration")
    void programIds() {
        assertEquals(TREE, registry.programId(ProgramRole.TREE));
        assertEquals(TOKEN, registry.programId(ProgramRole.TOKEN));
    }

    @Test
    @DisplayName("decodes against the schema of the emitting program only")
    void schemaPerProgram() {
        String changelog = changelog(1, 5, 0, 1).toBase64();

        assertTrue(registry.decodeEvent(TREE, changelog).isPresent());
        assertTrue(registry.decodeEvent(TOKEN, changelog).isEmpty());
    }

    @Test
    @DisplayName("unregistered program decodes to no event")
    void unknownProgram() {
        assertTrue(registry.decodeEvent(OUTER, changelog(1, 5, 0, 1).toBase64()).isEmpty());
    }

    @Test
    @DisplayName("non-base64 payload decodes to no event")
    void notBase64() {
        assertTrue(registry.decodeEvent(ProgramRole.TREE, "***").isEmpty());
    }

    @Test
    @DisplayName("malformed body decodes to no event")
    void malformedBody() {
        String cut = java.util.Base64.getEncoder().encodeToString(
                java.util.Arrays.copyOf(changelog(1, 5, 0, 1).toBytes(), 20));

        assertTrue(registry.decodeEvent(ProgramRole.TREE, cut).isEmpty());
    }

    @Test
    @DisplayName("unsupported leaf schema variant is not swallowed")
    void unsupportedVariantPropagates() {
        String payload = leafSchemaVariant(2, 1, 2, 3).toBase64();

        assertThrows(UnsupportedSchemaVersionException.class,
                () -> registry.decodeEvent(ProgramRole.TOKEN, payload));
    }

    @Test
    @DisplayName("missing program id for a schema role fails at startup")
    void missingProgramId() {
        LeafLogProperties properties = new LeafLogProperties();
        properties.getPrograms().setTreeProgramId(" ");

        assertThrows(IllegalStateException.class, () -> new ConfiguredProgramRegistry(
                properties, List.of(new TreeProgramEventSchema())));
    }
}
