package com.leaflog.event;

import com.leaflog.config.LeafLogProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Program registry built from configuration.
 *
 * Program ids come from "leaflog.programs.*"; each {@link EventSchema} bean is
 * registered under the id of the role it serves. Both schema tables are
 * read-only after construction, so one instance serves every transaction.
 */
@Component
@Slf4j
public class ConfiguredProgramRegistry implements ProgramRegistry {

    private final Map<ProgramRole, String> programIds = new EnumMap<>(ProgramRole.class);
    private final Map<String, EventSchema> schemasByProgram = new HashMap<>();

    public ConfiguredProgramRegistry(LeafLogProperties properties, List<EventSchema> schemas) {
        programIds.put(ProgramRole.TREE, properties.getPrograms().getTreeProgramId());
        programIds.put(ProgramRole.TOKEN, properties.getPrograms().getTokenProgramId());

        for (EventSchema schema : schemas) {
            String programId = programIds.get(schema.role());
            if (programId == null || programId.isBlank()) {
                throw new IllegalStateException("No program id configured for role " + schema.role());
            }
            schemasByProgram.put(programId, schema);
        }
        log.info("Program registry: tree={}, token={}",
                programIds.get(ProgramRole.TREE), programIds.get(ProgramRole.TOKEN));
    }

    @Override
    public String programId(ProgramRole role) {
        return programIds.get(role);
    }

    @Override
    public Optional<DecodedEvent> decodeEvent(String programId, String base64Payload) {
        EventSchema schema = schemasByProgram.get(programId);
        if (schema == null || base64Payload == null) {
            return Optional.empty();
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(base64Payload);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring non-base64 data line for program {}: {}", programId, e.getMessage());
            return Optional.empty();
        }

        try {
            return schema.decode(payload);
        } catch (EventDecodingException e) {
            log.debug("Ignoring undecodable event for program {}: {}", programId, e.getMessage());
            return Optional.empty();
        }
    }
}
