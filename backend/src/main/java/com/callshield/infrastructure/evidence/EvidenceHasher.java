package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.session.model.TranscriptEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 content hashes over a canonical JSON form (sorted properties, ISO timestamps).
 * Every hash is a pure function of its inputs.
 */
@Component
public class EvidenceHasher {

    private static final Comparator<ExtractedEntity> CANONICAL_ENTITY_ORDER = Comparator
            .comparing((ExtractedEntity e) -> e.type().name())
            .thenComparing(ExtractedEntity::originalValue)
            .thenComparingInt(ExtractedEntity::startPos);

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .addModule(new JavaTimeModule())
            .build();

    public String hashAudio(String audioReference) {
        return sha256(audioReference == null ? "" : audioReference);
    }

    public String hashTranscript(List<TranscriptEntry> transcript) {
        return sha256(canonicalJson(transcript));
    }

    public String hashEntities(List<ExtractedEntity> entities) {
        return sha256(canonicalJson(canonicalEntities(entities)));
    }

    public String hashPackage(String audioHash, String transcriptHash, String entityHash, EvidenceMetadata metadata) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("audio_hash", audioHash);
        content.put("transcript_hash", transcriptHash);
        content.put("entity_hash", entityHash);
        content.put("metadata", metadata);
        return sha256(canonicalJson(content));
    }

    static List<ExtractedEntity> canonicalEntities(List<ExtractedEntity> entities) {
        return entities.stream().sorted(CANONICAL_ENTITY_ORDER).toList();
    }

    private String canonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Evidence content is not serializable", e);
        }
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
