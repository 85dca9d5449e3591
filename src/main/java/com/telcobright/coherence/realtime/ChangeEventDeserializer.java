package com.telcobright.coherence.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcobright.coherence.entity.ChangeKind;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntityVersions;
import com.telcobright.coherence.remote.ChangeEvent;
import com.telcobright.coherence.remote.ErrorKind;
import com.telcobright.coherence.remote.RemoteStoreException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes change-feed JSON into {@link ChangeEvent}s.
 *
 * The version comes from the configured version field when the record has it,
 * otherwise from {@code updated_at}, otherwise from the commit timestamp.
 */
public class ChangeEventDeserializer {

    public static final String ID_FIELD = "id";
    public static final String UPDATED_AT_FIELD = "updated_at";

    private final ObjectMapper objectMapper;
    private final String versionField;

    public ChangeEventDeserializer(String versionField) {
        this(new ObjectMapper(), versionField);
    }

    public ChangeEventDeserializer(ObjectMapper objectMapper, String versionField) {
        this.objectMapper = objectMapper;
        this.versionField = versionField;
    }

    /**
     * @throws RemoteStoreException with VALIDATION_ERROR for malformed payloads
     */
    public ChangeEvent deserialize(String json) {
        ChangePayload payload;
        try {
            payload = objectMapper.readValue(json, ChangePayload.class);
        } catch (JsonProcessingException e) {
            throw new RemoteStoreException(ErrorKind.VALIDATION_ERROR, "Malformed change payload: " + e.getOriginalMessage(), e);
        }
        return toEvent(payload);
    }

    public ChangeEvent toEvent(ChangePayload payload) {
        if (payload.eventType == null || payload.table == null) {
            throw new RemoteStoreException(ErrorKind.VALIDATION_ERROR, "Change payload lacks eventType or table");
        }
        ChangeKind kind;
        try {
            kind = ChangeKind.valueOf(payload.eventType.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RemoteStoreException(ErrorKind.VALIDATION_ERROR, "Unknown change type: " + payload.eventType, e);
        }
        Instant committedAt = payload.commitTimestamp != null
            ? Instant.ofEpochMilli(EntityVersions.fromTimestamp(payload.commitTimestamp))
            : null;

        Map<String, Object> record = kind == ChangeKind.DELETE ? payload.oldRecord : payload.newRecord;
        if (record == null || record.get(ID_FIELD) == null) {
            throw new RemoteStoreException(ErrorKind.VALIDATION_ERROR,
                kind + " payload for " + payload.table + " has no record id");
        }
        Entity entity = toEntity(payload.table, record, payload.commitTimestamp);

        Entity previous = null;
        if (kind == ChangeKind.UPDATE && payload.oldRecord != null && payload.oldRecord.size() > 1
                && payload.oldRecord.get(ID_FIELD) != null) {
            previous = toEntity(payload.table, payload.oldRecord, null);
        }
        return new ChangeEvent(kind, entity, previous, committedAt);
    }

    private Entity toEntity(String table, Map<String, Object> record, String commitTimestamp) {
        Map<String, Object> fields = new LinkedHashMap<>(record);
        String id = String.valueOf(fields.remove(ID_FIELD));
        Object version = fields.remove(versionField);
        return Entity.builder()
            .entityType(table)
            .id(id)
            .version(versionOf(version, record, commitTimestamp))
            .fields(fields)
            .build();
    }

    private long versionOf(Object version, Map<String, Object> record, String commitTimestamp) {
        if (version instanceof Number) {
            return ((Number) version).longValue();
        }
        if (version instanceof String) {
            return Long.parseLong((String) version);
        }
        Object updatedAt = record.get(UPDATED_AT_FIELD);
        if (updatedAt instanceof String) {
            return EntityVersions.fromTimestamp((String) updatedAt);
        }
        if (commitTimestamp != null) {
            return EntityVersions.fromTimestamp(commitTimestamp);
        }
        return 0L;
    }
}
