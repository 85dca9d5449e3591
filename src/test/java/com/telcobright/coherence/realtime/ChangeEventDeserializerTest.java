package com.telcobright.coherence.realtime;

import com.telcobright.coherence.entity.ChangeKind;
import com.telcobright.coherence.remote.ChangeEvent;
import com.telcobright.coherence.remote.ErrorKind;
import com.telcobright.coherence.remote.RemoteStoreException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ChangeEventDeserializerTest {

    private final ChangeEventDeserializer deserializer = new ChangeEventDeserializer("version");

    @Test
    void testUpdateWithVersionField() {
        ChangeEvent event = deserializer.deserialize("{\"eventType\":\"UPDATE\",\"schema\":\"public\","
            + "\"table\":\"member\",\"commit_timestamp\":\"2024-03-01T10:00:00Z\","
            + "\"new\":{\"id\":\"m1\",\"name\":\"Ann\",\"version\":7},\"old\":{\"id\":\"m1\"}}");

        assertEquals(ChangeKind.UPDATE, event.getType());
        assertEquals("member", event.getEntity().getEntityType());
        assertEquals("m1", event.getEntityId());
        assertEquals(7, event.getEntity().getVersion());
        assertEquals("Ann", event.getEntity().getString("name"));
        assertFalse(event.getEntity().getFields().containsKey("version"));
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), event.getCommittedAt());
        // An old record holding only the key says nothing about previous values
        assertNull(event.getPrevious());
    }

    @Test
    void testVersionFallsBackToUpdatedAt() {
        ChangeEvent event = deserializer.deserialize("{\"eventType\":\"insert\",\"table\":\"member\","
            + "\"new\":{\"id\":\"m2\",\"updated_at\":\"2024-03-01T10:00:00Z\"}}");

        assertEquals(ChangeKind.INSERT, event.getType());
        assertEquals(1709287200000L, event.getEntity().getVersion());
    }

    @Test
    void testUpdateCarriesFullPreviousRecord() {
        ChangeEvent event = deserializer.deserialize("{\"eventType\":\"UPDATE\",\"table\":\"member\","
            + "\"new\":{\"id\":\"m1\",\"status\":\"inactive\",\"version\":3},"
            + "\"old\":{\"id\":\"m1\",\"status\":\"active\",\"version\":2}}");

        assertNotNull(event.getPrevious());
        assertEquals(2, event.getPrevious().getVersion());
        assertEquals(Set.of("status"), event.getEntity().changedFields(event.getPrevious()));
    }

    @Test
    void testDeleteUsesOldRecord() {
        ChangeEvent event = deserializer.deserialize("{\"eventType\":\"DELETE\",\"table\":\"member\","
            + "\"commit_timestamp\":\"2024-03-01T10:00:00Z\",\"new\":{},"
            + "\"old\":{\"id\":\"m1\",\"name\":\"Ann\"}}");

        assertEquals(ChangeKind.DELETE, event.getType());
        assertEquals("m1", event.getEntityId());
        assertEquals(1709287200000L, event.getEntity().getVersion());
    }

    @Test
    void testMalformedPayloadsAreValidationErrors() {
        String[] payloads = {
            "{not json",
            "{\"table\":\"member\",\"new\":{\"id\":\"m1\"}}",
            "{\"eventType\":\"TRUNCATE\",\"table\":\"member\",\"new\":{\"id\":\"m1\"}}",
            "{\"eventType\":\"INSERT\",\"table\":\"member\",\"new\":{\"name\":\"no id\"}}"
        };
        for (String payload : payloads) {
            RemoteStoreException error = assertThrows(RemoteStoreException.class,
                () -> deserializer.deserialize(payload), payload);
            assertEquals(ErrorKind.VALIDATION_ERROR, error.getKind());
        }
    }
}
