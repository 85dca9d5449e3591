package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.ChangeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ViewRegistryTest {

    private ViewRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ViewRegistry();
        registry.registerStandardViews("member", "name", "status");
    }

    @Test
    void testUpdateOnlyHitsViewsReferencingChangedFields() {
        Set<ViewKey> affected = registry.affectedFamilies(ChangeKind.UPDATE, "member", Set.of("phone"));

        // Only the detail view shows every field
        assertEquals(Set.of(ViewDefinition.detail("member").getFamily()), affected);
    }

    @Test
    void testStatusChangeHitsListAndStatusCounts() {
        Set<ViewKey> affected = registry.affectedFamilies(ChangeKind.UPDATE, "member", Set.of("status"));

        assertTrue(affected.contains(ViewKey.list("member")));
        assertTrue(affected.contains(ViewKey.countByStatus("member")));
        assertFalse(affected.contains(ViewKey.count("member")));
    }

    @Test
    void testMembershipChangesHitAllCollections() {
        Set<ViewKey> affected = registry.affectedFamilies(ChangeKind.INSERT, "member", null);

        assertTrue(affected.contains(ViewKey.list("member")));
        assertTrue(affected.contains(ViewKey.count("member")));
        assertTrue(affected.contains(ViewKey.countByStatus("member")));
        assertTrue(registry.affectedFamilies(ChangeKind.INSERT, "invoice", null).isEmpty());
    }

    @Test
    void testLinksAreFollowedTransitively() {
        registry.registerStandardViews("household", "name");
        ViewKey dashboard = ViewKey.custom("dashboard", "summary", Map.of());
        registry.register(ViewDefinition.builder(dashboard).membershipSensitive(false).build());

        registry.link(ViewKey.count("member"), ViewKey.list("household"));
        registry.link(ViewKey.list("household"), dashboard);

        Set<ViewKey> affected = registry.affectedFamilies(ChangeKind.DELETE, "member", null);
        assertTrue(affected.contains(ViewKey.list("household")));
        assertTrue(affected.contains(dashboard));
        assertEquals(Set.of(ViewKey.list("household"), dashboard), registry.invalidates(ViewKey.count("member")));
    }

    @Test
    void testCyclicLinksTerminate() {
        registry.link(ViewKey.list("member"), ViewKey.count("member"));
        registry.link(ViewKey.count("member"), ViewKey.list("member"));

        assertEquals(Set.of(ViewKey.count("member")), registry.invalidates(ViewKey.list("member")));
    }

    @Test
    void testDefinitionLookupByConcreteKey() {
        assertTrue(registry.getDefinition(ViewKey.detail("member", "m1")).isPresent());
        assertTrue(registry.getDefinition(ViewKey.list("member", Map.of("status", "active"))).isPresent());
        assertFalse(registry.getDefinition(ViewKey.search("member", "ann")).isPresent());
        assertEquals(4, registry.definitionsFor("member").size());
    }
}
