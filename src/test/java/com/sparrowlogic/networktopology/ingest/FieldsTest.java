package com.sparrowlogic.networktopology.ingest;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldsTest {

    @Test
    void shouldDefaultMissingStrings() {
        Map<String, Object> record = Map.of("State", "available");

        assertEquals("available", Fields.str(record, "State"));
        assertEquals("", Fields.str(record, "Name"));
        assertEquals("unknown", Fields.str(record, "ResourceType", "unknown"));
        assertNull(Fields.optStr(Map.of("PrefixListId", ""), "PrefixListId"));
    }

    @Test
    void shouldReadNumbersFromNumbersAndStrings() {
        Map<String, Object> record = Map.of("asn", 64512, "vlan", "101", "mtu", "jumbo");

        assertEquals(64512L, Fields.lng(record, "asn", 0));
        assertEquals(101, Fields.integer(record, "vlan", 0));
        assertEquals(1500, Fields.integer(record, "mtu", 1500));
    }

    @Test
    void shouldReadBooleansFromBooleansAndStrings() {
        assertTrue(Fields.bool(Map.of("Main", true), "Main"));
        assertTrue(Fields.bool(Map.of("Main", "true"), "Main"));
        assertFalse(Fields.bool(Map.of(), "Main"));
    }

    @Test
    void shouldKeepOnlyObjectsInLists() {
        Map<String, Object> record = Map.of("Routes", List.of(Map.of("State", "active"), "junk", 42));

        assertEquals(1, Fields.list(record, "Routes").size());
        assertTrue(Fields.list(Map.of("Routes", "not a list"), "Routes").isEmpty());
    }

    @Test
    void shouldFindNameTagInEitherSpelling() {
        Map<String, Object> ec2 = Map.of("Tags", List.of(Map.of("Key", "env", "Value", "prod"),
            Map.of("Key", "Name", "Value", "core")));
        Map<String, Object> dx = Map.of("tags", List.of(Map.of("key", "Name", "value", "dc-east")));

        assertEquals("core", Fields.tagName(ec2, "Tags"));
        assertEquals("dc-east", Fields.tagName(dx, "tags"));
        assertEquals("", Fields.tagName(Map.of(), "Tags"));
    }
}
