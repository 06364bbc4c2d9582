package org.fpbjs.amlmapper.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SequentialIdGeneratorTest {

    @Test
    void shouldCountFromOne() {
        IdGenerator ids = new SequentialIdGenerator();
        assertEquals("id-1", ids.nextId());
        assertEquals("id-2", ids.nextId());
    }

    @Test
    void shouldUsePrefix() {
        assertEquals("flow-1", new SequentialIdGenerator("flow-").nextId());
    }

    @Test
    void shouldGenerateDistinctUuids() {
        IdGenerator ids = new UuidIdGenerator();
        assertNotEquals(ids.nextId(), ids.nextId());
    }
}
