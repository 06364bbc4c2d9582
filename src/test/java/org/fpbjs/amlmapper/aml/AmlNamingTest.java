package org.fpbjs.amlmapper.aml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmlNamingTest {

    @Test
    void shouldKeepBareNameForFirstOccurrence() {
        assertEquals("Link", AmlNaming.indexedName("Link", 0));
        assertEquals("Link3", AmlNaming.indexedName("Link", 3));
    }

    @Test
    void shouldReadIndexFromSuffix() {
        assertEquals(0, AmlNaming.indexOf("FPD_Waypoint", "FPD_Waypoint"));
        assertEquals(12, AmlNaming.indexOf("FPD_Waypoint12", "FPD_Waypoint"));
        assertNull(AmlNaming.indexOf("FPD_WaypointA", "FPD_Waypoint"));
        assertNull(AmlNaming.indexOf("FPD_Waypoint-1", "FPD_Waypoint"));
        assertNull(AmlNaming.indexOf("PortCoordinate", "FPD_Waypoint"));
    }

    @Test
    void shouldCountPerOwnerAndBaseName() {
        AmlNaming.Counter counter = new AmlNaming.Counter();

        assertEquals("FPD_FlowOut", counter.next("a", "FPD_FlowOut"));
        assertEquals("FPD_FlowOut1", counter.next("a", "FPD_FlowOut"));
        assertEquals("FPD_FlowIn", counter.next("a", "FPD_FlowIn"));
        assertEquals("FPD_FlowOut", counter.next("b", "FPD_FlowOut"));
        assertEquals("FPD_FlowOut2", counter.next("a", "FPD_FlowOut"));
    }
}
