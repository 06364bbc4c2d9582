package org.fpbjs.amlmapper.fpb;

import org.fpbjs.amlmapper.Fixtures;
import org.fpbjs.amlmapper.MappingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FpbJsonValidatorTest {

    @Test
    void shouldAcceptFixtures() {
        assertDoesNotThrow(() -> FpbJsonValidator.validate(FpbJsonHelper.parse(Fixtures.read("simple-process.json"))));
        assertDoesNotThrow(() -> FpbJsonValidator.validate(FpbJsonHelper.parse(Fixtures.read("decomposed-process.json"))));
    }

    @Test
    void shouldRejectNonArrayDocument() {
        MappingException e = assertThrows(MappingException.class,
                () -> FpbJsonValidator.validate(FpbJsonHelper.parse("{\"$type\": \"fpb:Project\"}")));
        assertTrue(e.getMessage().startsWith("Invalid FPB.JS document: "), e.getMessage());
    }

    @Test
    void shouldRejectProcessWithoutId() {
        MappingException e = assertThrows(MappingException.class, () -> FpbJsonValidator.validate(
                FpbJsonHelper.parse("[{\"$type\": \"fpb:Project\"}, {\"process\": {\"parent\": null}}]")));
        assertTrue(e.getMessage().contains("id"), e.getMessage());
    }

    @Test
    void shouldRejectNonNumericWaypoint() {
        String json = """
                [
                  {"$type": "fpb:Project", "entryPoint": "p"},
                  {"process": {"id": "p"}, "elementVisualInformation": [
                    {"id": "f", "type": "fpb:Flow", "waypoints": [{"x": "left", "y": 1}]}
                  ]}
                ]
                """;

        assertThrows(MappingException.class, () -> FpbJsonValidator.validate(FpbJsonHelper.parse(json)));
    }

    @Test
    void shouldRejectEntryWithoutTypeOrProcess() {
        assertThrows(MappingException.class,
                () -> FpbJsonValidator.validate(FpbJsonHelper.parse("[{\"name\": \"orphan\"}]")));
    }
}
