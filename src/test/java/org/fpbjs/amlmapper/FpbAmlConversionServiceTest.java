package org.fpbjs.amlmapper;

import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.util.SequentialIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FpbAmlConversionServiceTest {
    private FpbAmlConversionService service;

    @BeforeEach
    void setUp() {
        service = new FpbAmlConversionService(new MapperConfig(), new SequentialIdGenerator(), Fixtures.fixedClock());
    }

    @Test
    void shouldConvertJsonToAml() {
        String xml = service.toAml(Fixtures.read("simple-process.json"));

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
        assertTrue(xml.contains("LastWritingDateTime=\"2024-05-01T12:00:00.000Z\""));
        assertTrue(xml.contains("<InternalLink Name=\"Link\""));
    }

    @Test
    void shouldConvertAmlToPrettyJson() {
        String json = service.toJson(Fixtures.read("simple-process.aml"));

        assertTrue(json.startsWith("[\n    {"), json);
        assertTrue(json.contains("\"entryPoint\": \"id-2\""));
        assertTrue(json.contains("\"uniqueIdent\": \"product-1\""));
        assertTrue(json.contains("\"markers\": {}"));
    }

    @Test
    void shouldValidateJsonBeforeMapping() {
        MappingException e = assertThrows(MappingException.class,
                () -> service.toAml("[{\"name\": \"no type\"}]"));
        assertTrue(e.getMessage().startsWith("Invalid FPB.JS document: "));
    }

    @Test
    void shouldRejectEmptyInput() {
        assertEquals("FPB.JS document is empty", assertThrows(MappingException.class, () -> service.toAml(null)).getMessage());
        assertEquals("AML document is empty", assertThrows(MappingException.class, () -> service.toJson("")).getMessage());
    }

    @Test
    void shouldReportMissingProcess() {
        String xml = "<CAEXFile xmlns=\"http://www.dke.de/CAEX\"><InstanceHierarchy Name=\"IH\"/></CAEXFile>";

        assertEquals("No FPD_Process found in InstanceHierarchy",
                assertThrows(MappingException.class, () -> service.toJson(xml)).getMessage());
    }
}
