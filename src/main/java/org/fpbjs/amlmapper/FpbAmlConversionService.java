package org.fpbjs.amlmapper;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.aml.AmlToFpbParser;
import org.fpbjs.amlmapper.aml.AmlXmlHelper;
import org.fpbjs.amlmapper.aml.FpbToAmlGenerator;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.fpb.FpbJsonHelper;
import org.fpbjs.amlmapper.fpb.FpbJsonValidator;
import org.fpbjs.amlmapper.fpb.models.FpbDocument;
import org.fpbjs.amlmapper.util.IdGenerator;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;

import java.time.Clock;

/**
 * Text level conversions between FPB.JS JSON and AutomationML.
 * Each call works on its own document; the service keeps no state between calls.
 */
@Slf4j
@Component
public class FpbAmlConversionService {
    private final FpbToAmlGenerator generator;
    private final AmlToFpbParser parser;

    public FpbAmlConversionService(MapperConfig config, IdGenerator idGenerator, Clock clock) {
        this.generator = new FpbToAmlGenerator(config, idGenerator, clock);
        this.parser = new AmlToFpbParser(config, idGenerator);
    }

    /**
     * Converts FPB.JS JSON text to AML text.
     *
     * @throws MappingException if the JSON is malformed, fails validation or cannot be mapped
     */
    public String toAml(String json) {
        JsonNode root = FpbJsonHelper.parse(json);
        FpbJsonValidator.validate(root);
        FpbDocument document = FpbJsonHelper.readDocument(root);
        log.info("Converting FPB.JS document with {} process(es) to AML", document.processes().size());
        return AmlXmlHelper.toXmlString(toAmlDocument(document));
    }

    /**
     * Converts AML text to pretty printed FPB.JS JSON text.
     *
     * @throws MappingException if the XML is malformed or lacks the instance hierarchy or process
     */
    public String toJson(String xml) {
        FpbDocument document = toFpbDocument(AmlXmlHelper.parse(xml));
        log.info("Converted AML document to {} FPB.JS process(es)", document.processes().size());
        return FpbJsonHelper.toPrettyString(FpbJsonHelper.writeDocument(document));
    }

    public Document toAmlDocument(FpbDocument document) {
        return generator.generate(document);
    }

    public FpbDocument toFpbDocument(Document doc) {
        return parser.parse(doc);
    }
}
