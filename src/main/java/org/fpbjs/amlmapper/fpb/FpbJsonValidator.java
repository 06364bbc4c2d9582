package org.fpbjs.amlmapper.fpb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.fpbjs.amlmapper.MappingException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural check of FPB.JS input against schemas/fpb_document_schema.json before it is converted.
 */
public class FpbJsonValidator {
    public static final String SCHEMA_RESOURCE = "schemas/fpb_document_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static JsonSchema schema;

    /**
     * @throws MappingException listing every violation if the document does not match the schema
     */
    public static void validate(JsonNode document) {
        Set<ValidationMessage> errors = documentSchema().validate(document);
        if (!errors.isEmpty()) {
            String messages = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new MappingException("Invalid FPB.JS document: " + messages);
        }
    }

    private static synchronized JsonSchema documentSchema() {
        if (schema != null) {
            return schema;
        }
        try (InputStream schemaStream = FpbJsonValidator.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema;
        } catch (IOException e) {
            throw new MappingException("Failed to read schema: " + SCHEMA_RESOURCE, e);
        }
    }
}
