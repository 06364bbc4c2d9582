package org.fpbjs.amlmapper.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.MappingException;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class MapperConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "fpb-aml-mapper.json";
    private static final String SCHEMA_RESOURCE = "schemas/mapper_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final ResourceLoader resourceLoader = new DefaultResourceLoader();

    /**
     * Loads the bundled configuration from the classpath. Falls back to defaults when the resource is missing.
     */
    public static MapperConfig loadDefault() {
        Resource resource = resourceLoader.getResource("classpath:" + DEFAULT_CONFIG_RESOURCE);
        if (!resource.exists()) {
            log.warn("Configuration resource {} not found, using defaults", DEFAULT_CONFIG_RESOURCE);
            return new MapperConfig();
        }

        try (InputStream in = resource.getInputStream()) {
            return fromJson(mapper.readTree(in), DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new MappingException("Failed to read configuration: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from disk.
     *
     * @param configFilePath path of a JSON configuration file
     * @return the validated configuration
     * @throws MappingException if the file cannot be read or does not match the schema
     */
    public static MapperConfig loadConfigFile(String configFilePath) {
        try {
            return fromJson(mapper.readTree(new File(configFilePath)), configFilePath);
        } catch (IOException e) {
            throw new MappingException("Failed to read configuration: " + configFilePath, e);
        }
    }

    static MapperConfig fromJson(JsonNode configNode, String source) {
        validate(configNode, source);
        try {
            MapperConfig config = mapper.treeToValue(configNode, MapperConfig.class);
            log.debug("Loaded configuration from {}", source);
            return config;
        } catch (IOException e) {
            throw new MappingException("Failed to bind configuration: " + source, e);
        }
    }

    public static void validate(JsonNode configNode, String source) {
        try (InputStream schemaStream = MapperConfigHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }

            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            Set<ValidationMessage> result = schema.validate(configNode);
            if (!result.isEmpty()) {
                String messages = result.stream()
                        .map(ValidationMessage::getMessage)
                        .sorted()
                        .collect(Collectors.joining("; "));
                throw new MappingException("Invalid configuration " + source + ": " + messages);
            }
        } catch (IOException e) {
            throw new MappingException("Failed to read schema: " + SCHEMA_RESOURCE, e);
        }
    }
}
