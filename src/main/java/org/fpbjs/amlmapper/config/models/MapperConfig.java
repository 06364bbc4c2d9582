package org.fpbjs.amlmapper.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Mapper configuration, read from fpb-aml-mapper.json.
 * Every field has a default, so an empty object is a valid configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MapperConfig {
    /**
     * Name written into the FPB.JS project header.
     */
    public String projectName = "FPBJS_Project";

    /**
     * Target namespace written into the FPB.JS project header.
     */
    public String targetNamespace = "http://www.hsu-ifa.de/fpbjs";

    /**
     * FileName attribute of the generated CAEXFile.
     */
    public String fileName = "fpb-export.aml";

    /**
     * SourceDocumentInformation of the generated CAEXFile.
     * Example: {"originName": "fpb-aml-mapper", "originId": "fpb-aml-mapper-1.0", "originVersion": "0.1.0"}
     */
    public String originName = "fpb-aml-mapper";
    public String originId = "fpb-aml-mapper-1.0";
    public String originVersion = "0.1.0";

    /**
     * Deepest process decomposition accepted in either direction. The entry process has depth 0.
     */
    public int maxDecompositionDepth = 32;
}
