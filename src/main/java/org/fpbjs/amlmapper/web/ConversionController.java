package org.fpbjs.amlmapper.web;

import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.FpbAmlConversionService;
import org.fpbjs.amlmapper.MappingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Conversion endpoints. Request bodies are read as plain text whatever their content type.
 * Every failed conversion is answered with 400 and {"error": message}.
 */
@Slf4j
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api")
public class ConversionController {
    private final FpbAmlConversionService conversionService;

    public ConversionController(FpbAmlConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @PostMapping("/to-aml")
    public ResponseEntity<String> toAml(@RequestBody(required = false) String body) {
        log.info("Received to-aml request ({} chars)", body != null ? body.length() : 0);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(conversionService.toAml(body));
    }

    @PostMapping("/to-json")
    public ResponseEntity<String> toJson(@RequestBody(required = false) String body) {
        log.info("Received to-json request ({} chars)", body != null ? body.length() : 0);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(conversionService.toJson(body));
    }

    @ExceptionHandler(MappingException.class)
    public ResponseEntity<Map<String, String>> handleMappingException(MappingException e) {
        log.warn("Conversion failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleUnexpectedException(RuntimeException e) {
        log.error("Conversion failed unexpectedly", e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message));
    }
}
