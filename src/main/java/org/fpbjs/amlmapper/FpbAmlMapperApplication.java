package org.fpbjs.amlmapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HTTP front end: POST /api/to-aml and POST /api/to-json.
 */
@SpringBootApplication
public class FpbAmlMapperApplication {

    public static void main(String[] args) {
        SpringApplication.run(FpbAmlMapperApplication.class, args);
    }
}
