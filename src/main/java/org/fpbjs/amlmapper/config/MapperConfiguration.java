package org.fpbjs.amlmapper.config;

import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.util.IdGenerator;
import org.fpbjs.amlmapper.util.UuidIdGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MapperConfiguration {

    /**
     * The bundled configuration, or the file named by {@code fpb.mapper.config} when that property is set.
     */
    @Bean
    public MapperConfig mapperConfig(@Value("${fpb.mapper.config:}") String configFile) {
        if (configFile.isEmpty()) {
            return MapperConfigHelper.loadDefault();
        }
        return MapperConfigHelper.loadConfigFile(configFile);
    }

    @Bean
    public IdGenerator idGenerator() {
        return new UuidIdGenerator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
