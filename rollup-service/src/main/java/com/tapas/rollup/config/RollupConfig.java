package com.tapas.rollup.config;

import com.tapas.rollup.schema.PropertiesSchemaResolver;
import com.tapas.rollup.schema.SchemaResolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RollupProperties.class)
public class RollupConfig {

    @Bean
    public SchemaResolver schemaResolver(RollupProperties properties) {
        return new PropertiesSchemaResolver(properties.getSchema());
    }
}
