package com.vidnyan.introspect.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.introspect.domain.patch.NamespacePatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the model engine.
 */
@Slf4j
@Configuration
public class IntrospectConfiguration {

    /**
     * ObjectMapper for element trees and reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log registered patch hooks on startup.
     */
    @Bean
    public String logPatches(List<NamespacePatch> patches) {
        log.info("Registered {} namespace patches:", patches.size());
        patches.forEach(p -> log.info("  - {}", p.name()));
        return "patches-logged";
    }
}
