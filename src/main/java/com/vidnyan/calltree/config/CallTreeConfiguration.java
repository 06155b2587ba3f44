package com.vidnyan.calltree.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.calltree.adapter.out.parser.RteClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for call-tree components.
 */
@Slf4j
@Configuration
public class CallTreeConfiguration {

    /**
     * ObjectMapper for the JSON report.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public RteClassifier rteClassifier(CallTreeProperties properties) {
        log.info("RTE calls recognized by prefix '{}'", properties.getRtePrefix());
        return new RteClassifier(properties.getRtePrefix());
    }
}
