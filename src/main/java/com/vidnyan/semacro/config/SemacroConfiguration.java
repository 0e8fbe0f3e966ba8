package com.vidnyan.semacro.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.semacro.parser.DefinitionParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for semacro components.
 */
@Configuration
public class SemacroConfiguration {

    /**
     * ObjectMapper for JSON output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public DefinitionParser definitionParser() {
        return new DefinitionParser();
    }
}
