package com.resolveai.ingestor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resolveai.entry.services.EntryDeserializer;
import com.resolveai.entry.services.EntrySerializer;
import com.resolveai.entry.services.InsertIdGenerator;
import com.resolveai.entry.services.StructConverter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EntryCodecProperties.class)
public class EntryCodecConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InsertIdGenerator insertIdGenerator() {
        return InsertIdGenerator.getDefault();
    }

    @Bean
    public StructConverter structConverter(ObjectMapper objectMapper) {
        return new StructConverter(objectMapper);
    }

    @Bean
    public EntrySerializer entrySerializer(ObjectMapper objectMapper, StructConverter structConverter) {
        return new EntrySerializer(objectMapper, structConverter);
    }

    @Bean
    public EntryDeserializer entryDeserializer(ObjectMapper objectMapper, StructConverter structConverter,
                                               Clock clock, InsertIdGenerator insertIdGenerator) {
        return new EntryDeserializer(objectMapper, structConverter, clock, insertIdGenerator);
    }
}
