package com.nomadtap.tap.config;

import com.nomadtap.tap.schema.NomadStreams;
import com.nomadtap.tap.schema.SchemaRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class TapNomadConfiguration {

    @Bean
    public RestTemplate nomadRestTemplate(RestTemplateBuilder builder, TapNomadProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .build();
    }

    @Bean
    public SchemaRegistry schemaRegistry() {
        return NomadStreams.registry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
