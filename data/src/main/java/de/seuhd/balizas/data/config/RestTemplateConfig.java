package de.seuhd.balizas.data.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used to download DATEX2 publications.
 */
@Configuration
public class RestTemplateConfig {
    @Bean
    public RestTemplate datex2RestTemplate(RestTemplateBuilder builder, Datex2Properties properties) {
        return builder
                .setConnectTimeout(properties.timeout())
                .setReadTimeout(properties.timeout())
                .build();
    }
}
