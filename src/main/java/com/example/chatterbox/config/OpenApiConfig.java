package com.example.chatterbox.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI(@Value("${chatterbox.api.version:1.0}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("Chatterbox API")
                        .description("Message board: post, list, edit and delete short messages")
                        .version(version));
    }
}
