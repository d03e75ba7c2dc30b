package com.kopo.letterrush.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {
    @Bean
    public OpenAPI openAPI() {
        Info info = new Info()
                .title("Letter Rush API Documentation")
                .version("1.0.0")
                .description("Room, round, answer and voting API of the Letter Rush category word game.");
        return new OpenAPI()
                .components(new Components())
                .info(info);
    }
}
