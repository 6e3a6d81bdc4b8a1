package com.imperium.companion.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI recoveryCompanionOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Recovery Companion API")
                        .description("康复陪伴引导式对话后端接口文档：对话流、签到、日记、成就")
                        .version("v0")
                        .contact(new Contact().name("Recovery Companion Team")))
                .servers(List.of(
                        new Server().url("http://localhost:8093").description("Local")
                ));
    }
}
