package com.jreinhal.docqa.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Interactive API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:docqa}")
    private String appName;

    @Value("${docqa.sessions.timeout-seconds:3600}")
    private long sessionTimeoutSeconds;

    @Bean
    public OpenAPI docQaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(appName + " API")
                        .description("""
                                Session-scoped question answering over uploaded documents.

                                Each upload creates a session holding one retrieval index. Sessions
                                idle for more than %d seconds are discarded; requests naming an
                                expired session get an explanatory message, not an error.

                                Typed questions (percentage, count, date, name) have their answers
                                checked against the retrieved text before being returned.
                                """.formatted(sessionTimeoutSeconds))
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current Server")
                ))
                .tags(List.of(
                        new Tag().name("Documents").description("Upload, ask, summarize, compare"),
                        new Tag().name("Sessions").description("Session listing and removal"),
                        new Tag().name("System").description("Health probes")
                ));
    }
}
