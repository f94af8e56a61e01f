package com.jreinhal.covenant.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Interactive API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:covenant}")
    private String appName;

    @Bean
    public OpenAPI covenantOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Covenant Contract Retrieval API")
                        .version("1.0.0")
                        .description("""
                                Ingests contracts and NDAs, searches them with hybrid vector and keyword
                                ranking, and answers questions with citations to document, page and clause.

                                Service: %s
                                """.formatted(this.appName)))
                .servers(List.of(new Server().url("/").description("Current Server")))
                .tags(List.of(
                        new Tag().name("Documents").description("Upload, status, reprocess and delete"),
                        new Tag().name("Retrieval").description("Hybrid search and grounded answers"),
                        new Tag().name("Admin").description("Bulk reindex, progress and worker pool statistics")
                ));
    }
}
