package com.newsdesk.curation.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

@Configuration
public class OpenApiConfig {
    static final String ADMIN_KEY_SCHEME = "adminKey";

    /** Path prefix → tag shown in the Swagger UI. */
    private static final Map<String, String> SECTIONS = Map.of(
            "/actions", "Pipeline actions",
            "/articles", "Articles and feedback",
            "/newspapers", "Newspapers");

    @Bean
    public OpenAPI curationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Newsdesk Curation API")
                        .version("0.1.0")
                        .description("LLM enrichment, duplicate detection, downvote-based score adjustment and the daily newspaper."))
                .tags(SECTIONS.values().stream().sorted().map(name -> new Tag().name(name)).toList())
                .components(new Components().addSecuritySchemes(ADMIN_KEY_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("x-admin-key")));
    }

    @Bean
    public OpenApiCustomizer curationPathsCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement admin = new SecurityRequirement().addList(ADMIN_KEY_SCHEME);
            openAPI.getPaths().forEach((path, item) -> {
                SECTIONS.forEach((prefix, tag) -> {
                    if (path.startsWith(prefix)) operations(item).forEach(op -> op.setTags(List.of(tag)));
                });
                if (path.startsWith("/actions")) {
                    operations(item).forEach(op -> op.addSecurityItem(admin));
                } else if (path.equals("/newspapers/regenerate") && item.getPost() != null) {
                    item.getPost().addSecurityItem(admin);
                }
            });
        };
    }

    private static List<Operation> operations(PathItem item) {
        return item.readOperations();
    }
}
