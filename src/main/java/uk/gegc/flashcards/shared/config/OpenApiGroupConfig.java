package uk.gegc.flashcards.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI flashcardsOpenApi() {
        return new OpenAPI()
                .info(new Info().title("Flashcards API").version("v1"))
                .components(new Components().addSecuritySchemes("bearerAuth",
                        new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi flashcardsGroup() {
        return GroupedOpenApi.builder()
                .group("flashcards")
                .displayName("Flashcards")
                .pathsToMatch("/api/v1/flashcards/**")
                .build();
    }

    @Bean
    public GroupedOpenApi generationGroup() {
        return GroupedOpenApi.builder()
                .group("generation")
                .displayName("AI Generation Requests")
                .pathsToMatch("/api/v1/generation-requests/**")
                .build();
    }

    @Bean
    public GroupedOpenApi studyGroup() {
        return GroupedOpenApi.builder()
                .group("study")
                .displayName("Study Sessions")
                .pathsToMatch("/api/v1/study-sessions/**")
                .build();
    }
}
