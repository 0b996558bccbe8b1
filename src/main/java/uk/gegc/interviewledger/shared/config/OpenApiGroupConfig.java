package uk.gegc.interviewledger.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi interviewsGroup() {
        return GroupedOpenApi.builder()
                .group("interviews")
                .displayName("Interviews & Scoring")
                .pathsToMatch("/api/v1/interviews/**")
                .build();
    }

    @Bean
    public GroupedOpenApi organizationGroup() {
        return GroupedOpenApi.builder()
                .group("organization")
                .displayName("Organization Credits")
                .pathsToMatch("/api/v1/org/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Operations")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
