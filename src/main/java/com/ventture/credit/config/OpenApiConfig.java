package com.ventture.credit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI creditOpenAPI(CreditEngineProperties props) {
        return new OpenAPI()
                .info(new Info()
                        .title("Credit Decision API")
                        .description("Credit evaluation with per-feature explanations. Approval threshold "
                                + props.getThreshold() + ", explanation method " + props.getExplanation().getMethod())
                        .version("v1"))
                .tags(List.of(
                        new Tag().name("credit").description("Evaluate, simulate and explain applications"),
                        new Tag().name("model").description("Active model/schema pair and reload"),
                        new Tag().name("history").description("Recorded simulations and their summary")));
    }

    // the simulator only needs the scoring group; model and history are operator endpoints
    @Bean
    public GroupedOpenApi scoringApi() {
        return GroupedOpenApi.builder().group("scoring").pathsToMatch("/api/credit/**").build();
    }

    @Bean
    public GroupedOpenApi operationsApi() {
        return GroupedOpenApi.builder().group("operations").pathsToMatch("/api/model/**", "/api/history/**").build();
    }
}
