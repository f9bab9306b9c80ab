package com.strollie.planner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI plannerOpenAPI(@Value("${server.port:8082}") int port, PlannerProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Itinerary Planner API")
                        .description("Пешеходные маршруты по городу " + properties.getCity()
                                + ": подбор мест, расписание с учётом часов работы, кофе-паузы и пояснения")
                        .version("v1")
                        .contact(new Contact()
                                .name("Strollie")
                                .email("support@strollie.com")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Локальная среда")));
    }

    @Bean
    public GroupedOpenApi routesGroup() {
        return GroupedOpenApi.builder()
                .group("routes")
                .packagesToScan("com.strollie.planner.web")
                .pathsToMatch("/api/routes/**")
                .build();
    }

    @Bean
    public GroupedOpenApi categoriesGroup() {
        return GroupedOpenApi.builder()
                .group("categories")
                .packagesToScan("com.strollie.planner.web")
                .pathsToMatch("/api/categories/**")
                .build();
    }
}
