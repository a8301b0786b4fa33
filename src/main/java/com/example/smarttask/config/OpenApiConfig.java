package com.example.smarttask.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Smart Task Management API",
        version = "1.0.0",
        description = "A RESTful API for managing tasks with intelligent suggestions"
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI(@Value("${app.version:1.0.0}") String version) {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Smart Task Management API")
            .version(version)
            .description("Task CRUD, statistics and keyword-driven task suggestions.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi tasksApi() {
    return GroupedOpenApi.builder()
        .group("tasks")
        .packagesToScan("com.example.smarttask.controller")
        .pathsToMatch("/", "/tasks/**")
        .build();
  }
}
