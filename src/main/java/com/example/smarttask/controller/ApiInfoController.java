package com.example.smarttask.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "API Root")
public class ApiInfoController {

    private final String version;

    public ApiInfoController(@Value("${app.version:1.0.0}") String version) {
        this.version = version;
    }

    @Operation(summary = "Welcome message and API information")
    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Welcome to Smart Task Management API");
        body.put("version", version);
        body.put("documentation", "/swagger-ui.html");
        return body;
    }
}
