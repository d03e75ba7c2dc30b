package com.kopo.letterrush.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "Health Check", description = "Server liveness")
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Returns OK while the server is up.")
    public String healthCheck() {
        return "OK";
    }
}
