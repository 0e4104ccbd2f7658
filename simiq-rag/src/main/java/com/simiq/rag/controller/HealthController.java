package com.simiq.rag.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @GetMapping("/")
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "ok",
                "service", "Similar Product Recommendation Service"
        );
    }
}
