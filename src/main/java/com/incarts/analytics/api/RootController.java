package com.incarts.analytics.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
public class RootController {

    static final String WELCOME = "Welcome to the Analytics Data API. See /api/v1 for the report endpoints.";

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        log.info("Received root request");
        return ResponseEntity.ok(Map.of("message", WELCOME));
    }
}
