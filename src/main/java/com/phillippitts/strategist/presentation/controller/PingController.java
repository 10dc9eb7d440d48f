package com.phillippitts.strategist.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Lightweight liveness endpoint. The request traverses the MDC filter, so its log line shows
 * the structured context (requestId, method, uri).
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final Clock clock;

    PingController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", clock.instant().toString()
        ));
    }
}
