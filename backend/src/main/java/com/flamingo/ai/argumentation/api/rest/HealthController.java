package com.flamingo.ai.argumentation.api.rest;

import com.flamingo.ai.argumentation.service.tagging.TaggingModelService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final TaggingModelService taggingModelService;

  /** Returns a simple health check response including tagging model readiness. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "argumentation");
    health.put("taggingModelReady", taggingModelService.isReady());
    return ResponseEntity.ok(health);
  }
}
