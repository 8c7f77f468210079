package com.aero.controller;

import com.aero.model.CacheStatistics;
import com.aero.service.GatewayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final GatewayService gatewayService;

    public CacheController(GatewayService gatewayService) {
        this.gatewayService = gatewayService;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(gatewayService.getCacheStats());
    }

    /**
     * Clear the response cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        gatewayService.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Response cache cleared"
        ));
    }
}
