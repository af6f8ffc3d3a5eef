package com.tazifor.rotator.controller;

import com.tazifor.rotator.model.InventoryStats;
import com.tazifor.rotator.service.RotationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Monitoring endpoints
 */
@RestController
@RequestMapping("/api")
public class InventoryController {

    @Autowired
    private RotationService rotationService;

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
            "status", rotationService.isReady() ? "UP" : "LOADING",
            "service", "Banner Rotator"
        ));
    }

    /**
     * GET /api/inventory/stats
     *
     * Remaining counts are read banner by banner, not as one snapshot.
     */
    @GetMapping("/inventory/stats")
    public ResponseEntity<InventoryStats> stats() {
        return ResponseEntity.ok(rotationService.stats());
    }
}
