package com.workoutapi.refresh.controller;

import com.workoutapi.refresh.model.IdempotencyStats;
import com.workoutapi.refresh.model.RefreshRun;
import com.workoutapi.refresh.service.ExerciseRefreshService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Manual refresh runs and idempotency store inspection")
public class AdminController {

    private final ExerciseRefreshService refreshService;

    @Operation(summary = "Trigger Manual Refresh", description = "Runs one refresh batch over every exercise and returns per-exercise results and the run summary.")
    @ApiResponse(responseCode = "200", description = "Refresh run completed; check exitStatus for item failures")
    @ApiResponse(responseCode = "409", description = "Another refresh run is already in progress")
    @ApiResponse(responseCode = "503", description = "The run could not start")
    @GetMapping("/refresh")
    public ResponseEntity<RefreshRun> refresh() {
        log.info("🔄 ADMIN: Manual exercise refresh triggered");
        return ResponseEntity.ok(refreshService.refreshAll());
    }

    @Operation(summary = "Idempotency Store Stats", description = "Reports which store backs idempotency, how many keys it holds and the key TTL.")
    @ApiResponse(responseCode = "200", description = "Stats returned")
    @GetMapping("/idempotency/stats")
    public ResponseEntity<IdempotencyStats> idempotencyStats() {
        return ResponseEntity.ok(refreshService.idempotencyStats());
    }
}
