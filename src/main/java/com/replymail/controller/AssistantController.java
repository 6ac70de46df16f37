package com.replymail.controller;

import com.replymail.domain.CycleReport;
import com.replymail.domain.RunStatus;
import com.replymail.domain.TriggerResult;
import com.replymail.pipeline.MailPipelineOrchestrator;
import com.replymail.pipeline.PollingScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline control REST API
 * - Status (GET /api/assistant/status)
 * - Run once now (POST /api/assistant/trigger)
 */
@Slf4j
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private final MailPipelineOrchestrator orchestrator;
    private final PollingScheduler pollingScheduler;

    /**
     * Lock-free status snapshot
     * GET /api/assistant/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        RunStatus status = orchestrator.status();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("running", status.running());
        response.put("currentStage", status.currentStage());
        response.put("lastRunAt", status.lastRunAt() == null ? null : status.lastRunAt().toString());
        response.put("lastOutcome", status.lastOutcome());
        response.put("processedCount", status.processedCount());
        response.put("lastError", status.lastError());
        response.put("lastReport", reportMap(status.lastReport()));

        return ResponseEntity.ok(response);
    }

    /**
     * Manual trigger
     * POST /api/assistant/trigger
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger() {
        TriggerResult result = pollingScheduler.triggerNow();

        Map<String, Object> response = new LinkedHashMap<>();
        switch (result) {
            case ACCEPTED -> {
                response.put("status", "accepted");
                response.put("message", "Pipeline run started.");
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
            }
            case ALREADY_RUNNING -> {
                response.put("status", "already_running");
                response.put("message", "A pipeline run is already in progress.");
                return ResponseEntity.ok(response);
            }
            default -> {
                return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Pipeline is shutting down.");
            }
        }
    }

    private Map<String, Object> reportMap(CycleReport report) {
        if (report == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("startedAt", report.startedAt().toString());
        map.put("finishedAt", report.finishedAt().toString());
        map.put("outcome", report.outcome());
        map.put("fetched", report.fetched());
        map.put("replied", report.replied());
        map.put("skipped", report.skipped());
        map.put("failed", report.failed());
        map.put("error", report.error());
        return map;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
