package com.replymail.controller;

import com.replymail.domain.ProcessedRecord;
import com.replymail.ledger.ProcessedLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processed ledger REST API
 * - List processed records (GET /api/ledger)
 * - Administrative reset (DELETE /api/ledger?confirm=true)
 */
@Slf4j
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final ProcessedLedger ledger;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        List<ProcessedRecord> records = ledger.records();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", records.size());
        response.put("records", records);

        return ResponseEntity.ok(response);
    }

    /**
     * Every processed message becomes eligible for a reply again
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> reset(@RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Reset requires confirm=true.");
        }
        int removed = ledger.reset();
        log.warn("Ledger reset via API: {} record(s) removed", removed);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Ledger reset.");
        response.put("removed", removed);

        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
