package com.replymail.controller;

import com.replymail.domain.ConversationTurn;
import com.replymail.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation history REST API
 * - Turns exchanged with one sender (GET /api/conversations/{sender})
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    /**
     * GET /api/conversations/{sender}?limit=20
     */
    @GetMapping("/{sender}")
    public ResponseEntity<Map<String, Object>> history(@PathVariable String sender,
                                                       @RequestParam(required = false) Integer limit) {
        if (sender == null || !sender.contains("@")) {
            return errorResponse(HttpStatus.BAD_REQUEST, "sender must be an email address.");
        }
        List<ConversationTurn> turns = limit == null
                ? conversationService.history(sender)
                : conversationService.recent(sender, limit);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("sender", sender);
        response.put("count", turns.size());
        response.put("turns", turns);

        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
