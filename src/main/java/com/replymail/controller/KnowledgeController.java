package com.replymail.controller;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.DocumentChunk;
import com.replymail.domain.IngestionResult;
import com.replymail.domain.ScoredChunk;
import com.replymail.exception.AssistantException;
import com.replymail.exception.IndexCapacityExceededException;
import com.replymail.exception.RetrievalUnavailableException;
import com.replymail.service.KnowledgeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Knowledge base REST API
 * - Add user document (POST /api/knowledge/documents)
 * - Add news article (POST /api/knowledge/articles)
 * - Upload PDF (POST /api/knowledge/documents/pdf)
 * - Remove document (DELETE /api/knowledge/documents/{documentId})
 * - Search (POST /api/knowledge/search)
 * - Stats (GET /api/knowledge/stats)
 */
@Slf4j
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeService knowledgeService;
    private final AssistantProperties properties;

    /**
     * POST /api/knowledge/documents
     * Body: { "title": "...", "content": "...", "topics": ["ai", "mail"] }
     */
    @PostMapping("/documents")
    public ResponseEntity<Map<String, Object>> addDocument(@RequestBody Map<String, Object> request) {
        String content = asString(request.get("content"));
        if (content == null || content.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "content is required.");
        }
        return ingest(() -> knowledgeService.ingestDocument(
                asString(request.get("title")), content, asTopics(request.get("topics"))));
    }

    /**
     * POST /api/knowledge/articles
     * Body: { "title": "...", "content": "...", "url": "...", "topics": [...] }
     */
    @PostMapping("/articles")
    public ResponseEntity<Map<String, Object>> addArticle(@RequestBody Map<String, Object> request) {
        String title = asString(request.get("title"));
        String content = asString(request.get("content"));
        if (title == null || title.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "title is required.");
        }
        if (content == null || content.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "content is required.");
        }
        return ingest(() -> knowledgeService.ingestArticle(
                title, content, asString(request.get("url")), asTopics(request.get("topics"))));
    }

    /**
     * POST /api/knowledge/documents/pdf (multipart: file, topics=a,b)
     */
    @PostMapping(value = "/documents/pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadPdf(@RequestParam("file") MultipartFile file,
                                                         @RequestParam(required = false) String topics) {
        String fileName = file.getOriginalFilename() == null ? "document.pdf" : file.getOriginalFilename();
        if (file.isEmpty()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "file is required.");
        }
        if (!fileName.toLowerCase().endsWith(".pdf")) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Only PDF files are supported.");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read upload {}", fileName, e);
            return errorResponse(HttpStatus.BAD_REQUEST, "Cannot read uploaded file.");
        }
        return ingest(() -> knowledgeService.ingestPdf(fileName, bytes, asTopics(topics)));
    }

    /**
     * DELETE /api/knowledge/documents/{documentId}
     */
    @DeleteMapping("/documents/{documentId}")
    public ResponseEntity<Map<String, Object>> removeDocument(@PathVariable String documentId) {
        int removed;
        try {
            removed = knowledgeService.removeDocument(documentId);
        } catch (RetrievalUnavailableException e) {
            log.error("Removal of {} failed: {}", documentId, e.getMessage());
            return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Retrieval index unavailable.");
        }
        if (removed == 0) {
            return errorResponse(HttpStatus.NOT_FOUND, "Document not found: " + documentId);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Document removed.");
        response.put("documentId", documentId);
        response.put("removedChunks", removed);

        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/knowledge/search
     * Body: { "query": "...", "k": 5 }
     */
    @PostMapping("/search")
    public ResponseEntity<Map<String, Object>> search(@RequestBody Map<String, Object> request) {
        String query = asString(request.get("query"));
        if (query == null || query.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "query is required.");
        }
        Integer k = request.get("k") instanceof Number n ? n.intValue() : null;

        List<ScoredChunk> hits;
        try {
            hits = knowledgeService.search(query, k, properties.getRetrieval().getTopK());
        } catch (RetrievalUnavailableException e) {
            log.error("Search failed: {}", e.getMessage());
            return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Retrieval index unavailable.");
        }

        List<Map<String, Object>> results = hits.stream().map(hit -> {
            DocumentChunk chunk = hit.chunk();
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("score", hit.score());
            map.put("chunkId", chunk.getChunkId());
            map.put("documentId", chunk.getDocumentId());
            map.put("title", chunk.getTitle());
            map.put("source", chunk.getSource());
            map.put("url", chunk.getUrl());
            map.put("topics", chunk.topicList());
            map.put("content", chunk.getContent());
            return map;
        }).toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("query", query);
        response.put("count", results.size());
        response.put("results", results);

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/knowledge/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(knowledgeService.stats());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> ingest(Supplier<IngestionResult> ingestion) {
        IngestionResult result;
        try {
            result = ingestion.get();
        } catch (IndexCapacityExceededException e) {
            return errorResponse(HttpStatus.INSUFFICIENT_STORAGE, e.getMessage());
        } catch (RetrievalUnavailableException e) {
            log.error("Ingestion failed: {}", e.getMessage());
            return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Embedding service unavailable.");
        } catch (AssistantException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Document ingested.");
        response.put("documentId", result.documentId());
        response.put("chunkCount", result.chunkIds().size());
        response.put("chunkIds", result.chunkIds());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> asTopics(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().filter(t -> t != null).map(Object::toString)
                    .map(String::trim).filter(t -> !t.isEmpty()).toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return Arrays.stream(s.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
        }
        return List.of();
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
