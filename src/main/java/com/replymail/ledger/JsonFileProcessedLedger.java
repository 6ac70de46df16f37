package com.replymail.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.replymail.domain.ProcessedRecord;
import com.replymail.exception.LedgerWriteException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger kept in a single JSON file
 * - In-memory map is the read path
 * - Every commit rewrites the file: write temp, fsync, atomic rename
 * - Reads the legacy {"processed_ids": [...]} layout as well
 */
@Slf4j
public class JsonFileProcessedLedger implements ProcessedLedger {

    private static final String LEGACY_FIELD = "processed_ids";
    private static final String FIELD = "processed";

    private final Path path;
    private final Path tempPath;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public JsonFileProcessedLedger(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath();
        this.tempPath = this.path.resolveSibling(this.path.getFileName() + ".tmp");
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void open() {
        entries.clear();
        try {
            Files.createDirectories(path.getParent());
            Files.deleteIfExists(tempPath);
            if (Files.exists(path)) {
                load(objectMapper.readTree(path.toFile()));
            }
        } catch (IOException e) {
            throw new LedgerWriteException("Cannot read ledger file " + path, e);
        }
        log.info("Processed ledger (json) opened: {} with {} record(s)", path, entries.size());
    }

    private void load(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        for (JsonNode node : root.path(FIELD)) {
            String id = node.path("messageId").asText(null);
            if (id != null) {
                entries.putIfAbsent(id, node.path("processedAt").asText(""));
            }
        }
        for (JsonNode node : root.path(LEGACY_FIELD)) {
            entries.putIfAbsent(node.asText(), "");
        }
    }

    @Override
    public synchronized boolean isProcessed(String messageId) {
        return entries.containsKey(messageId);
    }

    @Override
    public synchronized boolean commit(String messageId, Instant processedAt) {
        if (entries.containsKey(messageId)) {
            log.debug("Ledger already contains {}", messageId);
            return false;
        }
        entries.put(messageId, processedAt.toString());
        try {
            persist();
        } catch (IOException e) {
            entries.remove(messageId);
            throw new LedgerWriteException("Ledger commit failed for " + messageId, e);
        }
        log.debug("Ledger committed {}", messageId);
        return true;
    }

    @Override
    public synchronized void flush() {
        try {
            persist();
        } catch (IOException e) {
            throw new LedgerWriteException("Ledger flush failed", e);
        }
    }

    @Override
    public synchronized List<ProcessedRecord> records() {
        List<ProcessedRecord> result = new ArrayList<>(entries.size());
        entries.forEach((id, at) -> result.add(new ProcessedRecord(id, at)));
        return result;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized int reset() {
        Map<String, String> previous = new LinkedHashMap<>(entries);
        entries.clear();
        try {
            persist();
        } catch (IOException e) {
            entries.putAll(previous);
            throw new LedgerWriteException("Ledger reset failed", e);
        }
        log.warn("Processed ledger reset, {} record(s) removed", previous.size());
        return previous.size();
    }

    @Override
    public synchronized void close() {
        log.info("Processed ledger (json) closed with {} record(s)", entries.size());
    }

    private void persist() throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode processed = root.putArray(FIELD);
        entries.forEach((id, at) -> processed.addObject().put("messageId", id).put("processedAt", at));
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);

        try (FileChannel channel = FileChannel.open(tempPath,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(json);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic rename unsupported on this filesystem, using plain replace");
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
        syncDirectory(path.toAbsolutePath().getParent());
    }

    /**
     * fsync the parent directory so the rename itself survives a crash
     */
    void syncDirectory(Path directory) throws IOException {
        if (directory == null) {
            return;
        }
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (AccessDeniedException e) {
            // Windows cannot open directories; NTFS journals the rename
            log.debug("Directory sync unsupported for {}: {}", directory, e.getMessage());
        }
    }
}
