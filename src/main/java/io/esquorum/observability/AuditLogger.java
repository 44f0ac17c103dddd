package io.esquorum.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.esquorum.security.SensitiveDataMasker;
import io.esquorum.util.Hashing;
import io.esquorum.util.Jsons;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous
 * row so that edits to the file are detectable.
 */
public final class AuditLogger {
    private static final int TAIL_CHUNK_BYTES = 4096;

    private final Path auditFile;
    private final String app;
    private String previousHash;

    public AuditLogger(Path auditFile, String app) {
        this.auditFile = auditFile;
        this.app = app == null || app.isBlank() ? "elasticsearch" : app.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("app", app);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-walks the whole file and checks every row against its predecessor.
     */
    @SuppressWarnings("unchecked")
    public synchronized VerifyOutcome verify() {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            String expectedPrev = "";
            int rows = 0;
            for (String line : lines) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                rows++;
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return new VerifyOutcome(false, rows, "prev_hash mismatch at row " + rows);
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return new VerifyOutcome(false, rows, "hash mismatch at row " + rows);
                }
                expectedPrev = recomputed;
            }
            return new VerifyOutcome(true, rows, "ok");
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = lastLine();
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    /**
     * Reads backwards from the end of the file until a full non-blank line is
     * buffered, so start-up cost does not grow with the trail.
     */
    private String lastLine() throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(auditFile.toFile(), "r")) {
            long position = file.length();
            byte[] tail = new byte[0];
            while (position > 0) {
                int length = (int) Math.min(TAIL_CHUNK_BYTES, position);
                position -= length;
                byte[] chunk = new byte[length];
                file.seek(position);
                file.readFully(chunk);
                byte[] merged = new byte[length + tail.length];
                System.arraycopy(chunk, 0, merged, 0, length);
                System.arraycopy(tail, 0, merged, length, tail.length);
                tail = merged;
                String text = new String(tail, StandardCharsets.UTF_8).strip();
                int newline = text.lastIndexOf('\n');
                if (newline >= 0) {
                    return text.substring(newline + 1).strip();
                }
            }
            return new String(tail, StandardCharsets.UTF_8).strip();
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean ok, int rows, String message) {
    }
}
