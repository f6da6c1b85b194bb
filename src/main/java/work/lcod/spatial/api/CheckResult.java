package work.lcod.spatial.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.spatial.validation.ValidationException;

/**
 * Outcome of a {@link SceneChecker} run (usable by the CLI and embedding apps).
 */
public record CheckResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CheckResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CheckResult valid(Map<String, Object> metadata, Instant startedAt) {
        return new CheckResult(Status.VALID, metadata, startedAt, Instant.now());
    }

    /**
     * A violation of the graph invariants, carrying its reason and field path.
     */
    public static CheckResult invalid(ValidationException failure, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("reason", failure.reason().wireName());
        meta.put("field", failure.field());
        meta.put("error", failure.getMessage());
        if (failure.instance() != null) {
            meta.put("instance", failure.instance().toString());
        }
        return new CheckResult(Status.INVALID, meta, startedAt, Instant.now());
    }

    /**
     * The scene could not be loaded or written.
     */
    public static CheckResult error(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new CheckResult(Status.ERROR, meta, startedAt, Instant.now());
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        VALID(0),
        INVALID(1),
        ERROR(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
