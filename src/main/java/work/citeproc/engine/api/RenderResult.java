package work.citeproc.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link CiteprocRunner} execution. The metadata map is what {@code --json} prints; the typed
 * accessors read the rendered texts back out of it.
 */
public record RenderResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RenderResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RenderResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RenderResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RenderResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message == null ? "unknown error" : message);
        return new RenderResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public Optional<String> error() {
        return Optional.ofNullable(metadata.get("error")).map(String::valueOf);
    }

    /**
     * Formatted citation clusters in document order; empty for failures.
     */
    public List<String> citationTexts() {
        return texts("citations");
    }

    /**
     * Formatted bibliography entries in bibliography order; empty for failures.
     */
    public List<String> bibliographyTexts() {
        return texts("bibliography");
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    private List<String> texts(String section) {
        var texts = new ArrayList<String>();
        if (metadata.get(section) instanceof List<?> list) {
            for (var element : list) {
                if (element instanceof Map<?, ?> map) {
                    texts.add(String.valueOf(map.get("text")));
                }
            }
        }
        return texts;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMillis", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage().replace("\"", "'") + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
