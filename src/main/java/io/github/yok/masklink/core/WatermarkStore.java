package io.github.yok.masklink.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Per-table watermarks persisted as a JSON object ({@code {"customers": "2024-01-03 00:00:00"}}).
 *
 * <p>
 * All reads and writes of the in-memory state and the state file go through one lock, so workers
 * processing different tables can advance their watermarks concurrently. A watermark never moves
 * backwards, and the file is rewritten after every advance: a crash loses at most the progress of
 * the batch in flight. The file is written to a sibling temporary file and moved into place.
 * </p>
 */
@Slf4j
public class WatermarkStore {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path stateFile;
    private final Map<String, String> state;
    private final ReentrantLock lock = new ReentrantLock();

    private WatermarkStore(Path stateFile, Map<String, String> state) {
        this.stateFile = stateFile;
        this.state = state;
    }

    /**
     * Loads the state file; a missing file yields empty state.
     *
     * @param stateFile state file location
     * @return store
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public static WatermarkStore open(Path stateFile) {
        Map<String, String> state = new TreeMap<>();
        if (Files.exists(stateFile)) {
            try {
                Map<String, Object> raw = MAPPER.readValue(stateFile.toFile(),
                        new TypeReference<Map<String, Object>>() {});
                if (raw != null) {
                    raw.forEach((table, value) -> {
                        if (value != null) {
                            state.put(table, String.valueOf(value));
                        }
                    });
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read watermark state: " + stateFile, e);
            }
            log.info("Watermark state loaded: {} table(s) from {}", state.size(), stateFile);
        } else {
            log.info("No watermark state at {}; starting empty", stateFile);
        }
        return new WatermarkStore(stateFile, state);
    }

    /**
     * Returns the watermark of a table.
     *
     * @param table table name
     * @return watermark text, or {@code null} when the table has none
     */
    public String get(String table) {
        lock.lock();
        try {
            return state.get(table);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances a table's watermark to the maximum of the candidates when that is greater than the
     * current value, and persists the state.
     *
     * @param table table name
     * @param candidates watermark column values of a loaded batch; {@code null}s are ignored
     * @return {@code true} when the watermark moved
     * @throws UncheckedIOException if the state cannot be written; the watermark is then left
     *         unchanged
     */
    public boolean advance(String table, Collection<?> candidates) {
        String max = null;
        WatermarkValues.Kind kind = null;
        for (Object candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (kind == null) {
                kind = WatermarkValues.Kind.of(candidate);
            }
            String rendered = WatermarkValues.render(candidate);
            if (max == null || WatermarkValues.compare(rendered, max, kind) > 0) {
                max = rendered;
            }
        }
        if (max == null) {
            return false;
        }
        lock.lock();
        try {
            String current = state.get(table);
            if (current != null && WatermarkValues.compare(max, current, kind) <= 0) {
                return false;
            }
            // In-memory state changes only once the file holds the new value
            Map<String, String> updated = new TreeMap<>(state);
            updated.put(table, max);
            persist(updated);
            state.put(table, max);
            log.debug("[{}] Watermark advanced: {} -> {}", table, current, max);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the current state.
     *
     * @return table to watermark mapping
     */
    public Map<String, String> snapshot() {
        lock.lock();
        try {
            return new TreeMap<>(state);
        } finally {
            lock.unlock();
        }
    }

    private void persist(Map<String, String> content) {
        Path target = stateFile.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            FileUtils.forceMkdirParent(target.toFile());
            MAPPER.writeValue(temp.toFile(), content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write watermark state: " + target, e);
        }
    }
}
