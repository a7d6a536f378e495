package com.clawcron.cron;

import com.clawcron.common.infra.JsonFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File-backed table of cron jobs.
 *
 * <p>
 * The whole file is read into an insertion-ordered map on {@link #load()} and
 * written back in full by {@link #save()}. Reads and in-memory mutations never
 * touch the disk; the service calls {@code save()} after each mutation.
 * </p>
 */
@Slf4j
public class CronStore {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path storePath;
    private final Map<String, CronJob> jobs = new LinkedHashMap<>();
    private boolean loaded;

    public CronStore(Path storePath) {
        this.storePath = storePath;
    }

    /**
     * Replace the in-memory table with the file contents. A missing or blank
     * file is an empty store.
     *
     * @throws CronErrors.CorruptStoreError when the file cannot be parsed or
     *                                      holds jobs without a unique id
     */
    public void load() {
        Map<String, CronJob> next = new LinkedHashMap<>();
        JsonNode root;
        try {
            root = JsonFile.read(MAPPER, storePath, JsonNode.class);
        } catch (IOException e) {
            throw new CronErrors.CorruptStoreError(storePath.toString(), e.getMessage(), e);
        }

        if (root != null) {
            for (JsonNode node : jobNodes(root)) {
                CronJob job;
                try {
                    job = MAPPER.treeToValue(node, CronJob.class);
                } catch (IOException | IllegalArgumentException e) {
                    throw new CronErrors.CorruptStoreError(storePath.toString(), "unreadable job entry", e);
                }
                if (job == null || job.getId() == null || job.getId().isBlank()) {
                    throw new CronErrors.CorruptStoreError(storePath.toString(), "job entry without id", null);
                }
                if (next.putIfAbsent(job.getId(), job) != null) {
                    throw new CronErrors.CorruptStoreError(storePath.toString(),
                            "duplicate job id " + job.getId(), null);
                }
            }
        }

        jobs.clear();
        jobs.putAll(next);
        loaded = true;
        log.debug("cron: loaded {} job(s) from {}", jobs.size(), storePath);
    }

    /**
     * Accepts the current {@code {"version":1,"jobs":[...]}} layout, the older
     * id-keyed {@code {"jobs":{id: job}}} layout, and a bare job array.
     */
    private List<JsonNode> jobNodes(JsonNode root) {
        List<JsonNode> nodes = new ArrayList<>();
        JsonNode container = root.isObject() ? root.get("jobs") : root;
        if (container == null || container.isNull()) {
            if (root.isObject() && onlyMetadata(root)) {
                return nodes;
            }
            throw new CronErrors.CorruptStoreError(storePath.toString(), "unexpected document shape", null);
        }
        if (container.isArray()) {
            container.forEach(nodes::add);
        } else if (container.isObject() && root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode node = entry.getValue();
                if (node.isObject() && !node.hasNonNull("id")) {
                    ((ObjectNode) node).put("id", entry.getKey());
                }
                nodes.add(node);
            }
        } else {
            throw new CronErrors.CorruptStoreError(storePath.toString(), "jobs is neither a list nor a map", null);
        }
        return nodes;
    }

    private static boolean onlyMetadata(JsonNode root) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"version".equals(name) && !"savedAt".equals(name) && !"jobs".equals(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Write the full table atomically.
     */
    public void save() throws IOException {
        CronTypes.CronStoreFile file = CronTypes.CronStoreFile.builder()
                .jobs(new ArrayList<>(jobs.values()))
                .build();
        JsonFile.writeAtomic(MAPPER, storePath, file);
        log.debug("cron: saved {} job(s) to {}", jobs.size(), storePath);
    }

    public boolean isLoaded() {
        return loaded;
    }

    public CronJob get(String id) {
        return id != null ? jobs.get(id) : null;
    }

    /**
     * Live records in insertion order.
     */
    public List<CronJob> list() {
        return new ArrayList<>(jobs.values());
    }

    /**
     * Insert or replace; a replaced job keeps its position.
     */
    public void upsert(CronJob job) {
        jobs.put(job.getId(), job);
    }

    public CronJob delete(String id) {
        return jobs.remove(id);
    }

    public int size() {
        return jobs.size();
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * Modification time of the store file, or null when it does not exist.
     */
    public Instant getFileMtime() {
        try {
            if (!Files.exists(storePath))
                return null;
            return Files.getLastModifiedTime(storePath).toInstant();
        } catch (IOException e) {
            log.debug("cron: cannot stat {}: {}", storePath, e.getMessage());
            return null;
        }
    }
}
