package com.clawcron.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file read and atomic write with owner-only file permissions.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    /**
     * Read a JSON file. Returns null when the file does not exist or is blank.
     *
     * @throws IOException when the file cannot be read or does not parse
     */
    public static <T> T read(ObjectMapper mapper, Path path, Class<T> type) throws IOException {
        if (!Files.exists(path))
            return null;
        String raw = Files.readString(path);
        if (raw.isBlank())
            return null;
        return mapper.readValue(raw, type);
    }

    /**
     * Write {@code data} as JSON: the bytes go to a temp file in the same
     * directory which is then renamed over {@code path}, so readers never see
     * a truncated file.
     */
    public static void writeAtomic(ObjectMapper mapper, Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String json = mapper.writeValueAsString(data) + "\n";
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, json);
            restrictPermissions(tmp);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, replacing in place", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions unsupported for {}", path);
        }
    }
}
