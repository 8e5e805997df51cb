package com.di.adbatch.checkpoint;

import com.di.adbatch.exception.CheckpointException;
import com.di.adbatch.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Checkpoint store backed by one JSON file per session in a directory:
 * {@code <dir>/checkpoint_<sessionId>.json}.
 *
 * <p>Every save writes the whole record to {@code <file>.tmp}, forces it to disk and
 * renames it over the target, so a crash mid-write leaves the previous file intact.
 * A file that cannot be parsed, or holds a task without a usable status, is moved aside as
 * {@code <file>.corrupt-<epochMillis>}
 * and treated as absent.
 */
@Slf4j
public class FileCheckpointStore extends AbstractCheckpointStore {

    private static final String  PREFIX    = "checkpoint_";
    private static final String  SUFFIX    = ".json";
    private static final Pattern FILE_NAME = Pattern.compile(Pattern.quote(PREFIX) + "([A-Za-z0-9._-]{1,128})"
                                                             + Pattern.quote(SUFFIX));

    private final Path         directory;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(Path directory, ObjectMapper objectMapper) {
        this.directory    = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path fileFor(String sessionId) {
        return directory.resolve(PREFIX + sessionId + SUFFIX);
    }

    @Override
    protected Optional<CheckpointRecord> read(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + file, e);
        }
        try {
            CheckpointRecord record = objectMapper.readValue(bytes, CheckpointRecord.class);
            if (record == null) {
                throw new CheckpointCorruption("file holds JSON null");
            }
            if (record.getSessionId() == null) {
                record.setSessionId(sessionId);
            }
            checkUsable(record);
            return Optional.of(record);
        } catch (IOException | CheckpointCorruption e) {
            quarantine(file, e);
            return Optional.empty();
        }
    }

    @Override
    protected void write(CheckpointRecord record) {
        Path target = fileFor(record.getSessionId());
        Path temp   = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            byte[] json = objectMapper.writeValueAsBytes(record);
            writeTempFile(temp, json);
            moveIntoPlace(temp, target);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialise checkpoint " + record.getSessionId(), e);
        } catch (IOException e) {
            throw new CheckpointException("Failed to write checkpoint " + target, e);
        }
    }

    /**
     * Writes {@code json} to the temporary file and syncs it to the device. Uses a plain
     * stream rather than a channel so a pending thread interrupt cannot abort the write.
     */
    protected void writeTempFile(Path temp, byte[] json) throws IOException {
        try (FileOutputStream out = new FileOutputStream(temp.toFile())) {
            out.write(json);
            out.flush();
            out.getFD().sync();
        }
    }

    @Override
    protected void remove(String sessionId) {
        Path file = fileFor(sessionId);
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("[CHECKPOINT] removed {}", file);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + file, e);
        }
    }

    @Override
    protected List<String> sessionIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(p -> {
                Matcher m = FILE_NAME.matcher(p.getFileName().toString());
                if (m.matches()) {
                    ids.add(m.group(1));
                }
            });
        } catch (IOException e) {
            throw new CheckpointException("Failed to list checkpoints in " + directory, e);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[CHECKPOINT] atomic move unsupported on {}, replacing instead", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void quarantine(Path file, Exception cause) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CheckpointException("Checkpoint " + file + " is unreadable and could not be moved aside", e);
        }
        log.warn("[CHECKPOINT] unreadable checkpoint {} moved to {}, starting from an empty record: {}",
                 file.getFileName(), aside.getFileName(), cause.getMessage());
    }

    /**
     * Rejects parsed records the store cannot work with and fills in absent lists.
     */
    private static void checkUsable(CheckpointRecord record) throws CheckpointCorruption {
        if (record.getTasks() == null) {
            record.setTasks(new LinkedHashMap<>());
            return;
        }
        for (Map.Entry<String, VariantTaskSnapshot> entry : record.getTasks().entrySet()) {
            VariantTaskSnapshot snapshot = entry.getValue();
            if (snapshot == null) {
                throw new CheckpointCorruption("task " + entry.getKey() + " has no snapshot");
            }
            if (snapshot.getStatus() == null || snapshot.getStatus() == TaskStatus.SKIPPED) {
                throw new CheckpointCorruption("task " + entry.getKey() + " has unusable status "
                        + snapshot.getStatus());
            }
            if (snapshot.getStrippedCreativeIds() == null) {
                snapshot.setStrippedCreativeIds(new ArrayList<>());
            }
        }
    }

    /** Parsed JSON that is not a usable record. */
    private static final class CheckpointCorruption extends Exception {
        CheckpointCorruption(String message) {
            super(message);
        }
    }
}
