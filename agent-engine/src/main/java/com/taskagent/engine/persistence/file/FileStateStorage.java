package com.taskagent.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.core.exception.CheckpointNotFoundException;
import com.taskagent.core.exception.NoStateException;
import com.taskagent.core.exception.StorageException;
import com.taskagent.core.model.Checkpoint;
import com.taskagent.core.model.Message;
import com.taskagent.core.model.StateSnapshot;
import com.taskagent.core.model.TaskRelevance;
import com.taskagent.core.model.TaskSummary;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.core.storage.TaskRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * State storage in flat JSON documents under a base directory:
 *
 * <pre>
 * states/{key}.json                state document without messages and context
 * states/{key}_messages.json       messages
 * context/{key}_context.json       context
 * checkpoints/{key}_{n}.json       checkpoint documents
 * </pre>
 *
 * The key is the task id with every byte outside {@code [A-Za-z0-9.-]}, a leading
 * dot, and the underscore percent-encoded, so any task id maps to one safe file
 * name and the underscore only ever separates the key from its suffix.
 *
 * Every document is written to a temporary file and moved into place, so a
 * reader never sees a partially written file.
 */
public class FileStateStorage implements StateStorage {

    private static final Logger log = LoggerFactory.getLogger(FileStateStorage.class);

    private static final String JSON = ".json";
    private static final String MESSAGES_SUFFIX = "_messages.json";
    private static final String CONTEXT_SUFFIX = "_context.json";
    private static final Pattern SEQUENCE = Pattern.compile("[1-9][0-9]*");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static final TypeReference<List<Message>> MESSAGE_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> CONTEXT_MAP = new TypeReference<>() {};

    private final Path statesDir;
    private final Path contextDir;
    private final Path checkpointsDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileStateStorage(Path baseDir, ObjectMapper objectMapper, Clock clock) {
        this.statesDir = baseDir.resolve("states");
        this.contextDir = baseDir.resolve("context");
        this.checkpointsDir = baseDir.resolve("checkpoints");
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(statesDir);
            Files.createDirectories(contextDir);
            Files.createDirectories(checkpointsDir);
        } catch (IOException e) {
            throw new StorageException("Failed to create state directories under " + baseDir, e);
        }
        log.info("File state storage at {}", baseDir.toAbsolutePath());
    }

    @Override
    public void saveState(String taskId, StateSnapshot snapshot) {
        String key = fileKey(taskId);
        write(statesDir.resolve(key + JSON), snapshot.withMessagesAndContext(List.of(), Map.of()));
        write(statesDir.resolve(key + MESSAGES_SUFFIX), snapshot.messages());
        write(contextDir.resolve(key + CONTEXT_SUFFIX), snapshot.context());
        log.debug("Saved state for task {}", taskId);
    }

    @Override
    public Optional<StateSnapshot> loadState(String taskId) {
        String key = fileKey(taskId);
        Path stateFile = statesDir.resolve(key + JSON);
        if (!Files.exists(stateFile)) {
            return Optional.empty();
        }
        StateSnapshot state = read(stateFile, StateSnapshot.class);
        List<Message> messages = readOrDefault(statesDir.resolve(key + MESSAGES_SUFFIX), MESSAGE_LIST, List.of());
        Map<String, Object> context = readContext(taskId);
        return Optional.of(state.withMessagesAndContext(messages, context));
    }

    @Override
    public synchronized Checkpoint createCheckpoint(String taskId, String description) {
        StateSnapshot state = loadState(taskId).orElseThrow(() -> new NoStateException(taskId));
        List<Checkpoint> existing = listCheckpoints(taskId);
        Checkpoint latest = existing.stream()
            .max((a, b) -> Integer.compare(a.sequenceNumber(), b.sequenceNumber()))
            .orElse(null);
        int sequence = latest == null ? 1 : latest.sequenceNumber() + 1;

        Checkpoint checkpoint = new Checkpoint(
            Checkpoint.idFor(taskId, sequence),
            clock.instant(),
            taskId,
            description,
            state,
            latest == null ? null : latest.id()
        );
        write(checkpointFile(taskId, sequence), checkpoint);
        log.debug("Created checkpoint {} ({})", checkpoint.id(), description);
        return checkpoint;
    }

    @Override
    public StateSnapshot restoreCheckpoint(String checkpointId) {
        int separator = checkpointId == null ? -1 : checkpointId.lastIndexOf('_');
        if (separator < 0 || !SEQUENCE.matcher(checkpointId.substring(separator + 1)).matches()) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        Path file = checkpointsDir.resolve(fileKey(checkpointId.substring(0, separator))
            + checkpointId.substring(separator) + JSON);
        if (!Files.exists(file)) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        Checkpoint checkpoint = read(file, Checkpoint.class);
        saveState(checkpoint.taskId(), checkpoint.state());
        log.info("Restored task {} from checkpoint {}", checkpoint.taskId(), checkpointId);
        return checkpoint.state();
    }

    @Override
    public List<Checkpoint> listCheckpoints(String taskId) {
        String prefix = fileKey(taskId) + "_";
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (Path file : listFiles(checkpointsDir)) {
            String name = file.getFileName().toString();
            if (name.startsWith(prefix) && name.endsWith(JSON)
                    && SEQUENCE.matcher(name.substring(prefix.length(), name.length() - JSON.length())).matches()) {
                checkpoints.add(read(file, Checkpoint.class));
            }
        }
        checkpoints.sort(Checkpoint.CHRONOLOGICAL);
        return checkpoints;
    }

    @Override
    public List<TaskRelevance> searchTaskHistory(String query, int limit) {
        if (limit < 1) {
            return List.of();
        }
        List<TaskRelevance> matches = new ArrayList<>();
        for (Path file : listFiles(statesDir)) {
            String taskId = taskIdOf(file, MESSAGES_SUFFIX);
            if (taskId == null) {
                continue;
            }
            List<String> contents = read(file, MESSAGE_LIST).stream().map(Message::content).toList();
            int relevance = TaskRanking.countMatches(contents, query);
            if (relevance > 0) {
                matches.add(new TaskRelevance(taskId, relevance));
            }
        }
        return matches.stream().sorted(TaskRanking.BY_RELEVANCE).limit(limit).toList();
    }

    @Override
    public List<TaskSummary> getRelatedTasks(String taskId, int limit) {
        Map<String, Object> target = readContext(taskId);
        if (target.isEmpty() || limit < 1) {
            return List.of();
        }
        List<TaskSummary> related = new ArrayList<>();
        for (Path file : listFiles(contextDir)) {
            String otherId = taskIdOf(file, CONTEXT_SUFFIX);
            if (otherId == null || otherId.equals(taskId)) {
                continue;
            }
            double relevance = TaskRanking.contextSimilarity(target, read(file, CONTEXT_MAP));
            if (relevance > 0) {
                Path stateFile = statesDir.resolve(fileKey(otherId) + JSON);
                if (Files.exists(stateFile)) {
                    StateSnapshot other = read(stateFile, StateSnapshot.class);
                    related.add(new TaskSummary(otherId, other.task(), relevance, other.complete()));
                }
            }
        }
        return related.stream().sorted(TaskRanking.BY_SIMILARITY).limit(limit).toList();
    }

    // ========== Helper Methods ==========

    private Map<String, Object> readContext(String taskId) {
        return readOrDefault(contextDir.resolve(fileKey(taskId) + CONTEXT_SUFFIX), CONTEXT_MAP, Map.of());
    }

    private Path checkpointFile(String taskId, int sequence) {
        return checkpointsDir.resolve(fileKey(taskId) + "_" + sequence + JSON);
    }

    private void write(Path target, Object document) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, e);
        }
    }

    private <T> T read(Path file, TypeReference<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, e);
        }
    }

    private <T> T readOrDefault(Path file, TypeReference<T> type, T fallback) {
        return Files.exists(file) ? read(file, type) : fallback;
    }

    private List<Path> listFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list " + dir, e);
        }
    }

    /**
     * File name key of a task id.
     */
    static String fileKey(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        byte[] bytes = taskId.getBytes(StandardCharsets.UTF_8);
        StringBuilder key = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            boolean plain = (b >= 'A' && b <= 'Z') || (b >= 'a' && b <= 'z') || (b >= '0' && b <= '9')
                || b == '-' || (b == '.' && i > 0);
            if (plain) {
                key.append((char) b);
            } else {
                key.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return key.toString();
    }

    /**
     * Task id of a file named {@code {key}{suffix}}, or null for any other file.
     */
    static String taskIdOf(Path file, String suffix) {
        String name = file.getFileName().toString();
        if (!name.endsWith(suffix)) {
            return null;
        }
        String key = name.substring(0, name.length() - suffix.length());
        if (key.indexOf('_') >= 0 || key.indexOf('+') >= 0) {
            return null;
        }
        try {
            return URLDecoder.decode(key, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unexpected file {}", file);
            return null;
        }
    }
}
