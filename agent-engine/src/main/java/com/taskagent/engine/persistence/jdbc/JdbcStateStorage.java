package com.taskagent.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Relational state storage (H2 by default).
 *
 * The state document is stored whole as JSON in {@code agent_states}; the
 * {@code agent_messages} and {@code agent_context} rows are projections of it,
 * rewritten in the same transaction on every save.
 */
public class JdbcStateStorage implements StateStorage {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStorage.class);

    public static final String SCHEMA_RESOURCE = "db/agent-state-schema.sql";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcStateStorage(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                            ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create a storage over a data source and apply the schema.
     */
    public static JdbcStateStorage create(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        JdbcStateStorage storage = new JdbcStateStorage(
            new JdbcTemplate(dataSource),
            new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
            objectMapper,
            clock
        );
        storage.initializeSchema();
        return storage;
    }

    /**
     * Create the tables if they do not exist.
     */
    public void initializeSchema() {
        DataSource dataSource = jdbcTemplate.getDataSource();
        if (dataSource == null) {
            throw new StorageException("JdbcTemplate has no DataSource", null);
        }
        new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)).execute(dataSource);
        log.info("Agent state schema initialized");
    }

    @Override
    public void saveState(String taskId, StateSnapshot snapshot) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("""
                MERGE INTO agent_states (task_id, task, is_complete, is_failed, state_json, updated_at)
                KEY (task_id)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                taskId,
                snapshot.task(),
                snapshot.complete(),
                snapshot.failed(),
                toJson(snapshot),
                toTimestamp(clock.instant())
            );

            jdbcTemplate.update("DELETE FROM agent_messages WHERE task_id = ?", taskId);
            List<Object[]> messageRows = new ArrayList<>();
            List<Message> messages = snapshot.messages();
            for (int i = 0; i < messages.size(); i++) {
                Message message = messages.get(i);
                messageRows.add(new Object[]{
                    taskId, i, message.role(), message.content(), toTimestamp(message.timestamp())
                });
            }
            if (!messageRows.isEmpty()) {
                jdbcTemplate.batchUpdate("""
                    INSERT INTO agent_messages (task_id, message_index, role, content, created_at)
                    VALUES (?, ?, ?, ?, ?)
                    """, messageRows);
            }

            jdbcTemplate.update("DELETE FROM agent_context WHERE task_id = ?", taskId);
            List<Object[]> contextRows = new ArrayList<>();
            snapshot.context().forEach((key, value) ->
                contextRows.add(new Object[]{taskId, key, toJson(value)}));
            if (!contextRows.isEmpty()) {
                jdbcTemplate.batchUpdate("""
                    INSERT INTO agent_context (task_id, context_key, context_value)
                    VALUES (?, ?, ?)
                    """, contextRows);
            }
        });
        log.debug("Saved state for task {}", taskId);
    }

    @Override
    public Optional<StateSnapshot> loadState(String taskId) {
        List<String> rows = jdbcTemplate.queryForList(
            "SELECT state_json FROM agent_states WHERE task_id = ?", String.class, taskId);
        return rows.stream().findFirst().map(json -> fromJson(json, StateSnapshot.class));
    }

    @Override
    public Checkpoint createCheckpoint(String taskId, String description) {
        Checkpoint checkpoint = transactionTemplate.execute(status -> {
            StateSnapshot state = loadState(taskId).orElseThrow(() -> new NoStateException(taskId));
            List<Map<String, Object>> latest = jdbcTemplate.queryForList("""
                SELECT checkpoint_id, sequence_number FROM agent_checkpoints
                WHERE task_id = ?
                ORDER BY sequence_number DESC
                LIMIT 1
                """, taskId);

            String parentId = null;
            int sequence = 1;
            if (!latest.isEmpty()) {
                parentId = (String) latest.get(0).get("checkpoint_id");
                sequence = ((Number) latest.get(0).get("sequence_number")).intValue() + 1;
            }

            Checkpoint created = new Checkpoint(
                Checkpoint.idFor(taskId, sequence), clock.instant(), taskId, description, state, parentId);
            jdbcTemplate.update("""
                INSERT INTO agent_checkpoints (
                    checkpoint_id, task_id, sequence_number, parent_id,
                    description, checkpoint_json, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                created.id(),
                taskId,
                sequence,
                parentId,
                description,
                toJson(created),
                toTimestamp(created.timestamp())
            );
            return created;
        });
        log.debug("Created checkpoint {} ({})", checkpoint.id(), description);
        return checkpoint;
    }

    @Override
    public StateSnapshot restoreCheckpoint(String checkpointId) {
        List<String> rows = jdbcTemplate.queryForList(
            "SELECT checkpoint_json FROM agent_checkpoints WHERE checkpoint_id = ?", String.class, checkpointId);
        if (rows.isEmpty()) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        Checkpoint checkpoint = fromJson(rows.get(0), Checkpoint.class);
        saveState(checkpoint.taskId(), checkpoint.state());
        log.info("Restored task {} from checkpoint {}", checkpoint.taskId(), checkpointId);
        return checkpoint.state();
    }

    @Override
    public List<Checkpoint> listCheckpoints(String taskId) {
        List<Checkpoint> checkpoints = new ArrayList<>(jdbcTemplate.query(
            "SELECT checkpoint_json FROM agent_checkpoints WHERE task_id = ? ORDER BY sequence_number",
            (rs, rowNum) -> fromJson(rs.getString("checkpoint_json"), Checkpoint.class),
            taskId
        ));
        checkpoints.sort(Checkpoint.CHRONOLOGICAL);
        return checkpoints;
    }

    @Override
    public List<TaskRelevance> searchTaskHistory(String query, int limit) {
        if (limit < 1) {
            return List.of();
        }
        return jdbcTemplate.query("""
            SELECT task_id, COUNT(*) AS relevance
            FROM agent_messages
            WHERE LOWER(content) LIKE ? ESCAPE '\\'
            GROUP BY task_id
            ORDER BY relevance DESC, task_id
            LIMIT ?
            """,
            (rs, rowNum) -> new TaskRelevance(rs.getString("task_id"), rs.getInt("relevance")),
            "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%",
            limit
        );
    }

    @Override
    public List<TaskSummary> getRelatedTasks(String taskId, int limit) {
        if (limit < 1) {
            return List.of();
        }
        Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT task_id, context_key, context_value FROM agent_context ORDER BY task_id",
            rs -> {
                contexts.computeIfAbsent(rs.getString("task_id"), id -> new LinkedHashMap<>())
                    .put(rs.getString("context_key"), fromJson(rs.getString("context_value"), Object.class));
            }
        );
        Map<String, Object> target = contexts.getOrDefault(taskId, Map.of());
        if (target.isEmpty()) {
            return List.of();
        }

        List<TaskSummary> related = new ArrayList<>();
        contexts.forEach((otherId, context) -> {
            if (otherId.equals(taskId)) {
                return;
            }
            double relevance = TaskRanking.contextSimilarity(target, context);
            if (relevance > 0) {
                jdbcTemplate.query(
                    "SELECT task, is_complete FROM agent_states WHERE task_id = ?",
                    rs -> {
                        related.add(new TaskSummary(
                            otherId, rs.getString("task"), relevance, rs.getBoolean("is_complete")));
                    },
                    otherId
                );
            }
        });
        return related.stream().sorted(TaskRanking.BY_SIMILARITY).limit(limit).toList();
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize to JSON", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
