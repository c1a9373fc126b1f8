package com.taskagent.core.storage;

import com.taskagent.core.model.TaskRelevance;
import com.taskagent.core.model.TaskSummary;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Scoring rules shared by all storage backends so that they rank identically.
 */
public final class TaskRanking {

    /**
     * Highest relevance first; ties by task id.
     */
    public static final Comparator<TaskRelevance> BY_RELEVANCE =
        Comparator.comparingInt(TaskRelevance::relevance).reversed()
            .thenComparing(TaskRelevance::taskId);

    /**
     * Highest relevance first; ties by task id.
     */
    public static final Comparator<TaskSummary> BY_SIMILARITY =
        Comparator.comparingDouble(TaskSummary::relevance).reversed()
            .thenComparing(TaskSummary::taskId);

    private TaskRanking() {
    }

    /**
     * Shared keys holding equal values, divided by the size of the larger context.
     */
    public static double contextSimilarity(Map<String, Object> first, Map<String, Object> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        long matching = first.keySet().stream()
            .filter(second::containsKey)
            .filter(key -> Objects.equals(first.get(key), second.get(key)))
            .count();
        return (double) matching / Math.max(first.size(), second.size());
    }

    /**
     * Number of message contents that contain the query, ignoring case.
     */
    public static int countMatches(List<String> contents, String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return (int) contents.stream()
            .filter(Objects::nonNull)
            .filter(content -> content.toLowerCase(Locale.ROOT).contains(needle))
            .count();
    }
}
