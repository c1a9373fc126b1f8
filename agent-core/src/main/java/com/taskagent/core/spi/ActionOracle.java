package com.taskagent.core.spi;

import com.taskagent.core.model.Action;
import com.taskagent.core.model.TaskState;
import java.util.List;

/**
 * Source of the next action for a task, typically backed by a language model.
 */
@FunctionalInterface
public interface ActionOracle {

    /**
     * Decide the next step of a task.
     *
     * @param task The natural-language task
     * @param state Progress so far
     * @param availableTools Names of the tools the engine can execute
     * @return The next action
     * @throws com.taskagent.core.exception.OracleCallException on transport or parse failure
     */
    Action nextAction(String task, TaskState state, List<String> availableTools);
}
