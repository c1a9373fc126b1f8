package com.taskagent.core.debug;

import com.taskagent.core.exception.InvalidConditionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BreakpointConditionTest {

    private final Map<String, Object> context = Map.of(
        "tool_name", "write_file",
        "args", Map.of("path", "config/.env", "size", 3),
        "state", Map.of(
            "is_failed", false,
            "tool_executions", List.of(Map.of("tool_name", "read_file"), Map.of("tool_name", "list_files")),
            "consecutive_auto_approvals", 2
        )
    );

    @Test
    void equality_shouldMatchStringLiteral() {
        assertTrue(BreakpointCondition.parse("tool_name == \"write_file\"").evaluate(context));
        assertFalse(BreakpointCondition.parse("tool_name == 'read_file'").evaluate(context));
        assertTrue(BreakpointCondition.parse("tool_name != 'read_file'").evaluate(context));
    }

    @Test
    void contains_shouldSearchStrings() {
        assertTrue(BreakpointCondition.parse("args.path contains \".env\"").evaluate(context));
        assertFalse(BreakpointCondition.parse("args.path contains 'secret'").evaluate(context));
    }

    @Test
    void numericComparison_shouldCompareAcrossNumberTypes() {
        assertTrue(BreakpointCondition.parse("state.consecutive_auto_approvals >= 2").evaluate(context));
        assertTrue(BreakpointCondition.parse("state.consecutive_auto_approvals == 2.0").evaluate(context));
        assertFalse(BreakpointCondition.parse("state.consecutive_auto_approvals > 2").evaluate(context));
    }

    @Test
    void sizeSegment_shouldYieldCollectionSize() {
        assertTrue(BreakpointCondition.parse("state.tool_executions.size == 2").evaluate(context));
        assertTrue(BreakpointCondition.parse("tool_name.length == 10").evaluate(context));
    }

    @Test
    void sizeSegment_shouldPreferExistingMapKey() {
        assertTrue(BreakpointCondition.parse("args.size == 3").evaluate(context));
    }

    @Test
    void numericSegment_shouldIndexLists() {
        assertTrue(BreakpointCondition.parse("state.tool_executions.1.tool_name == 'list_files'").evaluate(context));
        assertFalse(BreakpointCondition.parse("state.tool_executions.5.tool_name == 'list_files'").evaluate(context));
    }

    @Test
    void barePath_shouldTestTruthiness() {
        assertTrue(BreakpointCondition.parse("args.path").evaluate(context));
        assertFalse(BreakpointCondition.parse("state.is_failed").evaluate(context));
        assertFalse(BreakpointCondition.parse("missing.value").evaluate(context));
    }

    @Test
    void nullLiteral_shouldMatchMissingValues() {
        assertTrue(BreakpointCondition.parse("missing == null").evaluate(context));
    }

    @Test
    void incompatibleComparison_shouldFailEvaluation() {
        BreakpointCondition condition = BreakpointCondition.parse("tool_name > 3");

        assertThrows(IllegalStateException.class, () -> condition.evaluate(context));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "context['tool'] == 'x'",
        "__import__('os').system('ls')",
        "tool_name == write_file",
        "tool_name ==",
        "== 'x'"
    })
    void parse_shouldRejectMalformedConditions(String text) {
        assertThrows(InvalidConditionException.class, () -> BreakpointCondition.parse(text));
    }
}
