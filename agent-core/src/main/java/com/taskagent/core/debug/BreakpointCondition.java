package com.taskagent.core.debug;

import com.taskagent.core.exception.InvalidConditionException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Predicate over a breakpoint context, written as {@code path [operator literal]}.
 *
 * <p>The path is a dot-separated walk through nested maps; numeric segments index
 * lists and {@code size}/{@code length} yield the size of a collection, map or string.
 * Without an operator the resolved value is tested for truthiness. Literals are
 * quoted strings, numbers, {@code true}, {@code false} and {@code null}.</p>
 *
 * <pre>
 * tool_name == "write_file"
 * args.path contains ".env"
 * state.tool_executions.size >= 3
 * state.is_failed
 * </pre>
 *
 * <p>There is no way to call code from a condition.</p>
 */
public final class BreakpointCondition {

    private static final Pattern CONDITION = Pattern.compile(
        "^\\s*([A-Za-z_][\\w-]*(?:\\.[\\w-]+)*)\\s*(?:(==|!=|<=|>=|<|>|contains)\\s*(.+?))?\\s*$");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    enum Operator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="), CONTAINS("contains");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        static Operator fromSymbol(String symbol) {
            return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst()
                .orElseThrow();
        }
    }

    private final String source;
    private final List<String> path;
    private final Operator operator;
    private final Object literal;

    private BreakpointCondition(String source, List<String> path, Operator operator, Object literal) {
        this.source = source;
        this.path = path;
        this.operator = operator;
        this.literal = literal;
    }

    /**
     * Parse a condition.
     *
     * @throws InvalidConditionException if the text is not a valid condition
     */
    public static BreakpointCondition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidConditionException(String.valueOf(text), "condition is empty");
        }
        Matcher matcher = CONDITION.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidConditionException(text, "expected 'path' or 'path <operator> <literal>'");
        }
        List<String> path = List.of(matcher.group(1).split("\\."));
        if (matcher.group(2) == null) {
            return new BreakpointCondition(text, path, null, null);
        }
        Operator operator = Operator.fromSymbol(matcher.group(2));
        Object literal = parseLiteral(text, matcher.group(3).trim());
        return new BreakpointCondition(text, path, operator, literal);
    }

    /**
     * Evaluate against a context.
     *
     * @throws IllegalStateException if the operator cannot be applied to the resolved value
     */
    public boolean evaluate(Map<String, Object> context) {
        Object value = resolve(context);
        if (operator == null) {
            return isTruthy(value);
        }
        return switch (operator) {
            case EQ -> valuesEqual(value, literal);
            case NE -> !valuesEqual(value, literal);
            case LT -> compare(value) < 0;
            case LE -> compare(value) <= 0;
            case GT -> compare(value) > 0;
            case GE -> compare(value) >= 0;
            case CONTAINS -> contains(value);
        };
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    // ========== Parsing ==========

    private static Object parseLiteral(String condition, String token) {
        if (token.length() >= 2
                && ((token.startsWith("\"") && token.endsWith("\""))
                || (token.startsWith("'") && token.endsWith("'")))) {
            return token.substring(1, token.length() - 1);
        }
        if (NUMBER.matcher(token).matches()) {
            return new BigDecimal(token);
        }
        return switch (token) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            case "null" -> null;
            default -> throw new InvalidConditionException(condition, "unsupported literal " + token);
        };
    }

    // ========== Evaluation ==========

    private Object resolve(Map<String, Object> context) {
        Object current = context;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            current = step(current, segment);
        }
        return current;
    }

    private static Object step(Object current, String segment) {
        boolean sizeSegment = segment.equals("size") || segment.equals("length");
        if (current instanceof Map<?, ?> map) {
            if (map.containsKey(segment)) {
                return map.get(segment);
            }
            return sizeSegment ? map.size() : null;
        }
        if (current instanceof List<?> list) {
            if (sizeSegment) {
                return list.size();
            }
            if (segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                return index < list.size() ? list.get(index) : null;
            }
            return null;
        }
        if (current instanceof Collection<?> collection && sizeSegment) {
            return collection.size();
        }
        if (current instanceof CharSequence text && sizeSegment) {
            return text.length();
        }
        return null;
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return toDecimal(number).signum() != 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    private static boolean valuesEqual(Object value, Object expected) {
        if (value instanceof Number number && expected instanceof Number other) {
            return toDecimal(number).compareTo(toDecimal(other)) == 0;
        }
        if (value instanceof Enum<?> constant && expected instanceof String name) {
            return constant.name().equals(name);
        }
        return Objects.equals(value, expected);
    }

    private int compare(Object value) {
        if (value instanceof Number number && literal instanceof Number other) {
            return toDecimal(number).compareTo(toDecimal(other));
        }
        if (value instanceof String text && literal instanceof String other) {
            return text.compareTo(other);
        }
        throw new IllegalStateException("Cannot compare " + describe(value) + " with " + describe(literal));
    }

    private boolean contains(Object value) {
        if (value instanceof CharSequence text && literal != null) {
            return text.toString().contains(literal.toString());
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valuesEqual(element, literal));
        }
        if (value instanceof Map<?, ?> map && literal != null) {
            return map.containsKey(literal.toString());
        }
        throw new IllegalStateException("Cannot apply 'contains' to " + describe(value));
    }

    private static BigDecimal toDecimal(Number number) {
        return number instanceof BigDecimal decimal ? decimal : new BigDecimal(number.toString());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
