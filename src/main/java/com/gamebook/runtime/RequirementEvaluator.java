package com.gamebook.runtime;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a choice's opaque {@code requires} map against player stats.
 *
 * <p>Every required key must be present in the stats and its rule must hold. A map rule combines
 * {@code min, max, gt, gte, lt, lte, eq, ne, in, not_in}; a boolean rule compares truthiness; a
 * number is a minimum; anything else must be equal.
 */
public class RequirementEvaluator {

    public static final List<String> STAT_KEYS = List.of("health", "food", "gold", "morale");

    public boolean requirementsMet(Map<String, Object> requires, Map<String, ?> stats) {
        if (requires == null || requires.isEmpty()) {
            return true;
        }
        Map<String, Object> resolved = withDefaults(stats);
        for (Map.Entry<String, Object> requirement : requires.entrySet()) {
            if (!resolved.containsKey(requirement.getKey())) {
                return false;
            }
            if (!ruleHolds(resolved.get(requirement.getKey()), requirement.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Core stats coerced to integers and defaulted to 0; other keys passed through unchanged.
     */
    public Map<String, Object> withDefaults(Map<String, ?> stats) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String key : STAT_KEYS) {
            resolved.put(key, asInt(stats != null ? stats.get(key) : null));
        }
        if (stats != null) {
            for (Map.Entry<String, ?> entry : stats.entrySet()) {
                resolved.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return resolved;
    }

    @SuppressWarnings("unchecked")
    boolean ruleHolds(Object current, Object rule) {
        if (rule instanceof Map) {
            Map<String, Object> checks = (Map<String, Object>) rule;
            int value = asInt(current);
            for (Map.Entry<String, Object> check : checks.entrySet()) {
                Object operand = check.getValue();
                boolean ok;
                switch (check.getKey()) {
                    case "min":
                    case "gte":
                        ok = value >= asInt(operand);
                        break;
                    case "max":
                    case "lte":
                        ok = value <= asInt(operand);
                        break;
                    case "gt":
                        ok = value > asInt(operand);
                        break;
                    case "lt":
                        ok = value < asInt(operand);
                        break;
                    case "eq":
                        ok = looselyEqual(current, operand);
                        break;
                    case "ne":
                        ok = !looselyEqual(current, operand);
                        break;
                    case "in":
                        ok = !(operand instanceof Collection) || containsLoosely((Collection<?>) operand, current);
                        break;
                    case "not_in":
                        ok = !(operand instanceof Collection) || !containsLoosely((Collection<?>) operand, current);
                        break;
                    default:
                        ok = true;
                }
                if (!ok) {
                    return false;
                }
            }
            return true;
        }
        if (rule instanceof Boolean) {
            return isTruthy(current) == (Boolean) rule;
        }
        if (rule instanceof Number) {
            return asInt(current) >= ((Number) rule).intValue();
        }
        return looselyEqual(current, rule);
    }

    static int asInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    // 3 and 3.0 compare equal, as they do in the JSON the rules come from.
    static boolean looselyEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    private static boolean containsLoosely(Collection<?> values, Object current) {
        for (Object candidate : values) {
            if (looselyEqual(current, candidate)) {
                return true;
            }
        }
        return false;
    }
}
