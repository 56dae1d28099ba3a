package org.petri.expressions.lang;

import org.petri.exceptions.EvaluationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 表达式语言的运行时语义：真值、数值提升、相等与比较。
 * 整数运算在 Integer 范围内保持 Integer，溢出时提升为 Long；出现 Double 时按 Double 计算。
 */
final class Values {

    private Values() {
    }

    static boolean truth(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Iterable<?> it) {
            return it.iterator().hasNext();
        }
        return true;
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * 把 long 结果收窄：两个操作数都是 Integer 且结果在 int 范围内时返回 Integer。
     */
    static Number narrow(long result, Object left, Object right) {
        boolean small = !(left instanceof Long) && !(right instanceof Long);
        if (small && result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    static Number narrow(long result, Object operand) {
        return narrow(result, operand, operand);
    }

    /**
     * 数值相等跨类型比较（1 == 1L == 1.0），其他值使用 equals。
     */
    static boolean equal(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            if (isIntegral(left) && isIntegral(right)) {
                return ((Number) left).longValue() == ((Number) right).longValue();
            }
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!equal(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    /**
     * 有序比较，只支持数值、字符串和元组（按字典序）。
     * @return 负数、零或正数。
     * @throws EvaluationException 如果两个值不可比较。
     */
    static int compare(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            if (isIntegral(left) && isIntegral(right)) {
                return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
            }
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            int n = Math.min(l.size(), r.size());
            for (int i = 0; i < n; i++) {
                int c = compare(l.get(i), r.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(l.size(), r.size());
        }
        throw new EvaluationException("cannot compare " + typeName(left) + " and " + typeName(right));
    }

    /**
     * 成员关系：容器可以是字符串、Map（按键）或任意 Iterable。
     */
    static boolean member(Object item, Object container) {
        if (container instanceof String s) {
            if (!(item instanceof String)) {
                throw new EvaluationException("'in <string>' requires string as left operand, not " + typeName(item));
            }
            return s.contains((String) item);
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(item);
        }
        if (container instanceof Iterable<?> it) {
            for (Object element : it) {
                if (equal(item, element)) {
                    return true;
                }
            }
            return false;
        }
        throw new EvaluationException("argument of type " + typeName(container) + " is not iterable");
    }

    static List<Object> tuple(List<Object> items) {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    static String typeName(Object value) {
        return value == null ? "None" : value.getClass().getSimpleName();
    }
}
