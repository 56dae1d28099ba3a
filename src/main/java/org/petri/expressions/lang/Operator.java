package org.petri.expressions.lang;

import org.petri.exceptions.EvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * 二元与一元运算符。
 * 逻辑运算 and/or 需要短路，由语法树直接处理，不在此枚举中。
 */
enum Operator {

    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("in"),
    NOT_IN("not in"),
    NEGATE("-"),
    PLUS("+"),
    NOT("not");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    Object apply(Object operand) {
        return switch (this) {
            case NOT -> !Values.truth(operand);
            case PLUS -> {
                requireNumber(operand);
                yield operand;
            }
            case NEGATE -> {
                requireNumber(operand);
                if (Values.isIntegral(operand)) {
                    yield Values.narrow(negateExact(((Number) operand).longValue()), operand);
                }
                yield -((Number) operand).doubleValue();
            }
            default -> throw new IllegalStateException(this + " is not a unary operator");
        };
    }

    Object apply(Object left, Object right) {
        return switch (this) {
            case ADD -> add(left, right);
            case SUBTRACT -> arithmetic(left, right);
            case MULTIPLY -> multiply(left, right);
            case DIVIDE, FLOOR_DIVIDE, MODULO -> divide(left, right);
            case EQ -> Values.equal(left, right);
            case NE -> !Values.equal(left, right);
            case LT -> Values.compare(left, right) < 0;
            case LE -> Values.compare(left, right) <= 0;
            case GT -> Values.compare(left, right) > 0;
            case GE -> Values.compare(left, right) >= 0;
            case IN -> Values.member(left, right);
            case NOT_IN -> !Values.member(left, right);
            default -> throw new IllegalStateException(this + " is not a binary operator");
        };
    }

    private Object add(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            List<Object> joined = new ArrayList<>(l);
            joined.addAll(r);
            return Values.tuple(joined);
        }
        return arithmetic(left, right);
    }

    private Object multiply(Object left, Object right) {
        if (left instanceof String s && Values.isIntegral(right)) {
            return s.repeat((int) Math.max(0, ((Number) right).longValue()));
        }
        if (Values.isIntegral(left) && right instanceof String s) {
            return s.repeat((int) Math.max(0, ((Number) left).longValue()));
        }
        return arithmetic(left, right);
    }

    private Object divide(Object left, Object right) {
        requireNumbers(left, right);
        if (((Number) right).doubleValue() == 0.0) {
            throw new EvaluationException("division by zero");
        }
        if (Values.isIntegral(left) && Values.isIntegral(right)) {
            long a = ((Number) left).longValue();
            long b = ((Number) right).longValue();
            long result = this == MODULO ? Math.floorMod(a, b) : Math.floorDiv(a, b);
            return Values.narrow(result, left, right);
        }
        double a = ((Number) left).doubleValue();
        double b = ((Number) right).doubleValue();
        return switch (this) {
            case DIVIDE -> a / b;
            case FLOOR_DIVIDE -> Math.floor(a / b);
            default -> a - b * Math.floor(a / b);
        };
    }

    private Object arithmetic(Object left, Object right) {
        requireNumbers(left, right);
        if (Values.isIntegral(left) && Values.isIntegral(right)) {
            long a = ((Number) left).longValue();
            long b = ((Number) right).longValue();
            try {
                long result = switch (this) {
                    case ADD -> Math.addExact(a, b);
                    case SUBTRACT -> Math.subtractExact(a, b);
                    case MULTIPLY -> Math.multiplyExact(a, b);
                    default -> throw new IllegalStateException(this + " is not arithmetic");
                };
                return Values.narrow(result, left, right);
            } catch (ArithmeticException e) {
                throw new EvaluationException("integer overflow in " + a + " " + symbol + " " + b, e);
            }
        }
        double a = ((Number) left).doubleValue();
        double b = ((Number) right).doubleValue();
        return switch (this) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            default -> throw new IllegalStateException(this + " is not arithmetic");
        };
    }

    private static long negateExact(long value) {
        try {
            return Math.negateExact(value);
        } catch (ArithmeticException e) {
            throw new EvaluationException("integer overflow in -" + value, e);
        }
    }

    private void requireNumber(Object operand) {
        if (!Values.isNumber(operand)) {
            throw new EvaluationException("bad operand type for unary " + symbol + ": " + Values.typeName(operand));
        }
    }

    private void requireNumbers(Object left, Object right) {
        if (!Values.isNumber(left) || !Values.isNumber(right)) {
            throw new EvaluationException("unsupported operand types for " + symbol + ": "
                    + Values.typeName(left) + " and " + Values.typeName(right));
        }
    }
}
