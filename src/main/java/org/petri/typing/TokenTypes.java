package org.petri.typing;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 常用的令牌约束。
 * @author Ayalyt
 */
public final class TokenTypes {

    /** 接受任何值。 */
    public static final TokenType ANY = new Named("Any", value -> true);

    /** 不接受任何值。 */
    public static final TokenType NOTHING = new Named("Nothing", value -> false);

    /** Integer 或 Long。 */
    public static final TokenType INTEGER = new Named("Integer",
            value -> value instanceof Integer || value instanceof Long);

    /** 非负整数。 */
    public static final TokenType NATURAL = new Named("Natural",
            value -> INTEGER.accepts(value) && ((Number) value).longValue() >= 0);

    public static final TokenType STRING = instanceOf(String.class);

    public static final TokenType BOOLEAN = instanceOf(Boolean.class);

    private TokenTypes() {
    }

    /**
     * 接受给定类（及其子类）的实例。
     */
    public static TokenType instanceOf(Class<?> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        return new Named(type.getSimpleName(), type::isInstance);
    }

    /**
     * 只接受列出的值。
     */
    public static TokenType oneOf(Object... values) {
        Set<Object> allowed = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
        String name = allowed.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
        return new Named(name, allowed::contains);
    }

    /**
     * 接受闭区间 [min, max] 内的整数。
     * @throws IllegalArgumentException 如果 min > max。
     */
    public static TokenType range(long min, long max) {
        if (min > max) {
            throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
        }
        return new Named("Range(" + min + ", " + max + ")", value -> {
            if (!INTEGER.accepts(value)) {
                return false;
            }
            long v = ((Number) value).longValue();
            return v >= min && v <= max;
        });
    }

    /**
     * 由任意谓词定义的约束。
     * @param name 用于显示的名字。
     * @param predicate 谓词。
     */
    public static TokenType satisfying(String name, Predicate<Object> predicate) {
        return new Named(Objects.requireNonNull(name, "Name cannot be null"),
                Objects.requireNonNull(predicate, "Predicate cannot be null"));
    }

    /**
     * 带名字的谓词约束，名字只用于 toString。
     */
    static final class Named implements TokenType {
        private final String name;
        private final Predicate<Object> predicate;

        Named(String name, Predicate<Object> predicate) {
            this.name = name;
            this.predicate = predicate;
        }

        @Override
        public boolean accepts(Object value) {
            return predicate.test(value);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
