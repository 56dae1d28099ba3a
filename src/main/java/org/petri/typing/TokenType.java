package org.petri.typing;

import java.util.Objects;

/**
 * 库所上令牌的约束。
 * 库所在接受令牌之前会用它检查每个值。
 */
@FunctionalInterface
public interface TokenType {

    /**
     * @param value 令牌值。
     * @return 如果值满足约束则为 true。
     */
    boolean accepts(Object value);

    /**
     * 检查集合中的每个值。
     * @param values 令牌值。
     * @return 所有值都满足约束时为 true。
     */
    default boolean acceptsAll(Iterable<?> values) {
        for (Object value : values) {
            if (!accepts(value)) {
                return false;
            }
        }
        return true;
    }

    default TokenType and(TokenType other) {
        Objects.requireNonNull(other, "Other type cannot be null");
        return new TokenTypes.Named("(" + this + " & " + other + ")",
                value -> this.accepts(value) && other.accepts(value));
    }

    default TokenType or(TokenType other) {
        Objects.requireNonNull(other, "Other type cannot be null");
        return new TokenTypes.Named("(" + this + " | " + other + ")",
                value -> this.accepts(value) || other.accepts(value));
    }

    default TokenType not() {
        return new TokenTypes.Named("~" + this, value -> !this.accepts(value));
    }
}
