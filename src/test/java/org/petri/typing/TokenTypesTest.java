package org.petri.typing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenTypesTest {

    @Test
    @DisplayName("基本类型")
    void testBasicTypes() {
        assertAll(
                () -> assertTrue(TokenTypes.ANY.accepts(null)),
                () -> assertFalse(TokenTypes.NOTHING.accepts(1)),
                () -> assertTrue(TokenTypes.INTEGER.accepts(1)),
                () -> assertTrue(TokenTypes.INTEGER.accepts(1L)),
                () -> assertFalse(TokenTypes.INTEGER.accepts(1.0)),
                () -> assertTrue(TokenTypes.NATURAL.accepts(0)),
                () -> assertFalse(TokenTypes.NATURAL.accepts(-1)),
                () -> assertTrue(TokenTypes.STRING.accepts("a")),
                () -> assertTrue(TokenTypes.BOOLEAN.accepts(true))
        );
    }

    @Test
    @DisplayName("组合约束")
    void testCombinators() {
        TokenType smallInt = TokenTypes.INTEGER.and(TokenTypes.range(0, 3));
        TokenType intOrString = TokenTypes.INTEGER.or(TokenTypes.STRING);
        TokenType notString = TokenTypes.STRING.not();

        assertAll(
                () -> assertTrue(smallInt.accepts(2)),
                () -> assertFalse(smallInt.accepts(4)),
                () -> assertTrue(intOrString.accepts("x")),
                () -> assertFalse(intOrString.accepts(1.5)),
                () -> assertTrue(notString.accepts(1)),
                () -> assertFalse(notString.accepts("x")),
                () -> assertEquals("(Integer | String)", intOrString.toString())
        );
    }

    @Test
    @DisplayName("枚举、谓词与 acceptsAll")
    void testOneOfAndSatisfying() {
        TokenType colors = TokenTypes.oneOf("red", "green");
        TokenType even = TokenTypes.satisfying("Even", v -> v instanceof Integer i && i % 2 == 0);

        assertAll(
                () -> assertTrue(colors.accepts("red")),
                () -> assertFalse(colors.accepts("blue")),
                () -> assertTrue(even.accepts(4)),
                () -> assertFalse(even.accepts(3)),
                () -> assertTrue(even.acceptsAll(List.of(2, 4))),
                () -> assertFalse(even.acceptsAll(List.of(2, 3))),
                () -> assertEquals("Even", even.toString())
        );
    }

    @Test
    @DisplayName("空区间应被拒绝")
    void testEmptyRange() {
        assertThrows(IllegalArgumentException.class, () -> TokenTypes.range(3, 1));
    }
}
