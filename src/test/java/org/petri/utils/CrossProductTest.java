package org.petri.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrossProductTest {

    @Test
    @DisplayName("两个集合的积按顺序组合")
    void testProduct() {
        List<List<Object>> result = CrossProduct.of(List.of(List.of(1, 2), List.of("a", "b")));
        assertEquals(List.of(
                List.of(1, "a"), List.of(1, "b"),
                List.of(2, "a"), List.of(2, "b")), result);
    }

    @Test
    @DisplayName("零个集合的积只有一个空元组")
    void testEmptyProduct() {
        assertEquals(List.of(List.of()), CrossProduct.of(List.of()));
    }

    @Test
    @DisplayName("任一因子为空时结果为空")
    void testEmptyFactor() {
        assertTrue(CrossProduct.of(List.of(List.of(1), List.of())).isEmpty());
    }
}
