package org.petri.core;

import org.petri.exceptions.DomainException;
import org.petri.exceptions.TokenException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkingTest {

    private static Marking marking(Object... pairs) {
        Map<String, MultiSet> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (MultiSet) pairs[i + 1]);
        }
        return Marking.of(map);
    }

    @Test
    @DisplayName("空库所不出现在标识中，未给出的库所视为空")
    void testCanonicalForm() {
        Marking m = marking("p1", MultiSet.of(1), "p2", MultiSet.EMPTY);
        assertAll(
                () -> assertEquals(1, m.size()),
                () -> assertFalse(m.contains("p2")),
                () -> assertEquals(MultiSet.EMPTY, m.get("p2")),
                () -> assertEquals(marking("p1", MultiSet.of(1)), m)
        );
    }

    @Nested
    @DisplayName("加减")
    class ArithmeticTests {

        @Test
        @DisplayName("逐库所相加")
        void testPlus() {
            Marking m = marking("p1", MultiSet.of(1)).plus(marking("p1", MultiSet.of(2), "p2", MultiSet.of(3)));
            assertEquals(marking("p1", MultiSet.of(1, 2), "p2", MultiSet.of(3)), m);
        }

        @Test
        @DisplayName("相减后变空的库所被删除")
        void testMinus() {
            Marking m = marking("p1", MultiSet.of(1), "p2", MultiSet.of(2));
            assertEquals(marking("p2", MultiSet.of(2)), m.minus(marking("p1", MultiSet.of(1))));
        }

        @Test
        @DisplayName("减去不存在的库所或不足的令牌应失败")
        void testMinusFailures() {
            Marking m = marking("p1", MultiSet.of(1), "p2", MultiSet.of(2));
            DomainException e = assertThrows(DomainException.class,
                    () -> m.minus(marking("p3", MultiSet.of(1))));
            assertEquals("'p3' absent from the marking", e.getMessage());
            assertThrows(TokenException.class, () -> m.minus(marking("p1", MultiSet.of(1, 1))));
        }
    }

    @Nested
    @DisplayName("比较")
    class ComparisonTests {

        private final Marking small = marking("p1", MultiSet.of(1));
        private final Marking big = marking("p1", MultiSet.of(1, 1), "p2", MultiSet.of(2));

        @Test
        @DisplayName(">= 与 <=")
        void testGreaterOrEqual() {
            assertAll(
                    () -> assertTrue(big.isGreaterOrEqual(small)),
                    () -> assertTrue(small.isLessOrEqual(big)),
                    () -> assertFalse(small.isGreaterOrEqual(big)),
                    () -> assertTrue(small.isGreaterOrEqual(small))
            );
        }

        @Test
        @DisplayName("严格比较：令牌更多或库所更多")
        void testStrict() {
            Marking morePlaces = marking("p1", MultiSet.of(1), "p2", MultiSet.of(2));
            assertAll(
                    () -> assertTrue(big.isGreater(small)),
                    () -> assertTrue(morePlaces.isGreater(small)),
                    () -> assertTrue(small.isLess(morePlaces)),
                    () -> assertFalse(small.isGreater(small)),
                    () -> assertFalse(small.isLess(small))
            );
        }

        @Test
        @DisplayName("不可比较的标识")
        void testIncomparable() {
            Marking other = marking("p3", MultiSet.of(1));
            assertFalse(small.isGreaterOrEqual(other));
            assertFalse(other.isGreaterOrEqual(small));
        }
    }

    @Test
    @DisplayName("toString 按库所名排序")
    void testToString() {
        assertEquals("{p1={1}, p2={'a'}}", marking("p2", MultiSet.of("a"), "p1", MultiSet.of(1)).toString());
    }
}
