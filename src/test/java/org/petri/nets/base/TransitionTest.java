package org.petri.nets.base;

import org.apache.commons.lang3.tuple.Pair;
import org.petri.core.Marking;
import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.FiringException;
import org.petri.exceptions.StructureException;
import org.petri.exceptions.UnboundNameException;
import org.petri.expressions.arcs.Expression;
import org.petri.expressions.arcs.Flush;
import org.petri.expressions.arcs.Inhibitor;
import org.petri.expressions.arcs.Value;
import org.petri.expressions.arcs.Variable;
import org.petri.typing.TokenTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransitionTest {

    private Place p;
    private Place q;
    private Transition t;

    /**
     * p = {0, 1, 2} --x--> t[x != 1] --x+1--> q
     */
    @BeforeEach
    void setUp() {
        p = new Place("p", List.of(0, 1, 2), TokenTypes.INTEGER);
        q = new Place("q", List.of(), TokenTypes.INTEGER);
        t = new Transition("t", new Expression("x != 1"));
        t.addInput(p, new Variable("x"));
        t.addOutput(q, new Expression("x + 1"));
    }

    @Nested
    @DisplayName("弧")
    class ArcTests {

        @Test
        @DisplayName("重复连接与未连接的库所应报错")
        void testConnectionErrors() {
            StructureException e1 = assertThrows(StructureException.class, () -> t.addInput(p, new Value(1)));
            assertEquals("already connected to 'p'", e1.getMessage());
            StructureException e2 = assertThrows(StructureException.class, () -> t.removeOutput(p));
            assertEquals("not connected to 'p'", e2.getMessage());
        }

        @Test
        @DisplayName("表达式不能用在输入弧上")
        void testExpressionOnInput() {
            Place r = new Place("r");
            StructureException e = assertThrows(StructureException.class,
                    () -> t.addInput(r, new Expression("x")));
            assertEquals("'Expression' objects not allowed on input arcs", e.getMessage());
        }

        @Test
        @DisplayName("库所记录相连变迁的标注")
        void testAdjacency() {
            assertAll(
                    () -> assertEquals(new Variable("x"), p.getPost().get("t")),
                    () -> assertEquals(new Expression("x + 1"), q.getPre().get("t")),
                    () -> assertEquals(Set.of("p"), t.getPre().keySet()),
                    () -> assertEquals(Set.of("q"), t.getPost().keySet())
            );
            t.removeInput(p);
            assertTrue(p.getPost().isEmpty());
        }

        @Test
        @DisplayName("改名后库所的映射随之更新")
        void testRename() {
            t.rename("u");
            assertTrue(p.getPost().containsKey("u"));
            assertFalse(p.getPost().containsKey("t"));
        }
    }

    @Nested
    @DisplayName("绑定与触发")
    class FiringTests {

        @Test
        @DisplayName("x=1 不是模式，其他值是")
        void testModes() {
            List<Substitution> modes = t.modes();
            assertEquals(List.of(Substitution.of("x", 0), Substitution.of("x", 2)), modes);
            assertFalse(modes.contains(Substitution.of("x", 1)));
            for (Substitution mode : modes) {
                assertTrue(t.enabled(mode), "mode should be enabled: " + mode);
            }
        }

        @Test
        @DisplayName("以 x=0 触发后 p={1,2}，q={1}")
        void testFire() {
            t.fire(Substitution.of("x", 0));
            assertEquals(MultiSet.of(1, 2), p.getTokens());
            assertEquals(MultiSet.of(1), q.getTokens());
        }

        @Test
        @DisplayName("未使能的绑定不能触发")
        void testFireNotEnabled() {
            FiringException e = assertThrows(FiringException.class, () -> t.fire(Substitution.of("x", 1)));
            assertEquals("transition not enabled for {x -> 1}", e.getMessage());
            assertThrows(FiringException.class, () -> t.fire(Substitution.of("x", 7)));
            assertEquals(MultiSet.of(0, 1, 2), p.getTokens());
        }

        @Test
        @DisplayName("flow 给出取走和放入的标识")
        void testFlow() {
            Pair<Marking, Marking> flow = t.flow(Substitution.of("x", 2));
            assertEquals(Marking.of("p", MultiSet.of(2)), flow.getLeft());
            assertEquals(Marking.of("q", MultiSet.of(3)), flow.getRight());
            assertThrows(FiringException.class, () -> t.flow(Substitution.of("x", 1)));
        }

        @Test
        @DisplayName("激活不要求令牌，但要求类型")
        void testActivated() {
            assertTrue(t.activated(Substitution.of("x", 7)));
            assertFalse(t.enabled(Substitution.of("x", 7)));
            assertFalse(t.activated(Substitution.of("x", "a")));
        }

        @Test
        @DisplayName("输出违反类型的绑定不是模式")
        void testOutputTypeChecked() {
            q.setType(TokenTypes.range(0, 2));
            assertEquals(List.of(Substitution.of("x", 0)), t.modes());
        }

        @Test
        @DisplayName("没有输入弧的变迁只有一个空模式")
        void testNoInputs() {
            Transition source = new Transition("source");
            source.addOutput(q, new Value(5));
            assertEquals(List.of(Substitution.EMPTY), source.modes());
            source.fire(Substitution.EMPTY);
            assertEquals(MultiSet.of(5), q.getTokens());
        }

        @Test
        @DisplayName("守卫引用未绑定的名字时报错")
        void testUnboundGuardName() {
            t.setGuard(new Expression("y > 0"));
            assertThrows(UnboundNameException.class, () -> t.modes());
        }

        @Test
        @DisplayName("抑制弧阻止触发")
        void testInhibitor() {
            Place guardPlace = new Place("g", List.of("stop"));
            t.addInput(guardPlace, new Inhibitor(new Value("stop")));
            assertTrue(t.modes().isEmpty());
            assertFalse(t.enabled(Substitution.of("x", 0)));
            guardPlace.empty();
            assertEquals(2, t.modes().size());
            assertTrue(t.enabled(Substitution.of("x", 0)));
        }

        @Test
        @DisplayName("清空弧取走全部令牌")
        void testFlush() {
            Place all = new Place("all", List.of("a", "b", "b"));
            Place out = new Place("out");
            Transition drain = new Transition("drain");
            drain.addInput(all, new Flush("x"));
            drain.addOutput(out, new Flush("x"));
            List<Substitution> modes = drain.modes();
            assertEquals(1, modes.size());
            drain.fire(modes.get(0));
            assertTrue(all.isEmpty());
            assertEquals(MultiSet.of("a", "b", "b"), out.getTokens());
            assertEquals(List.of(Substitution.of("x", MultiSet.EMPTY)), drain.modes());
        }
    }

    @Nested
    @DisplayName("变量与复制")
    class StructureTests {

        @Test
        @DisplayName("vars 不含全局声明的名字")
        void testVars() {
            t.setGuard(new Expression("x != k"));
            t.getEnvironment().declare("k", 1);
            assertEquals(Set.of("x"), t.vars());
            assertEquals(List.of(Substitution.of("x", 0), Substitution.of("x", 2)), t.modes());
        }

        @Test
        @DisplayName("substitute 重命名守卫和所有弧")
        void testSubstitute() {
            t.substitute(Substitution.of("x", "z"));
            assertAll(
                    () -> assertEquals(new Expression("z != 1"), t.getGuard()),
                    () -> assertEquals(new Variable("z"), t.input(p)),
                    () -> assertEquals(new Expression("z + 1"), t.output(q)),
                    () -> assertEquals(new Variable("z"), p.getPost().get("t"))
            );
        }

        @Test
        @DisplayName("copy 保留守卫，不带弧")
        void testCopy() {
            Transition copy = t.copy("t2");
            assertEquals("t2", copy.getName());
            assertEquals(t.getGuard(), copy.getGuard());
            assertTrue(copy.inputs().isEmpty());
        }
    }
}
