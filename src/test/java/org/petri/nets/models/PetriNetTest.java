package org.petri.nets.models;

import org.petri.core.Marking;
import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.StructureException;
import org.petri.exceptions.TokenException;
import org.petri.expressions.arcs.Expression;
import org.petri.expressions.arcs.MultiArc;
import org.petri.expressions.arcs.Value;
import org.petri.expressions.arcs.Variable;
import org.petri.nets.base.Place;
import org.petri.nets.base.Transition;
import org.petri.typing.TokenTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PetriNetTest {

    private PetriNet net;

    /**
     * p = {0, 1} --x--> t[x < k] --x+1--> q，k = 5
     */
    @BeforeEach
    void setUp() {
        net = new PetriNet("N");
        net.declare("k", 5);
        net.addPlace(new Place("p", List.of(0, 1), TokenTypes.INTEGER));
        net.addPlace(new Place("q", List.of(), TokenTypes.INTEGER));
        net.addTransition(new Transition("t", "x < k"));
        net.addInput("p", "t", new Variable("x"));
        net.addOutput("q", "t", new Expression("x + 1"));
    }

    @Nested
    @DisplayName("节点与弧")
    class StructureTests {

        @Test
        @DisplayName("库所和变迁共享名字空间")
        void testSharedNamespace() {
            StructureException e1 = assertThrows(StructureException.class, () -> net.addPlace(new Place("p")));
            assertEquals("place 'p' exists", e1.getMessage());
            StructureException e2 = assertThrows(StructureException.class, () -> net.addPlace(new Place("t")));
            assertEquals("a transition 't' exists", e2.getMessage());
            StructureException e3 = assertThrows(StructureException.class, () -> net.addTransition(new Transition("q")));
            assertEquals("a place 'q' exists", e3.getMessage());
        }

        @Test
        @DisplayName("一个节点只能属于一个网")
        void testNodeBelongsToOneNet() {
            Place shared = net.place("p");
            PetriNet other = new PetriNet("M");
            assertThrows(StructureException.class, () -> other.addPlace(shared));
            assertSame(net, shared.getNet());
        }

        @Test
        @DisplayName("网中的节点不能绕过网改名或脱离")
        void testNodeNamespaceGuarded() {
            Place p = net.place("p");
            StructureException rename = assertThrows(StructureException.class, () -> p.rename("q2"));
            assertEquals("node 'p' belongs to net 'N', rename it through the net", rename.getMessage());
            assertThrows(StructureException.class, () -> net.transition("t").rename("u"));
            assertThrows(StructureException.class, () -> p.setNet(null));
            assertThrows(StructureException.class, () -> new Place("z").setNet(net));
            assertAll(
                    () -> assertEquals("p", p.getName()),
                    () -> assertSame(net, p.getNet()),
                    () -> assertEquals(Set.of("t"), p.getPost().keySet()),
                    () -> assertFalse(net.hasNode("z"))
            );
        }

        @Test
        @DisplayName("查找不存在的节点")
        void testLookupMissing() {
            StructureException e = assertThrows(StructureException.class, () -> net.node("z"));
            assertEquals("node 'z' not found", e.getMessage());
            assertThrows(StructureException.class, () -> net.place("t"));
            assertThrows(StructureException.class, () -> net.transition("p"));
            assertAll(
                    () -> assertTrue(net.hasPlace("p")),
                    () -> assertTrue(net.hasTransition("t")),
                    () -> assertTrue(net.hasNode("q")),
                    () -> assertFalse(net.hasNode("z"))
            );
        }

        @Test
        @DisplayName("输入弧上不允许表达式")
        void testExpressionOnInput() {
            net.addPlace(new Place("r"));
            StructureException e = assertThrows(StructureException.class,
                    () -> net.addInput("r", "t", new Expression("x")));
            assertEquals("'Expression' not allowed on input arcs", e.getMessage());
        }

        @Test
        @DisplayName("pre 与 post")
        void testPrePost() {
            assertAll(
                    () -> assertEquals(Set.of("p"), net.pre("t")),
                    () -> assertEquals(Set.of("q"), net.post("t")),
                    () -> assertEquals(Set.of("t"), net.post("p")),
                    () -> assertEquals(Set.of("t"), net.pre("q")),
                    () -> assertEquals(Set.of("t"), net.post(List.of("p", "q"))),
                    () -> assertTrue(net.pre("p").isEmpty())
            );
        }

        @Test
        @DisplayName("删除库所时删除它的弧")
        void testRemovePlace() {
            Transition t = net.transition("t");
            net.removePlace("p");
            assertFalse(net.hasPlace("p"));
            assertTrue(t.inputs().isEmpty());
            assertEquals(Set.of("q"), net.post("t"));
        }

        @Test
        @DisplayName("删除变迁后它保留全局声明的副本")
        void testRemoveTransition() {
            Transition t = net.transition("t");
            net.removeTransition("t");
            assertNull(t.getNet());
            assertTrue(net.place("p").getPost().isEmpty());
            assertEquals(5, t.getEnvironment().get("k"));
            assertNotSame(net.getEnvironment(), t.getEnvironment());
        }

        @Test
        @DisplayName("变迁看到网的全局声明")
        void testGlobals() {
            assertEquals(List.of(Substitution.of("x", 0), Substitution.of("x", 1)),
                    net.transition("t").modes());
            net.declare("k", 1);
            assertEquals(List.of(Substitution.of("x", 0)), net.transition("t").modes());
            assertEquals(Set.of("x"), net.transition("t").vars());
        }
    }

    @Nested
    @DisplayName("标识")
    class MarkingTests {

        @Test
        @DisplayName("getMarking 只包含非空库所")
        void testGetMarking() {
            assertEquals(Marking.of("p", MultiSet.of(0, 1)), net.getMarking());
        }

        @Test
        @DisplayName("setMarking 清空未提到的库所并忽略未知库所")
        void testSetMarking() {
            net.setMarking(Marking.of(Map.of("q", MultiSet.of(7), "zz", MultiSet.of(1))));
            assertTrue(net.place("p").isEmpty());
            assertEquals(MultiSet.of(7), net.place("q").getTokens());
        }

        @Test
        @DisplayName("setMarking 失败时恢复原标识")
        void testSetMarkingRollback() {
            Marking before = net.getMarking();
            assertThrows(TokenException.class,
                    () -> net.setMarking(Marking.of(Map.of("p", MultiSet.of(3), "q", MultiSet.of("bad")))));
            assertEquals(before, net.getMarking());
        }

        @Test
        @DisplayName("addMarking 与 removeMarking")
        void testAddRemoveMarking() {
            Marking delta = Marking.of(Map.of("p", MultiSet.of(1), "q", MultiSet.of(2)));
            net.addMarking(delta);
            assertEquals(Marking.of(Map.of("p", MultiSet.of(0, 1, 1), "q", MultiSet.of(2))), net.getMarking());
            net.removeMarking(delta);
            assertEquals(Marking.of("p", MultiSet.of(0, 1)), net.getMarking());
        }

        @Test
        @DisplayName("removeMarking 令牌不足时恢复原标识")
        void testRemoveMarkingRollback() {
            Marking before = net.getMarking();
            assertThrows(TokenException.class,
                    () -> net.removeMarking(Marking.of(Map.of("p", MultiSet.of(0), "q", MultiSet.of(9)))));
            assertEquals(before, net.getMarking());
        }

        @Test
        @DisplayName("触发变迁改变网的标识")
        void testFire() {
            net.transition("t").fire(Substitution.of("x", 1));
            assertEquals(Marking.of(Map.of("p", MultiSet.of(0), "q", MultiSet.of(2))), net.getMarking());
        }
    }

    @Nested
    @DisplayName("结构变换")
    class TransformationTests {

        @Test
        @DisplayName("renameNode 保持弧")
        void testRenamePlace() {
            net.renameNode("p", "r");
            assertAll(
                    () -> assertTrue(net.hasPlace("r")),
                    () -> assertFalse(net.hasNode("p")),
                    () -> assertEquals(Set.of("r"), net.pre("t")),
                    () -> assertEquals(Set.of("t"), net.post("r"))
            );
        }

        @Test
        @DisplayName("renameNode 改名变迁")
        void testRenameTransition() {
            net.renameNode("t", "u");
            assertEquals(Set.of("u"), net.post("p"));
            assertEquals(Set.of("q"), net.post("u"));
        }

        @Test
        @DisplayName("renameNode 的错误")
        void testRenameErrors() {
            StructureException e1 = assertThrows(StructureException.class, () -> net.renameNode("p", "q"));
            assertEquals("node 'q' exists", e1.getMessage());
            StructureException e2 = assertThrows(StructureException.class, () -> net.renameNode("z", "w"));
            assertEquals("node 'z' not found", e2.getMessage());
        }

        @Test
        @DisplayName("copyPlace 复制令牌和弧")
        void testCopyPlace() {
            net.copyPlace("p", "p2", "p3");
            assertAll(
                    () -> assertEquals(MultiSet.of(0, 1), net.place("p2").getTokens()),
                    () -> assertEquals(Set.of("p", "p2", "p3"), net.pre("t")),
                    () -> assertEquals(new Variable("x"), net.transition("t").getPre().get("p3"))
            );
        }

        @Test
        @DisplayName("copyTransition 复制守卫和弧")
        void testCopyTransition() {
            net.copyTransition("t", "t2");
            Transition copy = net.transition("t2");
            assertAll(
                    () -> assertEquals(new Expression("x < k"), copy.getGuard()),
                    () -> assertEquals(Set.of("t", "t2"), net.post("p")),
                    () -> assertEquals(Set.of("t", "t2"), net.pre("q")),
                    () -> assertSame(net.getEnvironment(), copy.getEnvironment())
            );
        }

        @Test
        @DisplayName("mergePlaces 合并令牌并把弧合为 MultiArc")
        void testMergePlaces() {
            net.addPlace(new Place("s", List.of(2)));
            net.addInput("s", "t", new Variable("y"));
            net.mergePlaces("m", "p", "s");
            Place merged = net.place("m");
            assertAll(
                    () -> assertEquals(MultiSet.of(0, 1, 2), merged.getTokens()),
                    () -> assertEquals(new MultiArc(new Variable("x"), new Variable("y")),
                            merged.getPost().get("t")),
                    () -> assertTrue(merged.getType().accepts("text")),
                    () -> assertTrue(net.hasPlace("p"))
            );
        }

        @Test
        @DisplayName("mergeTransitions 合取守卫")
        void testMergeTransitions() {
            net.addTransition(new Transition("u", "y > 0"));
            net.addInput("p", "u", new Variable("y"));
            net.mergeTransitions("v", "t", "u");
            Transition merged = net.transition("v");
            assertAll(
                    () -> assertEquals(new Expression("(x < k) and (y > 0)"), merged.getGuard()),
                    () -> assertEquals(new MultiArc(new Variable("x"), new Variable("y")), merged.input(net.place("p"))),
                    () -> assertEquals(new Expression("x + 1"), merged.output(net.place("q")))
            );
            assertEquals(List.of(Substitution.of("x", 0, "y", 1)), merged.modes());
        }

        @Test
        @DisplayName("copy 得到独立的网")
        void testCopy() {
            PetriNet copy = net.copy("N2");
            copy.place("p").add(9);
            copy.declare("k", 0);
            assertAll(
                    () -> assertEquals("N2", copy.getName()),
                    () -> assertEquals(MultiSet.of(0, 1), net.place("p").getTokens()),
                    () -> assertEquals(5, net.getEnvironment().get("k")),
                    () -> assertEquals(Set.of("q"), copy.post("t")),
                    () -> assertNotSame(net.place("p"), copy.place("p")),
                    () -> assertTrue(copy.transition("t").modes().isEmpty())
            );
        }

        @Test
        @DisplayName("Value 标注在副本中保持不变")
        void testCopyKeepsLabels() {
            net.addPlace(new Place("c", List.of("go")));
            net.addInput("c", "t", new Value("go"));
            PetriNet copy = net.copy(null);
            assertEquals("N", copy.getName());
            assertEquals(new Value("go"), copy.transition("t").getPre().get("c"));
        }
    }
}
