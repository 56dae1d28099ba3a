package org.petri.nets.graph;

import org.apache.commons.lang3.tuple.Pair;
import org.petri.core.Marking;
import org.petri.core.Substitution;
import org.petri.exceptions.StructureException;
import org.petri.nets.base.Transition;
import org.petri.nets.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * 可达标识图。
 * 状态用从 0 开始的连续整数编号，0 是初始标识。边上的标签是 (变迁名, 绑定)。
 * 图按广度优先顺序增量构建：待处理的状态在一个先进先出队列中，
 * 处理一个状态时枚举所有使能的 (变迁, 绑定)，计算后继标识，复用或分配状态编号并记录边。
 * 图持有网的一个副本，副本总是处于“当前状态”的标识上。
 * @author Ayalyt
 */
public class StateGraph implements Iterable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(StateGraph.class);

    private final PetriNet net;
    private final Deque<Integer> todo = new ArrayDeque<>();
    private final Set<Integer> done = new TreeSet<>();
    private final Set<Integer> removed = new LinkedHashSet<>();
    private final Map<Marking, Integer> states = new HashMap<>();
    private final Map<Integer, Marking> markings = new HashMap<>();
    private final Map<Integer, Map<Integer, Set<Pair<String, Substitution>>>> succ = new HashMap<>();
    private final Map<Integer, Map<Integer, Set<Pair<String, Substitution>>>> pred = new HashMap<>();
    private int last = -1;
    private int current;

    /**
     * @param net 要探索的网；图使用它的副本，原网不会被修改。
     */
    public StateGraph(PetriNet net) {
        this.net = net.copy(null);
        createState(net.getMarking());
        this.current = 0;
        logger.info("为网 {} 创建状态图，初始标识 {}", net.getName(), markings.get(0));
    }

    /**
     * @return 状态图内部使用的网副本，处于当前状态的标识上。
     */
    public PetriNet getNet() {
        return net;
    }

    private int createState(Marking marking) {
        last++;
        markings.put(last, marking);
        states.put(marking, last);
        pred.put(last, new LinkedHashMap<>());
        succ.put(last, new LinkedHashMap<>());
        todo.addLast(last);
        return last;
    }

    private void createEdge(int source, int target, Pair<String, Substitution> label) {
        succ.get(source).computeIfAbsent(target, k -> new LinkedHashSet<>()).add(label);
        pred.get(target).computeIfAbsent(source, k -> new LinkedHashSet<>()).add(label);
    }

    private void removeEdges(int source, int target) {
        Map<Integer, Set<Pair<String, Substitution>>> out = succ.get(source);
        if (out != null) {
            out.remove(target);
        }
        Map<Integer, Set<Pair<String, Substitution>>> in = pred.get(target);
        if (in != null) {
            in.remove(source);
        }
    }

    // --- 导航 ---

    /**
     * 把网移动到给定状态的标识上，即使该状态已是当前状态也重设标识。
     * @param state 状态编号；null 或已删除的状态表示当前状态。
     * @throws IllegalArgumentException 状态不存在。
     */
    public void goTo(Integer state) {
        if (state == null || removed.contains(state)) {
            state = current();
        }
        if (!markings.containsKey(state)) {
            throw new IllegalArgumentException("unknown state");
        }
        current = state;
        net.setMarking(markings.get(state));
    }

    /**
     * @return 当前状态。当前状态被删除时返回队列中第一个状态或任一已处理的状态。
     * @throws StructureException 所有状态都被删除。
     */
    public int current() {
        if (!removed.contains(current)) {
            return current;
        }
        if (!todo.isEmpty()) {
            return todo.peekFirst();
        }
        if (!done.isEmpty()) {
            return done.iterator().next();
        }
        throw new StructureException("all states removed");
    }

    /**
     * @throws IllegalArgumentException 状态不存在。
     */
    public Marking marking(int state) {
        Marking marking = markings.get(state);
        if (marking == null) {
            throw new IllegalArgumentException("unknown state");
        }
        return marking;
    }

    public boolean contains(Marking marking) {
        return states.containsKey(marking);
    }

    /**
     * @return 标识对应的状态编号，不存在时为 null。
     */
    public Integer state(Marking marking) {
        return states.get(marking);
    }

    // --- 邻接 ---

    /**
     * 后继状态，必要时先把图构建到该状态为止。
     * @return 后继状态到边标签集合的映射。
     */
    public Map<Integer, Set<Pair<String, Substitution>>> successors(int state) {
        requireKnown(state);
        process(state);
        return Collections.unmodifiableMap(succ.get(state));
    }

    public Map<Integer, Set<Pair<String, Substitution>>> successors() {
        return successors(current());
    }

    /**
     * 已经发现的前驱状态，不触发构建。
     */
    public Map<Integer, Set<Pair<String, Substitution>>> predecessors(int state) {
        requireKnown(state);
        return Collections.unmodifiableMap(pred.get(state));
    }

    public Map<Integer, Set<Pair<String, Substitution>>> predecessors() {
        return predecessors(current());
    }

    private void requireKnown(int state) {
        if (!markings.containsKey(state)) {
            throw new IllegalArgumentException("unknown state");
        }
    }

    // --- 构建 ---

    /**
     * 处理队列中编号不超过 state 的状态，然后回到原来的当前状态。
     */
    private void process(int state) {
        int origin = current();
        build(state);
        goTo(origin);
    }

    /**
     * 处理一个已从队列取出的状态。失败时该状态放回队首，已经记录的边保留，重新处理时会被合并。
     */
    private void compute(int state) {
        try {
            goTo(state);
            Marking marking = markings.get(state);
            for (Transition transition : net.transitions()) {
                for (Substitution mode : new LinkedHashSet<>(transition.modes())) {
                    Pair<Marking, Marking> flow = transition.flow(mode);
                    Marking next = marking.minus(flow.getLeft()).plus(flow.getRight());
                    Integer target = states.get(next);
                    if (target == null) {
                        target = createState(next);
                        logger.debug("新状态 {}: {}", target, next);
                    }
                    createEdge(state, target, Pair.of(transition.getName(), mode));
                }
            }
        } catch (RuntimeException e) {
            logger.error("处理状态 {} 失败: {}", state, e.getMessage());
            todo.addFirst(state);
            throw e;
        }
        done.add(state);
    }

    /**
     * 处理队列中的状态直到队列为空。
     */
    public void build() {
        build(Integer.MAX_VALUE);
    }

    /**
     * 处理队列头部编号不超过 stop 的状态。
     * @param stop 最大的待处理状态编号。
     */
    public void build(int stop) {
        while (!todo.isEmpty() && todo.peekFirst() <= stop) {
            compute(todo.pollFirst());
        }
        logger.info("状态图构建到 {}: 已处理 {} 个状态，待处理 {} 个", stop, done.size(), todo.size());
    }

    /**
     * 有界探索：处理状态直到已处理的状态数达到 maxStates 或队列为空。
     * @param maxStates 最多处理的状态数。
     * @return 探索是否完成。
     */
    public boolean explore(int maxStates) {
        if (maxStates < 0) {
            throw new IllegalArgumentException("maxStates must be non-negative: " + maxStates);
        }
        while (!todo.isEmpty() && done.size() < maxStates) {
            compute(todo.pollFirst());
        }
        if (!todo.isEmpty()) {
            logger.warn("状态图在处理 {} 个状态后停止，仍有 {} 个待处理", done.size(), todo.size());
        }
        return todo.isEmpty();
    }

    /**
     * 删除一个状态以及与它相连的所有边。已删除的编号不会被重用。
     * @return 被删除状态的标识。
     */
    public Marking removeState(int state) {
        requireKnown(state);
        removed.add(state);
        done.remove(state);
        todo.removeIf(s -> s == state);
        Marking marking = markings.remove(state);
        states.remove(marking);
        for (Integer source : new ArrayList<>(pred.get(state).keySet())) {
            removeEdges(source, state);
        }
        for (Integer target : new ArrayList<>(succ.get(state).keySet())) {
            removeEdges(state, target);
        }
        pred.remove(state);
        succ.remove(state);
        if (state == current && size() > 0) {
            goTo(null);
        }
        logger.debug("删除状态 {}: {}", state, marking);
        return marking;
    }

    /**
     * @return 已处理和待处理的状态总数。
     */
    public int size() {
        return done.size() + todo.size();
    }

    public boolean completed() {
        return todo.isEmpty();
    }

    /**
     * @return 待处理的状态数。
     */
    public int todo() {
        return todo.size();
    }

    /**
     * 依次访问每个状态：先是已处理的状态（按编号），再边构建边访问其余状态。
     * 每返回一个状态，网就被移动到该状态上；迭代结束后回到开始时的当前状态。
     */
    @Override
    public Iterator<Integer> iterator() {
        int origin = current();
        List<Integer> processed = new ArrayList<>(done);
        return new Iterator<>() {
            private int index = 0;
            private boolean finished = false;

            @Override
            public boolean hasNext() {
                if (index < processed.size() || !todo.isEmpty()) {
                    return true;
                }
                if (!finished) {
                    finished = true;
                    goTo(origin);
                }
                return false;
            }

            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int state;
                if (index < processed.size()) {
                    state = processed.get(index++);
                } else {
                    state = todo.pollFirst();
                    compute(state);
                }
                goTo(state);
                return state;
            }
        };
    }

    @Override
    public String toString() {
        return "StateGraph(" + net.getName() + ", " + size() + " states)";
    }
}
