package org.petri.nets.models;

import lombok.Getter;
import org.petri.core.Marking;
import org.petri.core.MultiSet;
import org.petri.exceptions.StructureException;
import org.petri.expressions.Environment;
import org.petri.expressions.ExpressionEvaluator;
import org.petri.expressions.arcs.AnnotationKind;
import org.petri.expressions.arcs.ArcAnnotation;
import org.petri.expressions.arcs.Expression;
import org.petri.expressions.arcs.MultiArc;
import org.petri.nets.base.Node;
import org.petri.nets.base.Place;
import org.petri.nets.base.Transition;
import org.petri.typing.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 着色 Petri 网：一组库所和变迁，以及它们之间带标注的弧。
 * 库所和变迁共享一个名字空间。网中的所有变迁共享同一个求值环境。
 * 所有弧的修改都通过网进行，以保持两端节点的前驱、后继信息一致。
 * @author Ayalyt
 */
public class PetriNet {

    private static final Logger logger = LoggerFactory.getLogger(PetriNet.class);

    @Getter
    private String name;
    @Getter
    private final Environment environment;

    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final Map<String, Node> nodes = new LinkedHashMap<>();

    public PetriNet(String name) {
        this(name, new Environment());
    }

    public PetriNet(String name, ExpressionEvaluator evaluator) {
        this(name, new Environment(evaluator));
    }

    private PetriNet(String name, Environment environment) {
        this.name = Objects.requireNonNull(name, "Net name cannot be null");
        this.environment = environment;
        logger.info("创建 Petri 网: {}", name);
    }

    public void rename(String newName) {
        this.name = Objects.requireNonNull(newName, "Net name cannot be null");
    }

    /**
     * 声明一个所有变迁可见的全局名字。
     */
    public void declare(String globalName, Object value) {
        environment.declare(globalName, value);
    }

    // --- 节点 ---

    public boolean hasPlace(String nodeName) {
        return places.containsKey(nodeName);
    }

    public boolean hasTransition(String nodeName) {
        return transitions.containsKey(nodeName);
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    /**
     * @throws StructureException 已有同名的库所或变迁，或库所已属于其他网。
     */
    public void addPlace(Place place) {
        Objects.requireNonNull(place, "Place cannot be null");
        String placeName = place.getName();
        if (places.containsKey(placeName)) {
            throw new StructureException("place '" + placeName + "' exists");
        }
        if (transitions.containsKey(placeName)) {
            throw new StructureException("a transition '" + placeName + "' exists");
        }
        if (place.getNet() != null) {
            throw new StructureException("place '" + placeName + "' already belongs to net '"
                    + place.getNet().getName() + "'");
        }
        places.put(placeName, place);
        nodes.put(placeName, place);
        place.setNet(this);
        logger.debug("网 {} 添加库所 {}", name, place);
    }

    /**
     * 删除库所及其所有弧。
     * @throws StructureException 库所不存在。
     */
    public void removePlace(String placeName) {
        Place place = place(placeName);
        for (String trans : new ArrayList<>(place.getPost().keySet())) {
            removeInput(placeName, trans);
        }
        for (String trans : new ArrayList<>(place.getPre().keySet())) {
            removeOutput(placeName, trans);
        }
        places.remove(placeName);
        nodes.remove(placeName);
        place.setNet(null);
        logger.debug("网 {} 删除库所 {}", name, placeName);
    }

    /**
     * 加入变迁，变迁改用网的求值环境。
     * @throws StructureException 已有同名的库所或变迁，或变迁已属于其他网。
     */
    public void addTransition(Transition transition) {
        Objects.requireNonNull(transition, "Transition cannot be null");
        String transName = transition.getName();
        if (transitions.containsKey(transName)) {
            throw new StructureException("transition '" + transName + "' exists");
        }
        if (places.containsKey(transName)) {
            throw new StructureException("a place '" + transName + "' exists");
        }
        if (transition.getNet() != null) {
            throw new StructureException("transition '" + transName + "' already belongs to net '"
                    + transition.getNet().getName() + "'");
        }
        transitions.put(transName, transition);
        nodes.put(transName, transition);
        transition.setNet(this);
        transition.attach(environment);
        logger.debug("网 {} 添加变迁 {}", name, transition);
    }

    public void removeTransition(String transName) {
        Transition transition = transition(transName);
        for (Place place : new ArrayList<>(transition.outputs().keySet())) {
            removeOutput(place.getName(), transName);
        }
        for (Place place : new ArrayList<>(transition.inputs().keySet())) {
            removeInput(place.getName(), transName);
        }
        transitions.remove(transName);
        nodes.remove(transName);
        transition.setNet(null);
        transition.detach();
        logger.debug("网 {} 删除变迁 {}", name, transName);
    }

    /**
     * @throws StructureException 库所不存在。
     */
    public Place place(String placeName) {
        Place place = places.get(placeName);
        if (place == null) {
            throw new StructureException("place '" + placeName + "' not found");
        }
        return place;
    }

    public List<Place> places() {
        return new ArrayList<>(places.values());
    }

    public Transition transition(String transName) {
        Transition transition = transitions.get(transName);
        if (transition == null) {
            throw new StructureException("transition '" + transName + "' not found");
        }
        return transition;
    }

    public List<Transition> transitions() {
        return new ArrayList<>(transitions.values());
    }

    public Node node(String nodeName) {
        Node node = nodes.get(nodeName);
        if (node == null) {
            throw new StructureException("node '" + nodeName + "' not found");
        }
        return node;
    }

    public List<Node> nodes() {
        return new ArrayList<>(nodes.values());
    }

    // --- 弧 ---

    /**
     * 添加从库所到变迁的输入弧。
     * @throws StructureException 标注不能用于输入弧、节点不存在或弧已存在。
     */
    public void addInput(String placeName, String transName, ArcAnnotation label) {
        Objects.requireNonNull(label, "Label cannot be null");
        if (!label.isInputAllowed()) {
            throw new StructureException("'" + label.getKind().getDisplayName() + "' not allowed on input arcs");
        }
        transition(transName).addInput(place(placeName), label);
    }

    public void removeInput(String placeName, String transName) {
        transition(transName).removeInput(place(placeName));
    }

    /**
     * 添加从变迁到库所的输出弧。
     */
    public void addOutput(String placeName, String transName, ArcAnnotation label) {
        Objects.requireNonNull(label, "Label cannot be null");
        transition(transName).addOutput(place(placeName), label);
    }

    public void removeOutput(String placeName, String transName) {
        transition(transName).removeOutput(place(placeName));
    }

    /**
     * @return 给定节点的所有前驱节点名。
     */
    public Set<String> pre(String... nodeNames) {
        return pre(Arrays.asList(nodeNames));
    }

    public Set<String> pre(Collection<String> nodeNames) {
        Set<String> result = new LinkedHashSet<>();
        for (String nodeName : nodeNames) {
            result.addAll(node(nodeName).getPre().keySet());
        }
        return result;
    }

    public Set<String> post(String... nodeNames) {
        return post(Arrays.asList(nodeNames));
    }

    public Set<String> post(Collection<String> nodeNames) {
        Set<String> result = new LinkedHashSet<>();
        for (String nodeName : nodeNames) {
            result.addAll(node(nodeName).getPost().keySet());
        }
        return result;
    }

    // --- 标识 ---

    /**
     * @return 当前标识，只包含非空的库所。
     */
    public Marking getMarking() {
        Map<String, MultiSet> result = new LinkedHashMap<>();
        places.forEach((placeName, place) -> result.put(placeName, place.getTokens()));
        return Marking.of(result);
    }

    /**
     * 设置标识：标识中没有的库所被清空，标识中不属于网的库所名被忽略。
     * 任何库所拒绝令牌时恢复原标识并重新抛出异常。
     */
    public void setMarking(Marking marking) {
        Marking old = getMarking();
        try {
            applyMarking(marking);
        } catch (RuntimeException e) {
            logger.warn("网 {} 设置标识 {} 失败，恢复到 {}: {}", name, marking, old, e.getMessage());
            applyMarking(old);
            throw e;
        }
    }

    private void applyMarking(Marking marking) {
        places.forEach((placeName, place) -> {
            if (marking.contains(placeName)) {
                place.reset(marking.get(placeName));
            } else {
                place.empty();
            }
        });
    }

    /**
     * 向各库所加入标识中的令牌，失败时恢复原标识。
     */
    public void addMarking(Marking marking) {
        Marking old = getMarking();
        try {
            marking.asMap().forEach((placeName, tokens) -> {
                if (places.containsKey(placeName)) {
                    places.get(placeName).addAll(tokens);
                }
            });
        } catch (RuntimeException e) {
            logger.warn("网 {} 加入标识 {} 失败: {}", name, marking, e.getMessage());
            applyMarking(old);
            throw e;
        }
    }

    /**
     * 从各库所取走标识中的令牌，失败时恢复原标识。
     */
    public void removeMarking(Marking marking) {
        Marking old = getMarking();
        try {
            marking.asMap().forEach((placeName, tokens) -> {
                if (places.containsKey(placeName)) {
                    places.get(placeName).removeAll(tokens);
                }
            });
        } catch (RuntimeException e) {
            logger.warn("网 {} 移除标识 {} 失败: {}", name, marking, e.getMessage());
            applyMarking(old);
            throw e;
        }
    }

    // --- 结构变换 ---

    /**
     * 改名，保持弧和名字空间一致。
     * @throws StructureException 新名字已被占用或旧名字不存在。
     */
    public void renameNode(String oldName, String newName) {
        if (nodes.containsKey(newName)) {
            throw new StructureException("node '" + newName + "' exists");
        }
        if (!nodes.containsKey(oldName)) {
            throw new StructureException("node '" + oldName + "' not found");
        }
        Node node = nodes.get(oldName);
        nodes.put(newName, node);
        node.rename(newName);
        nodes.remove(oldName);
        if (node instanceof Place place) {
            places.remove(oldName);
            places.put(newName, place);
        } else {
            transitions.remove(oldName);
            transitions.put(newName, (Transition) node);
        }
        logger.debug("网 {} 中节点 {} 改名为 {}", name, oldName, newName);
    }

    /**
     * 复制库所（令牌、类型和所有弧）为若干新库所。
     */
    public void copyPlace(String source, String... targets) {
        Place src = place(source);
        for (String target : targets) {
            addPlace(src.copy(target));
            src.getPost().forEach((trans, label) -> addInput(target, trans, label));
            src.getPre().forEach((trans, label) -> addOutput(target, trans, label));
        }
    }

    /**
     * 复制变迁（守卫和所有弧）为若干新变迁。
     */
    public void copyTransition(String source, String... targets) {
        Transition src = transition(source);
        for (String target : targets) {
            Transition copy = src.copy(target);
            addTransition(copy);
            src.getPre().forEach((placeName, label) -> addInput(placeName, target, label));
            src.getPost().forEach((placeName, label) -> addOutput(placeName, target, label));
        }
    }

    /**
     * 把若干库所合并为一个新库所：令牌相加，类型取并，
     * 与同一变迁之间的多条弧合并为一条 MultiArc。原库所保留。
     */
    public void mergePlaces(String target, String... sources) {
        if (sources.length == 0) {
            throw new IllegalArgumentException("no place to merge");
        }
        List<Place> sourceList = new ArrayList<>();
        for (String source : sources) {
            sourceList.add(place(source));
        }
        MultiSet tokens = MultiSet.EMPTY;
        TokenType type = sourceList.get(0).getType();
        for (int i = 0; i < sourceList.size(); i++) {
            tokens = tokens.plus(sourceList.get(i).getTokens());
            if (i > 0) {
                type = type.or(sourceList.get(i).getType());
            }
        }
        addPlace(new Place(target, tokens, type));
        Map<String, List<ArcAnnotation>> post = new LinkedHashMap<>();
        Map<String, List<ArcAnnotation>> pre = new LinkedHashMap<>();
        for (Place place : sourceList) {
            place.getPost().forEach((trans, label) -> collect(post, trans, label));
            place.getPre().forEach((trans, label) -> collect(pre, trans, label));
        }
        post.forEach((trans, labels) -> addInput(target, trans, combine(labels)));
        pre.forEach((trans, labels) -> addOutput(target, trans, combine(labels)));
        logger.info("网 {} 合并库所 {} 为 {}", name, Arrays.toString(sources), target);
    }

    /**
     * 把若干变迁合并为一个新变迁：守卫取合取，与同一库所之间的多条弧合并为一条 MultiArc。原变迁保留。
     */
    public void mergeTransitions(String target, String... sources) {
        if (sources.length == 0) {
            throw new IllegalArgumentException("no transition to merge");
        }
        List<Transition> sourceList = new ArrayList<>();
        for (String source : sources) {
            sourceList.add(transition(source));
        }
        Expression guard = Expression.TRUE;
        for (Transition trans : sourceList) {
            guard = guard.and(trans.getGuard());
        }
        addTransition(new Transition(target, guard));
        Map<String, List<ArcAnnotation>> pre = new LinkedHashMap<>();
        Map<String, List<ArcAnnotation>> post = new LinkedHashMap<>();
        for (Transition trans : sourceList) {
            trans.getPre().forEach((placeName, label) -> collect(pre, placeName, label));
            trans.getPost().forEach((placeName, label) -> collect(post, placeName, label));
        }
        pre.forEach((placeName, labels) -> addInput(placeName, target, combine(labels)));
        post.forEach((placeName, labels) -> addOutput(placeName, target, combine(labels)));
        logger.info("网 {} 合并变迁 {} 为 {}", name, Arrays.toString(sources), target);
    }

    private static void collect(Map<String, List<ArcAnnotation>> arcs, String key, ArcAnnotation label) {
        List<ArcAnnotation> labels = arcs.computeIfAbsent(key, k -> new ArrayList<>());
        if (label.getKind() == AnnotationKind.MULTI_ARC) {
            labels.addAll(((MultiArc) label).getComponents());
        } else {
            labels.add(label);
        }
    }

    private static ArcAnnotation combine(List<ArcAnnotation> labels) {
        return labels.size() == 1 ? labels.get(0) : new MultiArc(labels);
    }

    /**
     * @param newName 副本的名字；null 表示沿用原名。
     * @return 结构、令牌和全局声明都相同的独立副本。
     */
    public PetriNet copy(String newName) {
        PetriNet result = new PetriNet(newName == null ? name : newName, environment.copy());
        for (Place place : places.values()) {
            result.addPlace(place.copy(null));
        }
        for (Transition trans : transitions.values()) {
            result.addTransition(new Transition(trans.getName(), trans.getGuard()));
            trans.getPre().forEach((placeName, label) -> result.addInput(placeName, trans.getName(), label));
            trans.getPost().forEach((placeName, label) -> result.addOutput(placeName, trans.getName(), label));
        }
        return result;
    }

    @Override
    public String toString() {
        return "PetriNet(" + name + ")";
    }
}
