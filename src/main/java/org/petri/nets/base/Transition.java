package org.petri.nets.base;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.petri.core.Marking;
import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.DomainException;
import org.petri.exceptions.FiringException;
import org.petri.exceptions.ModeException;
import org.petri.exceptions.StructureException;
import org.petri.exceptions.TokenException;
import org.petri.expressions.Environment;
import org.petri.expressions.arcs.AnnotationKind;
import org.petri.expressions.arcs.ArcAnnotation;
import org.petri.expressions.arcs.Expression;
import org.petri.expressions.arcs.Inhibitor;
import org.petri.utils.CrossProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 变迁：一个守卫和若干输入、输出弧。
 * <p>
 * 绑定（Substitution）使变迁<b>激活</b>：守卫成立且所有令牌满足库所类型；
 * 使变迁<b>使能</b>：激活且输入库所有足够的令牌、没有被抑制弧阻止。
 * 触发时按绑定从输入库所取走令牌，再向输出库所放入令牌。
 * @author Ayalyt
 */
public class Transition extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Transition.class);

    @Getter
    private Expression guard;
    @Getter
    private Environment environment;

    private final Map<Place, ArcAnnotation> inputs = new LinkedHashMap<>();
    private final Map<Place, ArcAnnotation> outputs = new LinkedHashMap<>();

    public Transition(String name) {
        this(name, Expression.TRUE);
    }

    public Transition(String name, Expression guard) {
        super(name);
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null");
        this.environment = new Environment();
    }

    public Transition(String name, String guard) {
        this(name, new Expression(guard));
    }

    public void setGuard(Expression guard) {
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null");
    }

    /**
     * 使用网的共享环境，由 PetriNet 在加入变迁时调用。
     */
    public void attach(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
    }

    /**
     * 离开网时保留一份环境的私有副本。
     */
    public void detach() {
        this.environment = environment.copy();
    }

    // --- 弧 ---

    /**
     * @throws StructureException 已经与该库所相连，或标注不能用于输入弧。
     */
    public void addInput(Place place, ArcAnnotation label) {
        Objects.requireNonNull(place, "Place cannot be null");
        Objects.requireNonNull(label, "Label cannot be null");
        if (inputs.containsKey(place)) {
            throw new StructureException("already connected to '" + place.getName() + "'");
        }
        if (!label.isInputAllowed()) {
            logger.warn("变迁 {} 的输入弧上不允许 {}", getName(), label);
            throw new StructureException("'" + label.getKind().getDisplayName()
                    + "' objects not allowed on input arcs");
        }
        inputs.put(place, label);
        place.linkPost(getName(), label);
        logger.debug("添加输入弧 {} -> {}: {}", place.getName(), getName(), label);
    }

    /**
     * @throws StructureException 没有与该库所相连。
     */
    public void removeInput(Place place) {
        if (inputs.remove(place) == null) {
            throw new StructureException("not connected to '" + place.getName() + "'");
        }
        place.unlinkPost(getName());
    }

    public void addOutput(Place place, ArcAnnotation label) {
        Objects.requireNonNull(place, "Place cannot be null");
        Objects.requireNonNull(label, "Label cannot be null");
        if (outputs.containsKey(place)) {
            throw new StructureException("already connected to '" + place.getName() + "'");
        }
        outputs.put(place, label);
        place.linkPre(getName(), label);
        logger.debug("添加输出弧 {} -> {}: {}", getName(), place.getName(), label);
    }

    public void removeOutput(Place place) {
        if (outputs.remove(place) == null) {
            throw new StructureException("not connected to '" + place.getName() + "'");
        }
        place.unlinkPre(getName());
    }

    /**
     * @return 输入库所到标注的只读映射，按添加顺序。
     */
    public Map<Place, ArcAnnotation> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public Map<Place, ArcAnnotation> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public ArcAnnotation input(Place place) {
        return inputs.get(place);
    }

    public ArcAnnotation output(Place place) {
        return outputs.get(place);
    }

    @Override
    public Map<String, ArcAnnotation> getPre() {
        Map<String, ArcAnnotation> result = new LinkedHashMap<>();
        inputs.forEach((place, label) -> result.put(place.getName(), label));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public Map<String, ArcAnnotation> getPost() {
        Map<String, ArcAnnotation> result = new LinkedHashMap<>();
        outputs.forEach((place, label) -> result.put(place.getName(), label));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public void rename(String newName) {
        String oldName = getName();
        super.rename(newName);
        inputs.forEach((place, label) -> {
            place.unlinkPost(oldName);
            place.linkPost(newName, label);
        });
        outputs.forEach((place, label) -> {
            place.unlinkPre(oldName);
            place.linkPre(newName, label);
        });
    }

    // --- 变量 ---

    /**
     * @return 守卫和所有弧上的变量，不含环境中声明的全局名字。
     */
    public Set<String> vars() {
        Set<String> result = new LinkedHashSet<>(guard.vars());
        inputs.values().forEach(label -> result.addAll(label.vars()));
        outputs.values().forEach(label -> result.addAll(label.vars()));
        result.removeAll(environment.declared());
        return result;
    }

    /**
     * 按 renaming 重命名守卫与所有弧上的变量。
     * @param renaming 变量名到变量名的映射。
     */
    public void substitute(Substitution renaming) {
        guard = guard.rename(renaming);
        for (Map.Entry<Place, ArcAnnotation> entry : inputs.entrySet()) {
            ArcAnnotation label = entry.getValue().substitute(renaming);
            entry.setValue(label);
            entry.getKey().linkPost(getName(), label);
        }
        for (Map.Entry<Place, ArcAnnotation> entry : outputs.entrySet()) {
            ArcAnnotation label = entry.getValue().substitute(renaming);
            entry.setValue(label);
            entry.getKey().linkPre(getName(), label);
        }
    }

    /**
     * @param name 新变迁的名字；null 表示沿用原名。
     * @return 守卫与环境声明相同、不连接任何弧的新变迁。
     */
    public Transition copy(String name) {
        Transition result = new Transition(name == null ? getName() : name, guard);
        result.environment = environment.copy();
        return result;
    }

    // --- 语义 ---

    /**
     * 检查绑定。
     * @param binding 变量到值的绑定。
     * @param checkAvailability 是否检查输入库所的令牌是否足够、抑制弧是否阻止。
     * @param checkInputTypes 是否检查输入弧上的值满足输入库所的类型。
     * @return 守卫成立且所要求的检查都通过时为 true；输出库所的类型总是检查。
     */
    public boolean check(Substitution binding, boolean checkAvailability, boolean checkInputTypes) {
        if (!guard.holds(binding, environment)) {
            return false;
        }
        if (checkAvailability) {
            for (Map.Entry<Place, ArcAnnotation> entry : inputs.entrySet()) {
                Place place = entry.getKey();
                ArcAnnotation label = entry.getValue();
                if (!label.flow(binding, environment).isSubsetOf(place.getTokens())) {
                    return false;
                }
                if (label.getKind() == AnnotationKind.INHIBITOR
                        && ((Inhibitor) label).inhibits(place.getTokens(), binding, environment)) {
                    return false;
                }
            }
        }
        if (checkInputTypes && !typesRespected(inputs, binding)) {
            return false;
        }
        return typesRespected(outputs, binding);
    }

    private boolean typesRespected(Map<Place, ArcAnnotation> arcs, Substitution binding) {
        for (Map.Entry<Place, ArcAnnotation> entry : arcs.entrySet()) {
            try {
                entry.getKey().check(entry.getValue().values(binding, environment));
            } catch (TokenException e) {
                return false;
            }
        }
        return true;
    }

    /**
     * 激活：守卫成立且类型满足，不要求令牌足够。
     */
    public boolean activated(Substitution binding) {
        return check(binding, false, true);
    }

    /**
     * 使能：激活且令牌足够。
     */
    public boolean enabled(Substitution binding) {
        return check(binding, true, true);
    }

    /**
     * 根据输入库所中实际存在的令牌计算所有使能的绑定。
     * 只搜索输入弧；没有输入弧的变迁只有一个候选，即空绑定。
     * 守卫中引用未绑定名字的错误会向外传播。
     * @return 使能的绑定列表。
     */
    public List<Substitution> modes() {
        List<List<Substitution>> parts = new ArrayList<>(inputs.size());
        for (Map.Entry<Place, ArcAnnotation> entry : inputs.entrySet()) {
            try {
                parts.add(entry.getValue().modes(entry.getKey().getTokens(), environment));
            } catch (ModeException e) {
                logger.debug("变迁 {} 在库所 {} 上没有模式: {}", getName(), entry.getKey().getName(), e.getMessage());
                return Collections.emptyList();
            }
        }
        List<Substitution> result = new ArrayList<>();
        for (List<Substitution> combination : CrossProduct.of(parts)) {
            try {
                Substitution binding = Substitution.EMPTY;
                for (Substitution sub : combination) {
                    binding = binding.plus(sub);
                }
                if (check(binding, false, false)) {
                    result.add(binding);
                }
            } catch (DomainException e) {
                logger.debug("变迁 {} 跳过组合 {}: {}", getName(), combination, e.getMessage());
            }
        }
        logger.debug("变迁 {} 的模式: {}", getName(), result);
        return result;
    }

    /**
     * 触发的令牌流。
     * @param binding 绑定。
     * @return (取走的令牌, 放入的令牌)。
     * @throws FiringException 绑定不使能变迁。
     */
    public Pair<Marking, Marking> flow(Substitution binding) {
        if (!enabled(binding)) {
            throw new FiringException("transition not enabled for " + binding);
        }
        return Pair.of(collect(inputs, binding), collect(outputs, binding));
    }

    private Marking collect(Map<Place, ArcAnnotation> arcs, Substitution binding) {
        Map<String, MultiSet> result = new LinkedHashMap<>();
        arcs.forEach((place, label) -> result.put(place.getName(), label.flow(binding, environment)));
        return Marking.of(result);
    }

    /**
     * 以绑定触发变迁。
     * @throws FiringException 绑定不使能变迁。
     */
    public void fire(Substitution binding) {
        if (!enabled(binding)) {
            logger.warn("变迁 {} 在 {} 下未使能", getName(), binding);
            throw new FiringException("transition not enabled for " + binding);
        }
        Map<Place, MultiSet> consumed = new LinkedHashMap<>();
        Map<Place, MultiSet> produced = new LinkedHashMap<>();
        inputs.forEach((place, label) -> consumed.put(place, label.flow(binding, environment)));
        outputs.forEach((place, label) -> produced.put(place, label.flow(binding, environment)));
        consumed.forEach(Place::removeAll);
        produced.forEach(Place::addAll);
        logger.debug("触发变迁 {}: {}", getName(), binding);
    }

    @Override
    public String toString() {
        return "Transition(" + getName() + ", " + guard + ")";
    }
}
