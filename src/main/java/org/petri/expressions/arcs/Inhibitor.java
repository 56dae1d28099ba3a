package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.DomainException;
import org.petri.exceptions.ModeException;
import org.petri.expressions.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 抑制弧：只有当内部标注在输入库所中找不到满足条件的绑定时，变迁才能触发。
 * 不消耗也不产生令牌。
 * @author Ayalyt
 */
public final class Inhibitor extends ArcAnnotation {

    private static final Logger logger = LoggerFactory.getLogger(Inhibitor.class);

    private final ArcAnnotation annotation;
    private final Expression condition;

    public Inhibitor(ArcAnnotation annotation) {
        this(annotation, Expression.TRUE);
    }

    /**
     * @param annotation 被抑制的标注。
     * @param condition 附加条件，在内部标注的每个绑定下计算。
     */
    public Inhibitor(ArcAnnotation annotation, Expression condition) {
        super(AnnotationKind.INHIBITOR);
        this.annotation = Objects.requireNonNull(annotation, "Annotation cannot be null");
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
    }

    public ArcAnnotation getAnnotation() {
        return annotation;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public Set<String> vars() {
        Set<String> result = new LinkedHashSet<>(annotation.vars());
        result.addAll(condition.vars());
        return Collections.unmodifiableSet(result);
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        return new Inhibitor(annotation.substitute(renaming), condition.rename(renaming));
    }

    /**
     * @return 空列表。
     * @throws ModeException 条件在 binding 下不成立。
     */
    @Override
    public Object bind(Substitution binding, Environment env) {
        if (condition.holds(binding, env)) {
            return Collections.emptyList();
        }
        throw new ModeException("condition not True for " + binding);
    }

    @Override
    public MultiSet flow(Substitution binding, Environment env) {
        return MultiSet.EMPTY;
    }

    @Override
    public List<Object> values(Substitution binding, Environment env) {
        return Collections.emptyList();
    }

    /**
     * @return 未被抑制时返回一个空绑定。
     * @throws ModeException 内部标注有满足条件的绑定。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        Substitution witness = witness(available, Substitution.EMPTY, env);
        if (witness != null) {
            logger.debug("{} 被 {} 抑制", this, witness);
            throw new ModeException("inhibited by " + witness);
        }
        return List.of(Substitution.EMPTY);
    }

    /**
     * 在变迁已有的绑定下检查是否被抑制。内部标注的绑定与 binding 冲突时不计入。
     * @param available 输入库所中现有的令牌。
     * @param binding 变迁的绑定，条件可以引用其中的变量。
     * @param env 求值环境。
     * @return 是否被抑制。
     */
    public boolean inhibits(MultiSet available, Substitution binding, Environment env) {
        return witness(available, binding, env) != null;
    }

    private Substitution witness(MultiSet available, Substitution binding, Environment env) {
        List<Substitution> inner;
        try {
            inner = annotation.modes(available, env);
        } catch (ModeException e) {
            return null;
        }
        for (Substitution mode : inner) {
            Substitution merged;
            try {
                merged = binding.plus(mode);
            } catch (DomainException e) {
                continue;
            }
            if (condition.holds(merged, env)) {
                return mode;
            }
        }
        return null;
    }

    @Override
    public boolean isInputAllowed() {
        return true;
    }

    @Override
    public ArcAnnotation replace(ArcAnnotation old, ArcAnnotation replacement) {
        if (equals(old)) {
            return replacement;
        }
        ArcAnnotation newCondition = condition.replace(old, replacement);
        return new Inhibitor(annotation.replace(old, replacement),
                newCondition instanceof Expression e ? e : condition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Inhibitor that = (Inhibitor) o;
        return annotation.equals(that.annotation) && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), annotation, condition);
    }

    @Override
    public String toString() {
        if (condition.isTrue()) {
            return "Inhibitor(" + annotation + ")";
        }
        return "Inhibitor(" + annotation + ", " + condition + ")";
    }
}
