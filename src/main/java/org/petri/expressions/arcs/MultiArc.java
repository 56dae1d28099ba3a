package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.DomainException;
import org.petri.expressions.Environment;
import org.petri.utils.CrossProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 多重弧：把若干标注放在同一条弧上，流过的令牌是各分量之和。
 * 相等性不考虑分量顺序。
 * @author Ayalyt
 */
public final class MultiArc extends ArcAnnotation {

    private static final Logger logger = LoggerFactory.getLogger(MultiArc.class);

    private final List<ArcAnnotation> components;
    private final int hashCode;

    /**
     * @param components 分量，至少一个。
     * @throws IllegalArgumentException 没有分量。
     */
    public MultiArc(List<? extends ArcAnnotation> components) {
        super(AnnotationKind.MULTI_ARC);
        Objects.requireNonNull(components, "Components cannot be null");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("MultiArc needs at least one component");
        }
        this.components = List.copyOf(components);
        this.hashCode = new HashSet<>(this.components).hashCode();
    }

    public MultiArc(ArcAnnotation... components) {
        this(List.of(components));
    }

    public List<ArcAnnotation> getComponents() {
        return components;
    }

    public int size() {
        return components.size();
    }

    @Override
    public Set<String> vars() {
        Set<String> result = new LinkedHashSet<>();
        components.forEach(c -> result.addAll(c.vars()));
        return Collections.unmodifiableSet(result);
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        return new MultiArc(components.stream().map(c -> c.substitute(renaming)).toList());
    }

    /**
     * @return 各分量的值组成的列表。
     */
    @Override
    public Object bind(Substitution binding, Environment env) {
        List<Object> result = new ArrayList<>(components.size());
        for (ArcAnnotation component : components) {
            result.add(component.bind(binding, env));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public MultiSet flow(Substitution binding, Environment env) {
        MultiSet result = MultiSet.EMPTY;
        for (ArcAnnotation component : components) {
            result = result.plus(component.flow(binding, env));
        }
        return result;
    }

    @Override
    public List<Object> values(Substitution binding, Environment env) {
        List<Object> result = new ArrayList<>();
        for (ArcAnnotation component : components) {
            result.addAll(component.values(binding, env));
        }
        return result;
    }

    /**
     * 各分量模式的笛卡尔积，合并后保留总流量不超过 available 的那些。
     * 分量找不到模式时异常向外传播。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        List<List<Substitution>> parts = new ArrayList<>(components.size());
        for (ArcAnnotation component : components) {
            parts.add(component.modes(available, env));
        }
        List<Substitution> result = new ArrayList<>();
        for (List<Substitution> combination : CrossProduct.of(parts)) {
            try {
                Substitution merged = Substitution.EMPTY;
                for (Substitution sub : combination) {
                    merged = merged.plus(sub);
                }
                if (flow(merged, env).isSubsetOf(available)) {
                    result.add(merged);
                }
            } catch (DomainException e) {
                logger.debug("跳过不一致的组合 {}: {}", combination, e.getMessage());
            }
        }
        return result;
    }

    @Override
    public boolean isInputAllowed() {
        return components.stream().allMatch(ArcAnnotation::isInputAllowed);
    }

    @Override
    public ArcAnnotation replace(ArcAnnotation old, ArcAnnotation replacement) {
        if (equals(old)) {
            return replacement;
        }
        return new MultiArc(components.stream().map(c -> c.replace(old, replacement)).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MultiArc that = (MultiArc) o;
        return components.size() == that.components.size()
                && new HashSet<>(components).equals(new HashSet<>(that.components));
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return components.stream().map(String::valueOf).collect(Collectors.joining(", ", "MultiArc(", ")"));
    }
}
