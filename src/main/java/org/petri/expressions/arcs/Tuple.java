package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.DomainException;
import org.petri.exceptions.ModeException;
import org.petri.expressions.Environment;
import org.petri.utils.CrossProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 元组标注：流过一个元组令牌（不可变 List），各位置由分量标注给出。
 * 作为输入弧时只匹配长度相同、逐位置匹配的 List 令牌。
 */
public final class Tuple extends ArcAnnotation {

    private static final Logger logger = LoggerFactory.getLogger(Tuple.class);

    private final List<ArcAnnotation> components;

    public Tuple(List<? extends ArcAnnotation> components) {
        super(AnnotationKind.TUPLE);
        Objects.requireNonNull(components, "Components cannot be null");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("missing tuple components");
        }
        this.components = List.copyOf(components);
    }

    public Tuple(ArcAnnotation... components) {
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
        return new Tuple(components.stream().map(c -> c.substitute(renaming)).toList());
    }

    @Override
    public Object bind(Substitution binding, Environment env) {
        List<Object> result = new ArrayList<>(components.size());
        for (ArcAnnotation component : components) {
            result.add(component.bind(binding, env));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @throws ModeException 没有匹配的元组令牌。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        List<Substitution> result = new ArrayList<>();
        for (Object token : available) {
            if (!(token instanceof List<?> tuple) || tuple.size() != components.size()) {
                continue;
            }
            try {
                List<List<Substitution>> parts = new ArrayList<>(components.size());
                for (int i = 0; i < components.size(); i++) {
                    parts.add(components.get(i).modes(MultiSet.of(tuple.get(i)), env));
                }
                for (List<Substitution> combination : CrossProduct.of(parts)) {
                    try {
                        Substitution merged = Substitution.EMPTY;
                        for (Substitution sub : combination) {
                            merged = merged.plus(sub);
                        }
                        result.add(merged);
                    } catch (DomainException e) {
                        logger.debug("元组 {} 中同名变量取值不一致: {}", tuple, e.getMessage());
                    }
                }
            } catch (ModeException e) {
                logger.debug("令牌 {} 与 {} 不匹配: {}", tuple, this, e.getMessage());
            }
        }
        if (result.isEmpty()) {
            throw new ModeException("no mode found");
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
        return new Tuple(components.stream().map(c -> c.replace(old, replacement)).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return components.equals(((Tuple) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        if (components.size() == 1) {
            return "(" + components.get(0) + ",)";
        }
        return components.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
