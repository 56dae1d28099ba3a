package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.ModeException;
import org.petri.expressions.Environment;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 常量标注：总是流过同一个令牌。
 */
public final class Value extends ArcAnnotation {

    private final Object value;

    public Value(Object value) {
        super(AnnotationKind.VALUE);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Set<String> vars() {
        return Collections.emptySet();
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        return this;
    }

    @Override
    public Object bind(Substitution binding, Environment env) {
        return value;
    }

    /**
     * @return 值存在时返回一个空绑定。
     * @throws ModeException 值不在 available 中。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        if (available.contains(value)) {
            return List.of(Substitution.EMPTY);
        }
        throw new ModeException("no match for value");
    }

    @Override
    public boolean isInputAllowed() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(value, ((Value) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
