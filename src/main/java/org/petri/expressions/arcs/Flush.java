package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.ModeException;
import org.petri.exceptions.TokenException;
import org.petri.expressions.Environment;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 清空弧。用在输入弧上时把库所中的全部令牌（可以为空）绑定到一个变量并全部取走；
 * 用在输出弧上时把一个集合值中的所有元素放入库所。
 * 文本是合法变量名时为变量，否则为表达式（只能用在输出弧上）。
 */
public final class Flush extends ArcAnnotation {

    private final ArcAnnotation annotation;

    public Flush(String text) {
        super(AnnotationKind.FLUSH);
        Objects.requireNonNull(text, "Text cannot be null");
        String stripped = text.strip();
        if (Variable.SYNTAX.matcher(stripped).matches()) {
            this.annotation = new Variable(stripped);
        } else {
            this.annotation = new Expression(stripped);
        }
    }

    private Flush(ArcAnnotation annotation) {
        super(AnnotationKind.FLUSH);
        this.annotation = annotation;
    }

    /**
     * @return 内部的 Variable 或 Expression。
     */
    public ArcAnnotation getAnnotation() {
        return annotation;
    }

    @Override
    public Set<String> vars() {
        return annotation.vars();
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        return new Flush(annotation.substitute(renaming));
    }

    /**
     * @return 绑定的集合值。
     */
    @Override
    public Object bind(Substitution binding, Environment env) {
        return annotation.bind(binding, env);
    }

    /**
     * @throws TokenException 绑定的值不是集合。
     */
    @Override
    public MultiSet flow(Substitution binding, Environment env) {
        Object value = bind(binding, env);
        if (value instanceof Iterable<?> values) {
            return MultiSet.copyOf(values);
        }
        throw new TokenException("cannot flush non-collection value " + value);
    }

    /**
     * 恰好一个绑定：变量绑定到整个 available，available 为空时也一样。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        if (!(annotation instanceof Variable variable)) {
            throw new ModeException("'Flush' objects not allowed on input arcs");
        }
        return List.of(Substitution.of(variable.getName(), available));
    }

    @Override
    public boolean isInputAllowed() {
        return annotation.isInputAllowed();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return annotation.equals(((Flush) o).annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), annotation);
    }

    @Override
    public String toString() {
        return annotation + "!";
    }
}
