package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.ModeException;
import org.petri.expressions.Environment;
import org.petri.expressions.ExpressionEvaluator;
import org.petri.expressions.lang.DefaultExpressionEvaluator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 表达式标注：只能用在输出弧上，也用作变迁的守卫。
 * 文本在构造时解析以尽早发现语法错误；字面量 True 不经过求值器。
 * 语法相关的操作（变量、重命名）使用构造时给定的求值器，求值使用调用方传入的环境。
 */
public final class Expression extends ArcAnnotation {

    public static final Expression TRUE = new Expression("True");

    private final String text;
    private final boolean trivial;
    private final ExpressionEvaluator syntax;
    private final Set<String> names;

    public Expression(String text) {
        this(text, DefaultExpressionEvaluator.getInstance());
    }

    /**
     * @param text 表达式文本。
     * @param syntax 用于解析、列出变量和重命名的求值器。
     * @throws org.petri.exceptions.ExpressionSyntaxException 文本无法解析。
     */
    public Expression(String text, ExpressionEvaluator syntax) {
        super(AnnotationKind.EXPRESSION);
        Objects.requireNonNull(text, "Expression text cannot be null");
        this.text = text.strip();
        this.syntax = Objects.requireNonNull(syntax, "Evaluator cannot be null");
        this.trivial = this.text.equals("True");
        this.names = trivial ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(syntax.names(this.text)));
    }

    public String getText() {
        return text;
    }

    /**
     * @return 文本是否就是 True。
     */
    public boolean isTrue() {
        return trivial;
    }

    @Override
    public Set<String> vars() {
        return names;
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        return rename(renaming);
    }

    /**
     * 与 substitute 相同，但保留 Expression 类型。
     */
    public Expression rename(Substitution renaming) {
        if (trivial) {
            return this;
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : names) {
            Object target = renaming.apply(name);
            if (!(target instanceof String)) {
                throw new IllegalArgumentException("cannot rename '" + name + "' to " + target);
            }
            if (!target.equals(name)) {
                map.put(name, (String) target);
            }
        }
        if (map.isEmpty()) {
            return this;
        }
        return new Expression(syntax.rename(text, map), syntax);
    }

    @Override
    public Object bind(Substitution binding, Environment env) {
        if (trivial) {
            return Boolean.TRUE;
        }
        return env.evaluate(text, binding);
    }

    /**
     * 作为守卫使用时的真值。
     */
    public boolean holds(Substitution binding, Environment env) {
        return trivial || env.holds(text, binding);
    }

    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        throw new ModeException("'Expression' objects not allowed on input arcs");
    }

    @Override
    public boolean isInputAllowed() {
        return false;
    }

    /**
     * 合取。True 与任何表达式的合取是后者。
     */
    public Expression and(Expression other) {
        if (trivial) {
            return other;
        }
        if (other.trivial) {
            return this;
        }
        return new Expression("(" + text + ") and (" + other.text + ")", syntax);
    }

    /**
     * 析取。任一方为 True 时结果是 True。
     */
    public Expression or(Expression other) {
        if (trivial || other.trivial) {
            return TRUE;
        }
        return new Expression("(" + text + ") or (" + other.text + ")", syntax);
    }

    public Expression not() {
        if (trivial) {
            return new Expression("False", syntax);
        }
        if (text.equals("False")) {
            return TRUE;
        }
        return new Expression("not (" + text + ")", syntax);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return text.equals(((Expression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
