package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.exceptions.ModeException;
import org.petri.expressions.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 变量标注：可以绑定到输入库所中的任意一个令牌。
 */
public final class Variable extends ArcAnnotation {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    static final Pattern SYNTAX = Pattern.compile("^[a-zA-Z]\\w*$");

    private final String name;

    /**
     * @param name 变量名，必须满足 [A-Za-z]\w*。
     * @throws IllegalArgumentException 名字不合法。
     */
    public Variable(String name) {
        super(AnnotationKind.VARIABLE);
        if (name == null || !SYNTAX.matcher(name).matches()) {
            logger.error("非法的变量名: {}", name);
            throw new IllegalArgumentException("not a variable name '" + name + "'");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Set<String> vars() {
        return Set.of(name);
    }

    @Override
    public ArcAnnotation substitute(Substitution renaming) {
        Object target = renaming.apply(name);
        if (!(target instanceof String)) {
            throw new IllegalArgumentException("cannot rename '" + name + "' to " + target);
        }
        return target.equals(name) ? this : new Variable((String) target);
    }

    @Override
    public Object bind(Substitution binding, Environment env) {
        return binding.get(name);
    }

    /**
     * 每个令牌（计入重复）给出一个绑定。
     * @throws ModeException available 为空。
     */
    @Override
    public List<Substitution> modes(MultiSet available, Environment env) {
        if (available.isEmpty()) {
            throw new ModeException("no value to bind");
        }
        List<Substitution> result = new ArrayList<>(available.length());
        for (Object value : available) {
            result.add(Substitution.of(name, value));
        }
        return result;
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
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
