package org.petri.expressions;

import lombok.Getter;
import org.petri.core.Substitution;
import org.petri.expressions.lang.DefaultExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 表达式的求值环境：全局声明加上求值器。
 * 一个网的所有变迁共享同一个环境；求值时绑定中的名字优先于全局声明。
 * @author Ayalyt
 */
public class Environment {

    private static final Logger logger = LoggerFactory.getLogger(Environment.class);

    private final Map<String, Object> globals;
    @Getter
    private final ExpressionEvaluator evaluator;

    public Environment() {
        this(DefaultExpressionEvaluator.getInstance());
    }

    public Environment(ExpressionEvaluator evaluator) {
        this(evaluator, new LinkedHashMap<>());
    }

    private Environment(ExpressionEvaluator evaluator, Map<String, Object> globals) {
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.globals = globals;
    }

    /**
     * 声明一个全局名字，已存在时覆盖。
     * @param name 名字。
     * @param value 值。
     */
    public void declare(String name, Object value) {
        Objects.requireNonNull(name, "Name cannot be null");
        globals.put(name, value);
        logger.debug("声明全局名字 {} = {}", name, value);
    }

    public boolean contains(String name) {
        return globals.containsKey(name);
    }

    public Object get(String name) {
        return globals.get(name);
    }

    public Set<String> declared() {
        return Collections.unmodifiableSet(globals.keySet());
    }

    public Map<String, Object> getGlobals() {
        return Collections.unmodifiableMap(globals);
    }

    /**
     * 在绑定和全局声明下计算表达式。
     * @param text 表达式文本。
     * @param binding 变量绑定，优先于全局声明。
     * @return 表达式的值。
     */
    public Object evaluate(String text, Substitution binding) {
        Map<String, Object> names = new LinkedHashMap<>(globals);
        names.putAll(binding.asMap());
        Object result = evaluator.evaluate(text, names);
        logger.debug("在{}下计算{}得到{}", binding, text, result);
        return result;
    }

    /**
     * 计算表达式并按求值器的规则解释为真值。
     */
    public boolean holds(String text, Substitution binding) {
        return evaluator.isTrue(evaluate(text, binding));
    }

    public Set<String> names(String text) {
        return evaluator.names(text);
    }

    public String rename(String text, Map<String, String> renaming) {
        return evaluator.rename(text, renaming);
    }

    /**
     * @return 有独立全局声明、共享同一求值器的副本。
     */
    public Environment copy() {
        return new Environment(evaluator, new LinkedHashMap<>(globals));
    }

    @Override
    public String toString() {
        return "Environment" + globals;
    }
}
