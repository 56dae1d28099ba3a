package org.petri.expressions.lang;

import org.petri.expressions.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认的表达式求值器，实现一个小的类 Python 表达式语言：
 * 整数、浮点、字符串、True/False/None 字面量，名字，括号与元组，
 * 算术 + - * / // %，比较（可链式）、in/not in，以及 and/or/not（也接受 &amp;&amp; || !）。
 * 解析结果按文本缓存。
 * @author Ayalyt
 */
public final class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultExpressionEvaluator.class);

    private static final DefaultExpressionEvaluator INSTANCE = new DefaultExpressionEvaluator();

    private final ConcurrentHashMap<String, SyntaxNode> cache = new ConcurrentHashMap<>(256);

    public static DefaultExpressionEvaluator getInstance() {
        return INSTANCE;
    }

    private SyntaxNode parse(String text) {
        Objects.requireNonNull(text, "Expression text cannot be null");
        return cache.computeIfAbsent(text, t -> {
            SyntaxNode node = ExpressionParser.parse(t);
            logger.debug("解析表达式 '{}': {}", t, node);
            return node;
        });
    }

    @Override
    public Object evaluate(String text, Map<String, Object> names) {
        return parse(text).evaluate(names);
    }

    @Override
    public Set<String> names(String text) {
        Set<String> names = new LinkedHashSet<>();
        parse(text).collectNames(names);
        return Collections.unmodifiableSet(names);
    }

    /**
     * 逐个替换名字记号，保留原文的其余部分（空白、字符串字面量）。
     */
    @Override
    public String rename(String text, Map<String, String> renaming) {
        parse(text);
        return ExpressionParser.rename(text, renaming);
    }

    @Override
    public boolean isTrue(Object value) {
        return Values.truth(value);
    }
}
