package org.petri.expressions;

import java.util.Map;
import java.util.Set;

/**
 * 表达式求值器。
 * 守卫和输出弧上的表达式都以文本保存，由求值器在给定的名字环境中计算。
 */
public interface ExpressionEvaluator {

    /**
     * 计算表达式的值。
     * @param text 表达式文本。
     * @param names 名字到值的映射。
     * @return 表达式的值。
     * @throws org.petri.exceptions.UnboundNameException 如果表达式引用了 names 中没有的名字。
     * @throws org.petri.exceptions.EvaluationException 其他求值错误。
     * @throws org.petri.exceptions.ExpressionSyntaxException 如果文本无法解析。
     */
    Object evaluate(String text, Map<String, Object> names);

    /**
     * @param text 表达式文本。
     * @return 表达式中出现的自由名字。
     */
    Set<String> names(String text);

    /**
     * 重命名表达式中的名字。
     * @param text 表达式文本。
     * @param renaming 旧名字到新名字的映射。
     * @return 重命名后的表达式文本。
     */
    String rename(String text, Map<String, String> renaming);

    /**
     * 把求值结果解释为真值，用于守卫和抑制条件。
     */
    default boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        return value != null;
    }
}
