package org.petri.expressions.lang;

import org.petri.exceptions.UnboundNameException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式语法树。
 * 解析后的树是不可变的，可以在多个线程之间共享。
 */
abstract class SyntaxNode {

    abstract Object evaluate(Map<String, Object> names);

    /**
     * 把自由名字加入 names。
     */
    abstract void collectNames(Set<String> names);

    /** 常量。 */
    static final class Literal extends SyntaxNode {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            return value;
        }

        @Override
        void collectNames(Set<String> names) {
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /** 名字引用。 */
    static final class Name extends SyntaxNode {
        private final String name;

        Name(String name) {
            this.name = name;
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            if (!names.containsKey(name)) {
                throw new UnboundNameException(name);
            }
            return names.get(name);
        }

        @Override
        void collectNames(Set<String> names) {
            names.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class Unary extends SyntaxNode {
        private final Operator operator;
        private final SyntaxNode operand;

        Unary(Operator operator, SyntaxNode operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            return operator.apply(operand.evaluate(names));
        }

        @Override
        void collectNames(Set<String> names) {
            operand.collectNames(names);
        }

        @Override
        public String toString() {
            return "(" + operator.getSymbol() + " " + operand + ")";
        }
    }

    static final class Binary extends SyntaxNode {
        private final Operator operator;
        private final SyntaxNode left;
        private final SyntaxNode right;

        Binary(Operator operator, SyntaxNode left, SyntaxNode right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            return operator.apply(left.evaluate(names), right.evaluate(names));
        }

        @Override
        void collectNames(Set<String> names) {
            left.collectNames(names);
            right.collectNames(names);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }

    /**
     * 链式比较：a < b <= c 等价于 a < b and b <= c，中间操作数只计算一次。
     */
    static final class Comparison extends SyntaxNode {
        private final List<SyntaxNode> operands;
        private final List<Operator> operators;

        Comparison(List<SyntaxNode> operands, List<Operator> operators) {
            this.operands = List.copyOf(operands);
            this.operators = List.copyOf(operators);
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            Object left = operands.get(0).evaluate(names);
            for (int i = 0; i < operators.size(); i++) {
                Object right = operands.get(i + 1).evaluate(names);
                if (!(Boolean) operators.get(i).apply(left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }

        @Override
        void collectNames(Set<String> names) {
            operands.forEach(operand -> operand.collectNames(names));
        }
    }

    /**
     * 短路的 and/or，结果总是 Boolean。
     */
    static final class Logical extends SyntaxNode {
        private final boolean conjunction;
        private final SyntaxNode left;
        private final SyntaxNode right;

        Logical(boolean conjunction, SyntaxNode left, SyntaxNode right) {
            this.conjunction = conjunction;
            this.left = left;
            this.right = right;
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            boolean first = Values.truth(left.evaluate(names));
            if (conjunction != first) {
                return first;
            }
            return Values.truth(right.evaluate(names));
        }

        @Override
        void collectNames(Set<String> names) {
            left.collectNames(names);
            right.collectNames(names);
        }

        @Override
        public String toString() {
            return "(" + left + (conjunction ? " and " : " or ") + right + ")";
        }
    }

    /** 元组字面量，求值为不可变 List。 */
    static final class TupleLiteral extends SyntaxNode {
        private final List<SyntaxNode> items;

        TupleLiteral(List<SyntaxNode> items) {
            this.items = List.copyOf(items);
        }

        @Override
        Object evaluate(Map<String, Object> names) {
            List<Object> values = new ArrayList<>(items.size());
            for (SyntaxNode item : items) {
                values.add(item.evaluate(names));
            }
            return Values.tuple(values);
        }

        @Override
        void collectNames(Set<String> names) {
            items.forEach(item -> item.collectNames(names));
        }
    }
}
