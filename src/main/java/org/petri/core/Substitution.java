package org.petri.core;

import org.petri.exceptions.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 从名字到值的部分映射，未定义处等价于恒等映射。
 * 支持并（plus，检查两个操作数之间的一致性）与复合（compose，(f*g)(x) = f(g(x))）。
 * 此类是不可变的，所有操作都不修改操作数。
 * @author Ayalyt
 */
public final class Substitution {

    private static final Logger logger = LoggerFactory.getLogger(Substitution.class);

    public static final Substitution EMPTY = new Substitution(Collections.emptyMap());

    private final Map<String, Object> bindings;
    private final int hashCode;

    private Substitution(Map<String, Object> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
        this.hashCode = bindings.hashCode();
    }

    /**
     * 工厂方法：从映射创建替换。
     * @param bindings 名字到值的映射。
     * @return Substitution 实例。
     */
    public static Substitution of(Map<String, ?> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        if (bindings.isEmpty()) {
            return EMPTY;
        }
        return new Substitution(new LinkedHashMap<>(bindings));
    }

    /**
     * 工厂方法：只包含一个绑定的替换。
     */
    public static Substitution of(String name, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(Objects.requireNonNull(name, "Name cannot be null"), value);
        return new Substitution(map);
    }

    /**
     * 工厂方法：两个绑定。
     */
    public static Substitution of(String name1, Object value1, String name2, Object value2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(name1, value1);
        map.put(name2, value2);
        return new Substitution(map);
    }

    /**
     * 调用式查找，永不失败。
     * @param name 要查找的名字（通常是字符串，也可以是 g(x) 的任意结果）。
     * @return 绑定的值；如果没有绑定则返回 name 本身。
     */
    public Object apply(Object name) {
        if (name instanceof String && bindings.containsKey(name)) {
            return bindings.get(name);
        }
        return name;
    }

    /**
     * 严格查找。
     * @param name 变量名。
     * @return 绑定的值。
     * @throws DomainException 如果 name 未绑定。
     */
    public Object get(String name) {
        if (!bindings.containsKey(name)) {
            throw new DomainException("unbound variable '" + name + "'");
        }
        return bindings.get(name);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /**
     * 两个替换的并。
     * @param other 另一个替换。
     * @return 合并后的新替换。
     * @throws DomainException 如果两者把同一个名字映射到不同的值。
     */
    public Substitution plus(Substitution other) {
        if (other.bindings.isEmpty()) {
            return this;
        }
        if (this.bindings.isEmpty()) {
            return other;
        }
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            String name = entry.getKey();
            if (other.bindings.containsKey(name)
                    && !Objects.equals(entry.getValue(), other.bindings.get(name))) {
                logger.debug("合并{}和{}时在{}上冲突", this, other, name);
                throw new DomainException("conflict on '" + name + "'");
            }
        }
        Map<String, Object> result = new LinkedHashMap<>(bindings);
        result.putAll(other.bindings);
        return new Substitution(result);
    }

    /**
     * 函数复合：结果满足 (this * other)(x) = this(other(x))。
     * @param other 先作用的替换。
     * @return 复合后的新替换。
     */
    public Substitution compose(Substitution other) {
        Map<String, Object> result = new LinkedHashMap<>(bindings);
        for (Map.Entry<String, Object> entry : other.bindings.entrySet()) {
            result.put(entry.getKey(), apply(entry.getValue()));
        }
        return new Substitution(result);
    }

    /**
     * 限制定义域。
     * @param names 保留的名字。
     * @return 只包含 names 中名字的新替换。
     */
    public Substitution restrict(Collection<String> names) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            if (names.contains(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result.isEmpty() ? EMPTY : new Substitution(result);
    }

    /**
     * 增加或覆盖一个绑定。
     */
    public Substitution with(String name, Object value) {
        Map<String, Object> result = new LinkedHashMap<>(bindings);
        result.put(name, value);
        return new Substitution(result);
    }

    public Set<String> domain() {
        return bindings.keySet();
    }

    public Set<Object> image() {
        return new LinkedHashSet<>(bindings.values());
    }

    public Map<String, Object> asMap() {
        return bindings;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Substitution that = (Substitution) o;
        return bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + " -> " + MultiSet.render(entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
