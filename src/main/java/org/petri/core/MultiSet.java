package org.petri.core;

import org.petri.exceptions.TokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 可重复集合（多重集），即从值到正整数出现次数的映射。
 * 此类是不可变的，所有修改操作都返回新的实例。
 * 不变量：内部映射中的每个次数都 >= 1，次数为零的条目会被删除。
 * 比较操作是包含关系，不是全序。
 * @author Ayalyt
 */
public final class MultiSet implements Iterable<Object> {

    private static final Logger logger = LoggerFactory.getLogger(MultiSet.class);

    public static final MultiSet EMPTY = new MultiSet(Collections.emptyMap());

    private final Map<Object, Integer> counts;
    private final int length;
    private final int hashCode;

    /**
     * 私有构造函数，调用方保证 counts 中没有非正次数。
     * @param counts 值到出现次数的映射。
     */
    private MultiSet(Map<Object, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
        int total = 0;
        for (int c : counts.values()) {
            total += c;
        }
        this.length = total;
        this.hashCode = counts.hashCode();
    }

    // --- 工厂方法 ---

    /**
     * 从若干值创建多重集，重复的值会被计数。
     * @param values 值。
     * @return 新的 MultiSet。
     */
    public static MultiSet of(Object... values) {
        if (values.length == 0) {
            return EMPTY;
        }
        return EMPTY.addAll(Arrays.asList(values));
    }

    /**
     * 从一个值集合创建多重集。
     * @param values 可迭代的值集合；如果本身就是 MultiSet 则直接返回。
     * @return 新的 MultiSet。
     */
    public static MultiSet copyOf(Iterable<?> values) {
        Objects.requireNonNull(values, "Values cannot be null");
        if (values instanceof MultiSet) {
            return (MultiSet) values;
        }
        return EMPTY.addAll(values);
    }

    /**
     * 从值到次数的映射创建多重集，次数为零的条目被忽略。
     * @param counts 值到次数的映射。
     * @return 新的 MultiSet。
     * @throws TokenException 如果某个次数为负。
     */
    public static MultiSet fromCounts(Map<?, Integer> counts) {
        Map<Object, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<?, Integer> entry : counts.entrySet()) {
            int times = entry.getValue();
            checkTimes(times);
            if (times > 0) {
                result.put(entry.getKey(), times);
            }
        }
        return result.isEmpty() ? EMPTY : new MultiSet(result);
    }

    private static void checkTimes(int times) {
        if (times < 0) {
            logger.error("多重集操作收到了负的次数 {}", times);
            throw new TokenException("negative values are forbidden");
        }
    }

    // --- 修改操作（返回新实例） ---

    public MultiSet add(Object value) {
        return add(value, 1);
    }

    /**
     * 将一个值加入 times 次。
     * @param value 要加入的值。
     * @param times 次数，必须非负。
     * @return 加入后的新 MultiSet。
     */
    public MultiSet add(Object value, int times) {
        return addAll(Collections.singletonList(value), times);
    }

    public MultiSet addAll(Iterable<?> values) {
        return addAll(values, 1);
    }

    /**
     * 将集合中的每个值各加入 times 次。
     * @param values 要加入的值。
     * @param times 每个值的次数，必须非负。
     * @return 加入后的新 MultiSet。
     */
    public MultiSet addAll(Iterable<?> values, int times) {
        checkTimes(times);
        if (times == 0) {
            return this;
        }
        Map<Object, Integer> result = new LinkedHashMap<>(counts);
        for (Object value : values) {
            result.merge(value, times, Integer::sum);
        }
        return result.isEmpty() ? EMPTY : new MultiSet(result);
    }

    public MultiSet remove(Object value) {
        return remove(value, 1);
    }

    /**
     * 将一个值移除 times 次。
     * @param value 要移除的值。
     * @param times 次数，必须非负且不超过当前次数。
     * @return 移除后的新 MultiSet。
     * @throws TokenException 如果次数为负或出现次数不足。
     */
    public MultiSet remove(Object value, int times) {
        return removeAll(Collections.singletonList(value), times);
    }

    public MultiSet removeAll(Iterable<?> values) {
        return removeAll(values, 1);
    }

    /**
     * 将集合中的每个值各移除 times 次。
     * @param values 要移除的值。
     * @param times 每个值的次数。
     * @return 移除后的新 MultiSet。
     * @throws TokenException 如果次数为负或某个值的出现次数不足。
     */
    public MultiSet removeAll(Iterable<?> values, int times) {
        checkTimes(times);
        Map<Object, Integer> result = new LinkedHashMap<>(counts);
        for (Object value : values) {
            int current = result.getOrDefault(value, 0);
            if (times > current) {
                logger.debug("从{}中移除{} {}次失败：出现次数不足", this, value, times);
                throw new TokenException("not enough occurrences");
            }
            if (current == times) {
                result.remove(value);
            } else {
                result.put(value, current - times);
            }
        }
        return result.isEmpty() ? EMPTY : new MultiSet(result);
    }

    // --- 多重集算术 ---

    /**
     * 多重集加法。
     * @param other 另一个 MultiSet。
     * @return 两者之和。
     */
    public MultiSet plus(MultiSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        Map<Object, Integer> result = new LinkedHashMap<>(counts);
        other.counts.forEach((value, times) -> result.merge(value, times, Integer::sum));
        return new MultiSet(result);
    }

    /**
     * 多重集减法。
     * @param other 被减去的 MultiSet，必须包含于当前多重集。
     * @return 两者之差。
     * @throws TokenException 如果 other 不是当前多重集的子集。
     */
    public MultiSet minus(MultiSet other) {
        Map<Object, Integer> result = new LinkedHashMap<>(counts);
        for (Map.Entry<Object, Integer> entry : other.counts.entrySet()) {
            int current = result.getOrDefault(entry.getKey(), 0);
            int times = entry.getValue();
            if (times > current) {
                throw new TokenException("not enough occurrences");
            }
            if (current == times) {
                result.remove(entry.getKey());
            } else {
                result.put(entry.getKey(), current - times);
            }
        }
        return result.isEmpty() ? EMPTY : new MultiSet(result);
    }

    /**
     * 乘以非负整数。
     * @param k 乘数。
     * @return 每个值的次数都乘以 k 的新 MultiSet；k 为 0 时为空。
     */
    public MultiSet times(int k) {
        checkTimes(k);
        if (k == 0) {
            return EMPTY;
        }
        Map<Object, Integer> result = new LinkedHashMap<>();
        counts.forEach((value, times) -> result.put(value, times * k));
        return new MultiSet(result);
    }

    // --- 查询 ---

    /**
     * @param value 要查询的值。
     * @return 该值的出现次数，不存在时为 0。
     */
    public int count(Object value) {
        return counts.getOrDefault(value, 0);
    }

    public boolean contains(Object value) {
        return counts.containsKey(value);
    }

    /**
     * @return 元素个数（计入重复）。
     */
    public int length() {
        return length;
    }

    /**
     * @return 不同值的个数（不计重复）。
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * @return 不同值构成的集合。
     */
    public Set<Object> domain() {
        return counts.keySet();
    }

    /**
     * @return 按插入顺序、计入重复的元素列表。
     */
    public List<Object> items() {
        List<Object> result = new ArrayList<>(length);
        for (Object value : this) {
            result.add(value);
        }
        return result;
    }

    /**
     * @return 值到出现次数的只读映射。
     */
    public Map<Object, Integer> asMap() {
        return counts;
    }

    // --- 包含关系 ---

    /**
     * 包含关系 this <= other：每个值在 this 中的次数不超过其在 other 中的次数。
     */
    public boolean isSubsetOf(MultiSet other) {
        if (this.counts.size() > other.counts.size()) {
            return false;
        }
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > other.count(entry.getKey())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 严格包含关系 this < other：包含且存在严格更小的次数，或 this 的不同值更少。
     */
    public boolean isStrictSubsetOf(MultiSet other) {
        boolean strict = false;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            int count = other.count(entry.getKey());
            if (entry.getValue() > count) {
                return false;
            } else if (entry.getValue() < count) {
                strict = true;
            }
        }
        return strict || this.counts.size() < other.counts.size();
    }

    public boolean isSupersetOf(MultiSet other) {
        return other.isSubsetOf(this);
    }

    public boolean isStrictSupersetOf(MultiSet other) {
        return other.isStrictSubsetOf(this);
    }

    // --- Object 方法 ---

    /**
     * 按值迭代，计入重复。
     */
    @Override
    public Iterator<Object> iterator() {
        Iterator<Map.Entry<Object, Integer>> entries = counts.entrySet().iterator();
        return new Iterator<>() {
            private Object current;
            private int remaining = 0;

            @Override
            public boolean hasNext() {
                return remaining > 0 || entries.hasNext();
            }

            @Override
            public Object next() {
                if (remaining == 0) {
                    if (!entries.hasNext()) {
                        throw new NoSuchElementException();
                    }
                    Map.Entry<Object, Integer> entry = entries.next();
                    current = entry.getKey();
                    remaining = entry.getValue();
                }
                remaining--;
                return current;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MultiSet that = (MultiSet) o;
        return length == that.length && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return items().stream()
                .map(MultiSet::render)
                .collect(Collectors.joining(", ", "{", "}"));
    }

    static String render(Object value) {
        if (value instanceof String) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
