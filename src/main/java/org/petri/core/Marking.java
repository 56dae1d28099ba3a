package org.petri.core;

import org.petri.exceptions.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Petri 网的标识：从库所名到多重集的映射。
 * 不在映射中的库所视为空，空多重集不会被保存，因此相等的标识有相同的表示。
 * 标识与具体的网无关，可以从一个网中取出再赋给另一个网。
 * @author Ayalyt
 */
public final class Marking {

    private static final Logger logger = LoggerFactory.getLogger(Marking.class);

    public static final Marking EMPTY = new Marking(Collections.emptyMap());

    private final Map<String, MultiSet> tokens;
    private final int hashCode;

    private Marking(Map<String, MultiSet> tokens) {
        this.tokens = Collections.unmodifiableMap(tokens);
        this.hashCode = tokens.hashCode();
    }

    /**
     * 工厂方法：从库所名到多重集的映射创建标识，空多重集被丢弃。
     * @param tokens 库所名到令牌的映射。
     * @return Marking 实例。
     */
    public static Marking of(Map<String, MultiSet> tokens) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Map<String, MultiSet> result = new TreeMap<>();
        tokens.forEach((place, multiSet) -> {
            Objects.requireNonNull(place, "Place name cannot be null");
            if (multiSet != null && !multiSet.isEmpty()) {
                result.put(place, multiSet);
            }
        });
        return result.isEmpty() ? EMPTY : new Marking(result);
    }

    /**
     * 工厂方法：只标记一个库所。
     */
    public static Marking of(String place, MultiSet multiSet) {
        return of(Collections.singletonMap(place, multiSet));
    }

    /**
     * 库所的令牌，未给出的库所返回空多重集。
     * @param place 库所名。
     * @return 该库所的多重集。
     */
    public MultiSet get(String place) {
        return tokens.getOrDefault(place, MultiSet.EMPTY);
    }

    public boolean contains(String place) {
        return tokens.containsKey(place);
    }

    /**
     * @return 被标记（非空）的库所名。
     */
    public Set<String> places() {
        return tokens.keySet();
    }

    public Map<String, MultiSet> asMap() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    /**
     * 标识加法，逐库所相加。
     */
    public Marking plus(Marking other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<String, MultiSet> result = new TreeMap<>(tokens);
        other.tokens.forEach((place, multiSet) -> result.merge(place, multiSet, MultiSet::plus));
        return new Marking(result);
    }

    /**
     * 标识减法，逐库所相减。
     * @param other 被减去的标识。
     * @return 两者之差，变空的库所被删除。
     * @throws DomainException 如果 other 标记了 this 中不存在的库所。
     * @throws org.petri.exceptions.TokenException 如果某个库所的令牌不足。
     */
    public Marking minus(Marking other) {
        Map<String, MultiSet> result = new TreeMap<>(tokens);
        for (Map.Entry<String, MultiSet> entry : other.tokens.entrySet()) {
            String place = entry.getKey();
            MultiSet current = result.get(place);
            if (current == null) {
                logger.debug("标识{}中没有库所{}", this, place);
                throw new DomainException("'" + place + "' absent from the marking");
            }
            MultiSet rest = current.minus(entry.getValue());
            if (rest.isEmpty()) {
                result.remove(place);
            } else {
                result.put(place, rest);
            }
        }
        return result.isEmpty() ? EMPTY : new Marking(result);
    }

    /**
     * this >= other：other 中的每个库所都在 this 中，且令牌更多或相等。
     */
    public boolean isGreaterOrEqual(Marking other) {
        for (Map.Entry<String, MultiSet> entry : other.tokens.entrySet()) {
            MultiSet mine = tokens.get(entry.getKey());
            if (mine == null || !mine.isSupersetOf(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * this > other：this >= other，且某个库所的令牌严格更多或者 this 标记了更多的库所。
     */
    public boolean isGreater(Marking other) {
        boolean more = false;
        for (Map.Entry<String, MultiSet> entry : other.tokens.entrySet()) {
            MultiSet mine = tokens.get(entry.getKey());
            if (mine == null || !mine.isSupersetOf(entry.getValue())) {
                return false;
            }
            if (mine.isStrictSupersetOf(entry.getValue())) {
                more = true;
            }
        }
        return more || tokens.size() > other.tokens.size();
    }

    public boolean isLessOrEqual(Marking other) {
        return other.isGreaterOrEqual(this);
    }

    public boolean isLess(Marking other) {
        return other.isGreater(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Marking that = (Marking) o;
        return tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return tokens.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
