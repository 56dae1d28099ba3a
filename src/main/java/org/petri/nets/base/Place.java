package org.petri.nets.base;

import lombok.Getter;
import org.petri.core.MultiSet;
import org.petri.exceptions.TokenException;
import org.petri.expressions.arcs.ArcAnnotation;
import org.petri.typing.TokenType;
import org.petri.typing.TokenTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 库所：保存一个令牌多重集，并用 TokenType 约束可以放入的值。
 * 所有修改都先检查再替换多重集，失败时令牌保持不变。
 * @author Ayalyt
 */
public class Place extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Place.class);

    @Getter
    private MultiSet tokens = MultiSet.EMPTY;
    @Getter
    private TokenType type;

    /** 输出到本库所的变迁名 -> 标注。 */
    private final Map<String, ArcAnnotation> pre = new LinkedHashMap<>();
    /** 从本库所输入的变迁名 -> 标注。 */
    private final Map<String, ArcAnnotation> post = new LinkedHashMap<>();

    public Place(String name) {
        this(name, MultiSet.EMPTY, TokenTypes.ANY);
    }

    public Place(String name, Iterable<?> tokens) {
        this(name, tokens, TokenTypes.ANY);
    }

    /**
     * @param name 库所名。
     * @param tokens 初始令牌。
     * @param type 令牌约束。
     * @throws TokenException 初始令牌违反约束。
     */
    public Place(String name, Iterable<?> tokens, TokenType type) {
        super(name);
        this.type = Objects.requireNonNull(type, "Token type cannot be null");
        addAll(tokens);
        logger.debug("创建库所 {}: {}", name, this.tokens);
    }

    /**
     * 检查每个值是否满足约束。
     * @throws TokenException 第一个不满足约束的值。
     */
    public void check(Iterable<?> values) {
        for (Object value : values) {
            if (!type.accepts(value)) {
                logger.warn("库所 {} 拒绝令牌 {}（类型 {}）", getName(), value, type);
                throw new TokenException("forbidden token '" + value + "'");
            }
        }
    }

    public void add(Object value) {
        addAll(Collections.singletonList(value));
    }

    /**
     * 加入多个令牌。任何一个值被拒绝时都不加入。
     */
    public void addAll(Iterable<?> values) {
        check(values);
        tokens = tokens.addAll(values);
    }

    /**
     * @throws TokenException 令牌不足。
     */
    public void remove(Object value) {
        removeAll(Collections.singletonList(value));
    }

    public void removeAll(Iterable<?> values) {
        tokens = tokens.removeAll(values);
    }

    /**
     * 用 values 替换全部令牌。
     */
    public void reset(Iterable<?> values) {
        check(values);
        tokens = MultiSet.copyOf(values);
    }

    public void empty() {
        tokens = MultiSet.EMPTY;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean contains(Object value) {
        return tokens.contains(value);
    }

    /**
     * 修改约束，不重新检查现有令牌。
     */
    public void setType(TokenType type) {
        this.type = Objects.requireNonNull(type, "Token type cannot be null");
    }

    /**
     * @param name 新库所的名字；null 表示沿用原名。
     * @return 令牌与约束相同、不连接任何弧的新库所。
     */
    public Place copy(String name) {
        return new Place(name == null ? getName() : name, tokens, type);
    }

    @Override
    public Map<String, ArcAnnotation> getPre() {
        return Collections.unmodifiableMap(pre);
    }

    @Override
    public Map<String, ArcAnnotation> getPost() {
        return Collections.unmodifiableMap(post);
    }

    void linkPre(String transition, ArcAnnotation label) {
        pre.put(transition, label);
    }

    void unlinkPre(String transition) {
        pre.remove(transition);
    }

    void linkPost(String transition, ArcAnnotation label) {
        post.put(transition, label);
    }

    void unlinkPost(String transition) {
        post.remove(transition);
    }

    @Override
    public String toString() {
        return "Place(" + getName() + ", " + tokens + ", " + type + ")";
    }
}
