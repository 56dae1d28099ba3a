package org.petri.expressions.arcs;

import org.petri.core.MultiSet;
import org.petri.core.Substitution;
import org.petri.expressions.Environment;

import java.util.List;
import java.util.Set;

/**
 * 弧上的标注。
 * 输入弧（库所到变迁）上的标注可以是值、变量，以及它们的组合；
 * 输出弧（变迁到库所）上还允许表达式，表示一次计算。
 * <p>
 * 标注是不可变的，变体是封闭的（构造函数包内可见），按 {@link #getKind()} 区分。
 * 所有需要求值的操作都显式接收求值环境。
 * @author Ayalyt
 */
public abstract class ArcAnnotation {

    private final AnnotationKind kind;

    ArcAnnotation(AnnotationKind kind) {
        this.kind = kind;
    }

    public AnnotationKind getKind() {
        return kind;
    }

    /**
     * @return 标注中出现的变量名，按出现顺序。
     */
    public abstract Set<String> vars();

    /**
     * 按 renaming 重命名变量（名字到名字，不是值）。
     * @param renaming 重命名映射。
     * @return 新的标注。
     */
    public abstract ArcAnnotation substitute(Substitution renaming);

    /**
     * 在绑定下计算标注的值。
     * @param binding 变量到值的绑定。
     * @param env 求值环境。
     * @return 标注的值。
     */
    public abstract Object bind(Substitution binding, Environment env);

    /**
     * 在绑定下，这条弧流过的令牌。默认是 bind 结果构成的单元素多重集。
     */
    public MultiSet flow(Substitution binding, Environment env) {
        return MultiSet.of(bind(binding, env));
    }

    /**
     * 需要做类型检查的令牌值。一般就是 flow 中的值。
     */
    public List<Object> values(Substitution binding, Environment env) {
        return flow(binding, env).items();
    }

    /**
     * 找出所有能让这条弧从 available 中取走令牌的绑定。
     * @param available 输入库所中现有的令牌。
     * @param env 求值环境。
     * @return 候选绑定列表。
     * @throws org.petri.exceptions.ModeException 如果没有任何绑定。
     */
    public abstract List<Substitution> modes(MultiSet available, Environment env);

    /**
     * @return 是否允许出现在输入弧上。
     */
    public abstract boolean isInputAllowed();

    /**
     * 返回把 old 替换为 replacement 之后的标注。
     * 非组合标注在等于 old 时返回 replacement，否则返回自身；组合标注替换其各个分量。
     */
    public ArcAnnotation replace(ArcAnnotation old, ArcAnnotation replacement) {
        return equals(old) ? replacement : this;
    }
}
