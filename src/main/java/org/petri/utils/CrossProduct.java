package org.petri.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 笛卡尔积工具。
 * 用于把每条弧各自的候选模式组合成变迁的候选绑定。
 * @author Ayalyt
 */
public final class CrossProduct {

    private static final Logger logger = LoggerFactory.getLogger(CrossProduct.class);

    private CrossProduct() {
    }

    /**
     * 计算若干集合的笛卡尔积。
     * 零个集合的积是仅含一个空元组的列表；任一集合为空时结果为空。
     * @param sets 各个因子，按顺序组合。
     * @return 元组列表，每个元组按 sets 的顺序取一个元素。
     */
    public static <T> List<List<T>> of(List<? extends List<? extends T>> sets) {
        List<List<T>> result = new ArrayList<>();
        result.add(Collections.emptyList());
        for (List<? extends T> factor : sets) {
            List<List<T>> next = new ArrayList<>(result.size() * Math.max(1, factor.size()));
            for (List<T> prefix : result) {
                for (T item : factor) {
                    List<T> tuple = new ArrayList<>(prefix.size() + 1);
                    tuple.addAll(prefix);
                    tuple.add(item);
                    next.add(Collections.unmodifiableList(tuple));
                }
            }
            result = next;
            if (result.isEmpty()) {
                break;
            }
        }
        logger.debug("计算了 {} 个集合的笛卡尔积，得到 {} 个元组", sets.size(), result.size());
        return result;
    }
}
