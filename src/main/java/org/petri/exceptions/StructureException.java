package org.petri.exceptions;

/**
 * 网结构错误：重名节点、重复或缺失的弧、找不到节点、输入弧上不允许的标注。
 */
public class StructureException extends PetriNetException {

    public StructureException(String message) {
        super(message);
    }
}
