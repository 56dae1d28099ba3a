package org.petri.exceptions;

/**
 * 单个弧标注找不到任何满足条件的绑定（无匹配、被抑制、令牌不足）。
 * 在 Transition.modes() 层面被折叠为“零个模式”，不会继续向外传播。
 */
public class ModeException extends PetriNetException {

    public ModeException(String message) {
        super(message);
    }
}
