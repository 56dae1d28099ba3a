package org.petri.exceptions;

/**
 * 函数在其定义域之外被调用：未绑定的变量、替换合并时的冲突等。
 */
public class DomainException extends PetriNetException {

    public DomainException(String message) {
        super(message);
    }
}
