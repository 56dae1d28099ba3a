package org.petri.exceptions;

/**
 * 令牌错误：违反库所类型约束、负数次数、出现次数不足。
 */
public class TokenException extends PetriNetException {

    public TokenException(String message) {
        super(message);
    }
}
