package org.petri.exceptions;

/**
 * 表达式求值失败（类型不匹配、除零等）。
 */
public class EvaluationException extends PetriNetException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
