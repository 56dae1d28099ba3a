package org.petri.exceptions;

/**
 * 所有 Petri 网相关错误的基类。
 * 与 JDK 的 IllegalArgumentException 一样是非受检异常，调用方按需捕获。
 * @author Ayalyt
 */
public class PetriNetException extends RuntimeException {

    public PetriNetException(String message) {
        super(message);
    }

    public PetriNetException(String message, Throwable cause) {
        super(message, cause);
    }
}
