package org.petri.exceptions;

/**
 * 试图以当前未使能的绑定触发变迁。
 */
public class FiringException extends PetriNetException {

    public FiringException(String message) {
        super(message);
    }
}
