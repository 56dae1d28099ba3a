package org.petri.exceptions;

import lombok.Getter;

/**
 * 表达式文本无法解析。
 */
@Getter
public class ExpressionSyntaxException extends PetriNetException {

    private final String text;
    private final int column;

    public ExpressionSyntaxException(String message, String text, int column) {
        super(message + " at column " + column + " in '" + text + "'");
        this.text = text;
        this.column = column;
    }
}
