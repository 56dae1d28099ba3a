package org.petri.exceptions;

import lombok.Getter;

/**
 * 求值环境中缺少表达式引用的名字。
 */
@Getter
public class UnboundNameException extends EvaluationException {

    private final String name;

    public UnboundNameException(String name) {
        super("name '" + name + "' is not defined");
        this.name = name;
    }
}
