package org.hephaestus.automata.exceptions;

import lombok.Getter;

/**
 * 自动机结构校验失败时抛出。
 * 构造是原子的：抛出此异常时不会产生任何部分构造的自动机。
 */
@Getter
public class AutomatonConstructionException extends IllegalArgumentException {

    private final ConstructionErrorKind kind;

    public AutomatonConstructionException(ConstructionErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + ", " + kind.getDescription() + "]: " + getMessage();
    }
}
