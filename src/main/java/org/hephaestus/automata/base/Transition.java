package org.hephaestus.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 一条字面迁移 (source, symbol, target)。
 * 只是调用方提供的原始三元组，合法性由所属自动机在构造时校验。
 */
@Getter
public final class Transition {

    private final int source;
    private final Symbol symbol;
    private final int target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param symbol 迁移符号 (a)
     * @param target 目标状态 (q')
     */
    private Transition(int source, Symbol symbol, int target) {
        this.source = source;
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = target;
        this.hashCode = Objects.hash(source, symbol, target);
    }

    public static Transition of(int source, Symbol symbol, int target) {
        return new Transition(source, symbol, target);
    }

    /**
     * 单字符形式，'_' 表示 epsilon 迁移。
     */
    public static Transition of(int source, char symbol, int target) {
        return new Transition(source, Symbol.of(symbol), target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source == that.source &&
                target == that.target &&
                symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("(%d, '%s') -> %d", source, symbol, target);
    }
}
