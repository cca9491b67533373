package org.hephaestus.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表有限自动机字母表中的一个符号。
 * Symbol 是不可变对象，仅由其标签决定身份。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    // 空串迁移（epsilon）的保留符号，不属于任何字母表
    public static final Symbol EPSILON = new Symbol("");

    // 字符形式的 epsilon 标记，沿用 '_'
    public static final char EPSILON_CHAR = '_';

    private final String label;
    private final boolean isEpsilon;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 Symbol。
     * @param label 符号的标签。
     */
    private Symbol(String label) {
        this.label = Objects.requireNonNull(label, "Symbol label cannot be null");
        this.isEpsilon = label.isEmpty();
        this.hashCode = Objects.hash(label);
        logger.debug("创建 Symbol: {}", this);
    }

    /**
     * 工厂方法：根据标签创建符号。空标签对应 {@link #EPSILON}。
     * @param label 符号的标签。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(String label) {
        Objects.requireNonNull(label, "Symbol label cannot be null");
        if (label.isEmpty()) {
            return EPSILON;
        }
        return new Symbol(label);
    }

    /**
     * 工厂方法：单字符符号。字符 '_' 表示 epsilon。
     * @param c 符号字符。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(char c) {
        if (c == EPSILON_CHAR) {
            return EPSILON;
        }
        return new Symbol(String.valueOf(c));
    }

    public boolean isEpsilon() {
        return isEpsilon;
    }

    @Override
    public String toString() {
        return label.isEmpty() ? "ε" : label;
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 排在最前面，其余按标签字典序
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
