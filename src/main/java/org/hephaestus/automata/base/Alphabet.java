package org.hephaestus.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 代表有限自动机的字母表。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 * 符号按 {@link Symbol#compareTo} 排序，该顺序即子集构造时遍历字母表的规范顺序。
 * 字母表中不允许出现 {@link Symbol#EPSILON}。
 */
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    @Getter
    private final SortedSet<Symbol> symbols;
    private final Map<String, Symbol> symbolsByLabel;
    private final int hashCode;

    /**
     * 私有构造函数，通过符号集合创建 Alphabet。
     * @param symbols 包含所有符号的集合。
     */
    private Alphabet(Set<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols set cannot be null");

        // '_' 在字符形式的迁移中表示 epsilon，不能再作为普通符号
        if (symbols.contains(Symbol.EPSILON)
                || symbols.stream().anyMatch(s -> s.getLabel().equals(String.valueOf(Symbol.EPSILON_CHAR)))) {
            logger.warn("Alphabet 不能包含 epsilon 符号: {}", symbols);
            throw new IllegalArgumentException("Alphabet 不能包含 epsilon 符号 '" + Symbol.EPSILON_CHAR + "'");
        }

        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
        this.symbolsByLabel = this.symbols.stream()
                .collect(Collectors.toUnmodifiableMap(Symbol::getLabel, Function.identity()));
        this.hashCode = Objects.hash(this.symbols);
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从一个符号集合创建 Alphabet 实例。
     * @param symbols 构成字母表的符号集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Set<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列符号标签创建 Alphabet 实例。
     * @param labels 符号标签，不允许重复。
     * @return Alphabet 实例。
     * @throws IllegalArgumentException 如果标签重复。
     */
    public static Alphabet of(String... labels) {
        return fromList(Arrays.stream(labels).map(Symbol::of).toList());
    }

    /**
     * 工厂方法：从一系列单字符符号创建 Alphabet 实例。
     * @param chars 符号字符，不允许重复。
     * @return Alphabet 实例。
     * @throws IllegalArgumentException 如果字符重复。
     */
    public static Alphabet of(char... chars) {
        Symbol[] symbols = new Symbol[chars.length];
        for (int i = 0; i < chars.length; i++) {
            symbols[i] = Symbol.of(chars[i]);
        }
        return fromList(List.of(symbols));
    }

    private static Alphabet fromList(List<Symbol> symbolList) {
        Set<Symbol> symbolSet = new LinkedHashSet<>(symbolList);
        if (symbolSet.size() != symbolList.size()) {
            logger.warn("Alphabet 包含重复的符号标签：{}", symbolList);
            throw new IllegalArgumentException("Alphabet 包含重复的符号标签。");
        }
        return new Alphabet(symbolSet);
    }

    /**
     * 根据标签获取符号。
     * @param label 符号标签。
     * @return 对应的 Symbol 实例，如果不存在则返回 null。
     */
    public Symbol getSymbolByLabel(String label) {
        return symbolsByLabel.get(label);
    }

    /**
     * 检查字母表是否包含某个符号。
     * @param symbol 要检查的符号。
     * @return 如果包含则返回 true。
     */
    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    /**
     * 获取字母表中符号的数量。
     * @return 符号数量。
     */
    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "[" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                "]";
    }
}
