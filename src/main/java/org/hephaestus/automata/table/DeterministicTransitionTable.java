package org.hephaestus.automata.table;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.exceptions.ConstructionErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntBiFunction;

/**
 * DFA 的迁移函数 δ: State × Symbol → State。
 * 对 [0, n) × alphabet 中每一对恰好有一个目标，构造后不可变。
 */
public final class DeterministicTransitionTable implements TransitionTable {

    private static final Logger logger = LoggerFactory.getLogger(DeterministicTransitionTable.class);

    @Getter
    private final int stateCount;
    @Getter
    private final Alphabet alphabet;
    private final Map<Pair<Integer, Symbol>, Integer> delta;

    private DeterministicTransitionTable(int stateCount, Alphabet alphabet, Map<Pair<Integer, Symbol>, Integer> delta) {
        this.stateCount = stateCount;
        this.alphabet = alphabet;
        this.delta = Collections.unmodifiableMap(delta);
    }

    /**
     * 从字面三元组构造并校验迁移函数。
     * 同一 (state, symbol) 重复声明相同目标是允许的；目标不同则为冲突。
     *
     * @param stateCount  状态数 n。
     * @param alphabet    字母表。
     * @param transitions 迁移三元组，按声明顺序校验。
     * @return 全函数形式的迁移表。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException
     *         INVALID_TRANSITION_STATE / UNKNOWN_SYMBOL / CONFLICTING_TRANSITION / INCOMPLETE_TRANSITION
     */
    public static DeterministicTransitionTable build(int stateCount, Alphabet alphabet, List<Transition> transitions) {
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        Objects.requireNonNull(transitions, "Transitions cannot be null.");

        Map<Pair<Integer, Symbol>, Integer> delta = new HashMap<>();
        for (Transition transition : transitions) {
            TransitionTables.checkTransition(stateCount, alphabet, transition, false);
            Pair<Integer, Symbol> key = Pair.of(transition.getSource(), transition.getSymbol());
            Integer previous = delta.putIfAbsent(key, transition.getTarget());
            if (previous != null && previous != transition.getTarget()) {
                throw TransitionTables.reject(ConstructionErrorKind.CONFLICTING_TRANSITION,
                        "Conflicting transition: (" + key.getLeft() + ", '" + key.getRight() + "') -> "
                                + previous + " and -> " + transition.getTarget());
            }
        }

        for (int state = 0; state < stateCount; state++) {
            for (Symbol symbol : alphabet.getSymbols()) {
                if (!delta.containsKey(Pair.of(state, symbol))) {
                    throw TransitionTables.reject(ConstructionErrorKind.INCOMPLETE_TRANSITION,
                            "Missing transition: (" + state + ", '" + symbol + "')");
                }
            }
        }

        logger.debug("建立 DFA 迁移表：{} 个状态，{} 个符号", stateCount, alphabet.size());
        return new DeterministicTransitionTable(stateCount, alphabet, delta);
    }

    /**
     * 由一个全函数直接生成迁移表，供乘积构造等本身即保证完全性的变换使用。
     *
     * @param stateCount 状态数 n。
     * @param alphabet   字母表。
     * @param function   对每个 (state, symbol) 给出 [0, n) 内的目标。
     * @return 迁移表。
     */
    public static DeterministicTransitionTable fromFunction(int stateCount, Alphabet alphabet,
                                                           ToIntBiFunction<Integer, Symbol> function) {
        Map<Pair<Integer, Symbol>, Integer> delta = new HashMap<>();
        for (int state = 0; state < stateCount; state++) {
            for (Symbol symbol : alphabet.getSymbols()) {
                int target = function.applyAsInt(state, symbol);
                if (target < 0 || target >= stateCount) {
                    logger.error("fromFunction: ({}, '{}') -> {} 越界，状态数为 {}", state, symbol, target, stateCount);
                    throw new IllegalStateException("Generated target " + target + " is outside [0, " + stateCount + ")");
                }
                delta.put(Pair.of(state, symbol), target);
            }
        }
        return new DeterministicTransitionTable(stateCount, alphabet, delta);
    }

    /**
     * δ(state, symbol)。由完全性保证一定存在。
     */
    public int next(int state, Symbol symbol) {
        TransitionTables.checkState(stateCount, state);
        Integer target = delta.get(Pair.of(state, symbol));
        if (target == null) {
            // 完全性保证了字母表内的符号一定命中
            throw TransitionTables.unknownSymbol(alphabet, symbol);
        }
        return target;
    }

    @Override
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>(delta.size());
        for (int state = 0; state < stateCount; state++) {
            for (Symbol symbol : alphabet.getSymbols()) {
                result.add(Transition.of(state, symbol, delta.get(Pair.of(state, symbol))));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DeterministicTransitionTable that = (DeterministicTransitionTable) o;
        return stateCount == that.stateCount &&
                alphabet.equals(that.alphabet) &&
                delta.equals(that.delta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stateCount, alphabet, delta);
    }
}
