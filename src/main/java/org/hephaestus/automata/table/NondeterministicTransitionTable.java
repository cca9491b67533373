package org.hephaestus.automata.table;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.StateSet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * NFA 的迁移关系 δ: State × Symbol → Set&lt;State&gt;。
 * 缺失的键表示"没有迁移"而不是错误。键按 (状态, 符号) 排序存放。
 */
public final class NondeterministicTransitionTable implements TransitionTable {

    private static final Logger logger = LoggerFactory.getLogger(NondeterministicTransitionTable.class);

    @Getter
    private final int stateCount;
    @Getter
    private final Alphabet alphabet;
    private final SortedMap<Pair<Integer, Symbol>, StateSet> delta;
    private final boolean hasEpsilonTransitions;

    private NondeterministicTransitionTable(int stateCount, Alphabet alphabet, SortedMap<Pair<Integer, Symbol>, StateSet> delta) {
        this.stateCount = stateCount;
        this.alphabet = alphabet;
        this.delta = Collections.unmodifiableSortedMap(delta);
        this.hasEpsilonTransitions = delta.keySet().stream().anyMatch(key -> key.getRight().isEpsilon());
    }

    /**
     * 从字面三元组构造迁移关系，同一键的目标累积为集合。
     *
     * @param stateCount  状态数 n。
     * @param alphabet    字母表。
     * @param transitions 迁移三元组，可包含 epsilon 迁移。
     * @return 迁移表。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException
     *         INVALID_TRANSITION_STATE / UNKNOWN_SYMBOL
     */
    public static NondeterministicTransitionTable build(int stateCount, Alphabet alphabet, List<Transition> transitions) {
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        Objects.requireNonNull(transitions, "Transitions cannot be null.");

        Map<Pair<Integer, Symbol>, SortedSet<Integer>> grouped = new TreeMap<>();
        for (Transition transition : transitions) {
            TransitionTables.checkTransition(stateCount, alphabet, transition, true);
            grouped.computeIfAbsent(Pair.of(transition.getSource(), transition.getSymbol()), key -> new TreeSet<>())
                    .add(transition.getTarget());
        }

        SortedMap<Pair<Integer, Symbol>, StateSet> delta = new TreeMap<>();
        grouped.forEach((key, targets) -> delta.put(key, StateSet.of(targets)));

        logger.debug("建立 NFA 迁移表：{} 个状态，{} 个符号，{} 个迁移键", stateCount, alphabet.size(), delta.size());
        return new NondeterministicTransitionTable(stateCount, alphabet, delta);
    }

    /**
     * δ(state, symbol)，没有迁移时返回空集。symbol 可以是 {@link Symbol#EPSILON}。
     */
    public StateSet next(int state, Symbol symbol) {
        TransitionTables.checkState(stateCount, state);
        StateSet targets = delta.get(Pair.of(state, symbol));
        if (targets == null) {
            if (!symbol.isEpsilon() && !alphabet.contains(symbol)) {
                throw TransitionTables.unknownSymbol(alphabet, symbol);
            }
            return StateSet.EMPTY;
        }
        return targets;
    }

    public boolean hasEpsilonTransitions() {
        return hasEpsilonTransitions;
    }

    /**
     * 按键顺序列出 (源状态, 符号) 到目标集合的映射。
     */
    public SortedMap<Pair<Integer, Symbol>, StateSet> asMap() {
        return delta;
    }

    @Override
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        delta.forEach((key, targets) -> {
            for (int target : targets) {
                result.add(Transition.of(key.getLeft(), key.getRight(), target));
            }
        });
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
        NondeterministicTransitionTable that = (NondeterministicTransitionTable) o;
        return stateCount == that.stateCount &&
                alphabet.equals(that.alphabet) &&
                delta.equals(that.delta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stateCount, alphabet, delta);
    }
}
