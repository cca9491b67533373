package org.hephaestus.automata.models;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.exceptions.ConstructionErrorKind;
import org.hephaestus.automata.table.DeterministicTransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 确定性有限自动机 (Deterministic Finite Automaton, DFA)。
 * 迁移函数是全函数，因此 run 不会失败，complement 只需翻转接受状态。
 * 此类是不可变的，所有变换都返回新的 DFA。
 */
public final class DFA extends AbstractAutomaton<DeterministicTransitionTable> {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    private DFA(DeterministicTransitionTable table, int start, SortedSet<Integer> accept) {
        super(table, start, accept);
        logger.debug("创建 DFA：{} 个状态，起始 {}，接受 {}", table.getStateCount(), start, accept);
    }

    /**
     * 构造并校验一个 DFA。
     *
     * @param stateCount  状态数 n。
     * @param alphabet    字母表。
     * @param transitions 字面迁移三元组。
     * @param start       起始状态。
     * @param accept      接受状态，重复与顺序无关。
     * @return 新的 DFA。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException 第一个不满足的不变量。
     */
    public static DFA of(int stateCount, Alphabet alphabet, List<Transition> transitions,
                         int start, Collection<Integer> accept) {
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        checkStateCount(stateCount);
        checkStart(stateCount, start);
        SortedSet<Integer> acceptStates = checkAcceptStates(stateCount, accept);
        DeterministicTransitionTable table = DeterministicTransitionTable.build(stateCount, alphabet, transitions);
        return new DFA(table, start, acceptStates);
    }

    @Override
    public boolean run(List<Symbol> input) {
        checkInput(input);
        DeterministicTransitionTable table = getTransitionTable();
        int current = getStartState();
        for (Symbol symbol : input) {
            current = table.next(current, symbol);
        }
        return getAcceptStates().contains(current);
    }

    /**
     * 接受补语言的 DFA：迁移函数与起始状态不变，接受状态取 [0, n) 中的补集。
     */
    public DFA complement() {
        SortedSet<Integer> flipped = new TreeSet<>();
        for (int state = 0; state < getStateCount(); state++) {
            if (!getAcceptStates().contains(state)) {
                flipped.add(state);
            }
        }
        return new DFA(getTransitionTable(), getStartState(), flipped);
    }

    /**
     * L(this) ∪ L(other)。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException 字母表不同时为 ALPHABET_MISMATCH。
     */
    public DFA union(DFA other) {
        return product(other, ProductMode.UNION);
    }

    /**
     * L(this) ∩ L(other)。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException 字母表不同时为 ALPHABET_MISMATCH。
     */
    public DFA intersection(DFA other) {
        return product(other, ProductMode.INTERSECTION);
    }

    /**
     * L(this) \ L(other)。
     */
    public DFA difference(DFA other) {
        return product(other, ProductMode.DIFFERENCE);
    }

    /**
     * 恰好被其中一个接受的串。
     */
    public DFA symmetricDifference(DFA other) {
        return product(other, ProductMode.SYMMETRIC_DIFFERENCE);
    }

    /**
     * 乘积构造。乘积状态 (i, j) 压平为 i * other.n + j，两个分量同步迁移。
     *
     * @param other 另一个 DFA，字母表必须相同。
     * @param mode  决定乘积状态是否接受。
     * @return 新的 DFA，状态数为 this.n * other.n。
     */
    public DFA product(DFA other, ProductMode mode) {
        Objects.requireNonNull(other, "Other DFA cannot be null.");
        Objects.requireNonNull(mode, "Product mode cannot be null.");
        if (!getAlphabet().equals(other.getAlphabet())) {
            throw reject(ConstructionErrorKind.ALPHABET_MISMATCH,
                    "Alphabet mismatch: " + getAlphabet() + " vs " + other.getAlphabet());
        }

        int width = other.getStateCount();
        int productCount = Math.multiplyExact(getStateCount(), width);
        DeterministicTransitionTable left = this.getTransitionTable();
        DeterministicTransitionTable right = other.getTransitionTable();

        DeterministicTransitionTable table = DeterministicTransitionTable.fromFunction(productCount, getAlphabet(),
                (state, symbol) -> left.next(state / width, symbol) * width + right.next(state % width, symbol));

        SortedSet<Integer> accept = new TreeSet<>();
        for (int i = 0; i < getStateCount(); i++) {
            for (int j = 0; j < width; j++) {
                if (mode.accepts(getAcceptStates().contains(i), other.getAcceptStates().contains(j))) {
                    accept.add(i * width + j);
                }
            }
        }

        int start = getStartState() * width + other.getStartState();
        logger.info("乘积构造 {}：{} × {} -> {} 个状态，{} 个接受状态",
                mode, getStateCount(), width, productCount, accept.size());
        return new DFA(table, start, accept);
    }

    @Override
    protected List<String> describeTransitions() {
        return getTransitionTable().getTransitions().stream()
                .map(Transition::toString)
                .toList();
    }
}
