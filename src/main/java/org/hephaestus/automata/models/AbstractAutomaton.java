package org.hephaestus.automata.models;

import lombok.Getter;
import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.exceptions.AutomatonConstructionException;
import org.hephaestus.automata.exceptions.ConstructionErrorKind;
import org.hephaestus.automata.table.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * DFA 与 NFA 共有的部分：状态数、字母表、起始状态、接受状态集与迁移表。
 * 子类构造前必须先通过 {@link #checkStateCount}、{@link #checkStart}、{@link #checkAcceptStates} 校验。
 *
 * @param <T> 迁移表类型。
 */
@Getter
public abstract class AbstractAutomaton<T extends TransitionTable> implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(AbstractAutomaton.class);

    private final int stateCount;
    private final Alphabet alphabet;
    private final int startState;
    private final SortedSet<Integer> acceptStates;
    private final T transitionTable;

    protected AbstractAutomaton(T transitionTable, int startState, SortedSet<Integer> acceptStates) {
        this.transitionTable = Objects.requireNonNull(transitionTable, "Transition table cannot be null.");
        this.stateCount = transitionTable.getStateCount();
        this.alphabet = transitionTable.getAlphabet();
        this.startState = startState;
        this.acceptStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptStates));
    }

    protected static void checkStateCount(int stateCount) {
        if (stateCount < 0) {
            throw reject(ConstructionErrorKind.INVALID_STATE_COUNT,
                    "State count must be non-negative, got " + stateCount);
        }
    }

    protected static void checkStart(int stateCount, int start) {
        if (start < 0 || start >= stateCount) {
            throw reject(ConstructionErrorKind.INVALID_START,
                    "Start state " + start + " does not exist in [0, " + stateCount + ")");
        }
    }

    /**
     * 校验并规范化接受状态集合，重复元素被忽略。
     * @return 升序的接受状态集合。
     */
    protected static SortedSet<Integer> checkAcceptStates(int stateCount, Collection<Integer> accept) {
        Objects.requireNonNull(accept, "Accept states cannot be null.");
        SortedSet<Integer> result = new TreeSet<>();
        for (Integer state : accept) {
            Objects.requireNonNull(state, "Accept state cannot be null.");
            if (state < 0 || state >= stateCount) {
                throw reject(ConstructionErrorKind.INVALID_ACCEPT_STATE,
                        "Accept state " + state + " does not exist in [0, " + stateCount + ")");
            }
            result.add(state);
        }
        return result;
    }

    protected static AutomatonConstructionException reject(ConstructionErrorKind kind, String message) {
        logger.warn("拒绝构造（{}，{}）：{}", kind, kind.getDescription(), message);
        return new AutomatonConstructionException(kind, message);
    }

    /**
     * 检查输入序列中的每个符号都属于字母表。
     */
    protected void checkInput(List<Symbol> input) {
        Objects.requireNonNull(input, "Input cannot be null.");
        for (Symbol symbol : input) {
            if (!alphabet.contains(symbol)) {
                logger.debug("输入中出现字母表 {} 之外的符号 {}", alphabet, symbol);
                throw new IllegalArgumentException("Symbol '" + symbol + "' is not in the alphabet " + alphabet);
            }
        }
    }

    @Override
    public boolean run(String input) {
        Objects.requireNonNull(input, "Input cannot be null.");
        List<Symbol> symbols = new ArrayList<>(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            Symbol symbol = alphabet.getSymbolByLabel(String.valueOf(c));
            if (symbol == null) {
                logger.debug("输入串 \"{}\" 的第 {} 个字符 '{}' 不在字母表 {} 中", input, i, c, alphabet);
                throw new IllegalArgumentException("Symbol '" + c + "' is not in the alphabet " + alphabet);
            }
            symbols.add(symbol);
        }
        return run(symbols);
    }

    /**
     * 输出迁移部分时每条迁移的格式，由子类决定。
     */
    protected abstract List<String> describeTransitions();

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Alphabet: ").append(alphabet).append('\n');
        sb.append("Start State: ").append(startState).append('\n');
        sb.append("Accept States: ")
                .append(acceptStates.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}")))
                .append('\n');
        sb.append("Transitions:\n");
        for (String line : describeTransitions()) {
            sb.append("  ").append(line).append('\n');
        }
        return sb.toString();
    }
}
