package org.hephaestus.automata.models;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.StateSet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.determinization.SubsetConstruction;
import org.hephaestus.automata.table.NondeterministicTransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 非确定性有限自动机 (Nondeterministic Finite Automaton, NFA)。
 * 一个 (状态, 符号) 可以迁移到零个、一个或多个状态，也可以有不消耗输入的 epsilon 迁移。
 * 此类是不可变的。
 */
public final class NFA extends AbstractAutomaton<NondeterministicTransitionTable> {

    private static final Logger logger = LoggerFactory.getLogger(NFA.class);

    private NFA(NondeterministicTransitionTable table, int start, SortedSet<Integer> accept) {
        super(table, start, accept);
        logger.debug("创建 NFA：{} 个状态，起始 {}，接受 {}", table.getStateCount(), start, accept);
    }

    /**
     * 构造并校验一个 NFA，不要求迁移关系完全或确定。
     *
     * @param stateCount  状态数 n。
     * @param alphabet    字母表。
     * @param transitions 字面迁移三元组，符号可以是 {@link Symbol#EPSILON}。
     * @param start       起始状态。
     * @param accept      接受状态，重复与顺序无关。
     * @return 新的 NFA。
     * @throws org.hephaestus.automata.exceptions.AutomatonConstructionException 第一个不满足的不变量。
     */
    public static NFA of(int stateCount, Alphabet alphabet, List<Transition> transitions,
                         int start, Collection<Integer> accept) {
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        checkStateCount(stateCount);
        checkStart(stateCount, start);
        SortedSet<Integer> acceptStates = checkAcceptStates(stateCount, accept);
        NondeterministicTransitionTable table = NondeterministicTransitionTable.build(stateCount, alphabet, transitions);
        return new NFA(table, start, acceptStates);
    }

    /**
     * 并行模拟：维护当前活跃状态集合，每读一个符号做一次惰性的子集构造步骤。
     * 活跃集合变空后不可能再接受，直接返回 false。
     */
    @Override
    public boolean run(List<Symbol> input) {
        checkInput(input);
        NondeterministicTransitionTable table = getTransitionTable();
        StateSet active = SubsetConstruction.closure(table, StateSet.of(getStartState()));
        for (Symbol symbol : input) {
            active = SubsetConstruction.step(table, active, symbol);
            if (active.isEmpty()) {
                return false;
            }
        }
        return active.intersects(getAcceptStates());
    }

    /**
     * 子集构造得到等价的 DFA，总能成功。
     */
    public DFA determinize() {
        return SubsetConstruction.determinize(this);
    }

    @Override
    protected List<String> describeTransitions() {
        return getTransitionTable().asMap().entrySet().stream()
                .map(entry -> String.format("(%d, '%s') -> %s",
                        entry.getKey().getLeft(), entry.getKey().getRight(), entry.getValue()))
                .toList();
    }
}
