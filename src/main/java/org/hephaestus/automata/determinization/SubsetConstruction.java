package org.hephaestus.automata.determinization;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.StateSet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.models.DFA;
import org.hephaestus.automata.models.NFA;
import org.hephaestus.automata.table.NondeterministicTransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 子集构造（幂集构造）。
 * NFA 的 run 通过 {@link #step} 惰性地逐个符号推进，
 * {@link #determinize} 则预先计算出全部可达子集，得到等价的 DFA。
 */
public final class SubsetConstruction {

    private static final Logger logger = LoggerFactory.getLogger(SubsetConstruction.class);

    private SubsetConstruction() {
    }

    /**
     * 计算 epsilon 闭包：从给定集合出发仅经 epsilon 迁移可达的所有状态。
     * 没有 epsilon 迁移时原样返回。
     */
    public static StateSet closure(NondeterministicTransitionTable table, StateSet states) {
        if (!table.hasEpsilonTransitions() || states.isEmpty()) {
            return states;
        }
        SortedSet<Integer> reached = states.toSortedSet();
        Deque<Integer> pending = new ArrayDeque<>(reached);
        while (!pending.isEmpty()) {
            int state = pending.pop();
            for (int next : table.next(state, Symbol.EPSILON)) {
                if (reached.add(next)) {
                    pending.push(next);
                }
            }
        }
        return reached.size() == states.size() ? states : StateSet.of(reached);
    }

    /**
     * target(S, a) = closure(∪_{s∈S} δ(s, a))，可能为空集。
     */
    public static StateSet step(NondeterministicTransitionTable table, StateSet states, Symbol symbol) {
        StateSet target = StateSet.EMPTY;
        for (int state : states) {
            target = target.union(table.next(state, symbol));
        }
        return closure(table, target);
    }

    /**
     * 广度优先地发现所有可达子集，按发现顺序编号（起始子集为 0）。
     * 空子集同样编号，作为所有符号都自环的非接受陷阱状态，以保证结果的迁移函数完全。
     * 字母表按其规范顺序遍历，因此同一个 NFA 总是得到同样编号的 DFA。
     *
     * @param nfa 要确定化的 NFA。
     * @return 等价的 DFA，只包含可达子集。
     */
    public static DFA determinize(NFA nfa) {
        Objects.requireNonNull(nfa, "NFA cannot be null.");
        NondeterministicTransitionTable table = nfa.getTransitionTable();
        Alphabet alphabet = nfa.getAlphabet();

        Map<StateSet, Integer> indices = new LinkedHashMap<>();
        Deque<StateSet> worklist = new ArrayDeque<>();
        List<Transition> transitions = new ArrayList<>();

        StateSet start = closure(table, StateSet.of(nfa.getStartState()));
        indices.put(start, 0);
        worklist.addLast(start);

        while (!worklist.isEmpty()) {
            StateSet current = worklist.pollFirst();
            int source = indices.get(current);
            for (Symbol symbol : alphabet.getSymbols()) {
                StateSet target = step(table, current, symbol);
                Integer targetIndex = indices.get(target);
                if (targetIndex == null) {
                    targetIndex = indices.size();
                    indices.put(target, targetIndex);
                    worklist.addLast(target);
                    logger.debug("发现新子集 {} -> 编号 {}", target, targetIndex);
                }
                transitions.add(Transition.of(source, symbol, targetIndex));
            }
        }

        SortedSet<Integer> accept = new TreeSet<>();
        indices.forEach((subset, index) -> {
            if (subset.intersects(nfa.getAcceptStates())) {
                accept.add(index);
            }
        });

        logger.info("NFA 确定化完成：{} 个 NFA 状态 -> {} 个 DFA 状态，{} 个接受状态",
                nfa.getStateCount(), indices.size(), accept.size());
        return DFA.of(indices.size(), alphabet, transitions, 0, accept);
    }
}
