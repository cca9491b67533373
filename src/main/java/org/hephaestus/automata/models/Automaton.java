package org.hephaestus.automata.models;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.table.TransitionTable;

import java.util.List;
import java.util.SortedSet;

/**
 * 有限自动机的公共契约。
 * 所有实现都是不可变的，run 可被多个线程同时调用。
 */
public interface Automaton {

    int getStateCount();

    Alphabet getAlphabet();

    int getStartState();

    SortedSet<Integer> getAcceptStates();

    TransitionTable getTransitionTable();

    /**
     * 判断自动机是否接受给定的符号序列。
     *
     * @param input 有限符号序列，可以为空。
     * @return 接受则返回 true。
     * @throws IllegalArgumentException 如果序列中有字母表之外的符号。
     */
    boolean run(List<Symbol> input);

    /**
     * 把字符串的每个字符当作一个单字符符号运行。
     *
     * @param input 输入串，可以为空串。
     * @return 接受则返回 true。
     * @throws IllegalArgumentException 如果某个字符不对应字母表中的符号。
     */
    boolean run(String input);
}
