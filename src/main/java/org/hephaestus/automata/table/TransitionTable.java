package org.hephaestus.automata.table;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Transition;

import java.util.List;

/**
 * DFA 与 NFA 共用的迁移表契约。
 * 迁移表在构造时一次性建立并校验，之后只读。
 */
public interface TransitionTable {

    int getStateCount();

    Alphabet getAlphabet();

    /**
     * 按规范顺序（状态升序，其次符号顺序，其次目标升序）列出所有迁移。
     */
    List<Transition> getTransitions();
}
