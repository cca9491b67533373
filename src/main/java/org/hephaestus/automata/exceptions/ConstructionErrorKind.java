package org.hephaestus.automata.exceptions;

/**
 * 自动机构造或二元运算失败的错误类别。
 */
public enum ConstructionErrorKind {

    INVALID_STATE_COUNT("状态数为负"),
    INVALID_START("起始状态越界"),
    INVALID_ACCEPT_STATE("接受状态越界"),
    INVALID_TRANSITION_STATE("迁移引用了不存在的状态"),
    UNKNOWN_SYMBOL("迁移引用了字母表之外的符号"),
    INCOMPLETE_TRANSITION("DFA 迁移函数不完全"),     // 仅 DFA
    CONFLICTING_TRANSITION("DFA 迁移存在冲突"),       // 仅 DFA
    ALPHABET_MISMATCH("两个自动机的字母表不同");      // 仅 union / intersection 等

    private final String description;

    ConstructionErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
