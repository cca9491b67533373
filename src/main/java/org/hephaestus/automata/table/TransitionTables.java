package org.hephaestus.automata.table;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.exceptions.AutomatonConstructionException;
import org.hephaestus.automata.exceptions.ConstructionErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 两种迁移表共用的校验逻辑。
 */
final class TransitionTables {

    private static final Logger logger = LoggerFactory.getLogger(TransitionTables.class);

    private TransitionTables() {
    }

    /**
     * 校验单条迁移的源状态、目标状态与符号。
     * @param allowEpsilon 是否允许 epsilon 迁移（仅 NFA）。
     * @throws AutomatonConstructionException 第一个不满足的条件。
     */
    static void checkTransition(int stateCount, Alphabet alphabet, Transition transition, boolean allowEpsilon) {
        int source = transition.getSource();
        int target = transition.getTarget();
        Symbol symbol = transition.getSymbol();

        if (source < 0 || source >= stateCount) {
            throw reject(ConstructionErrorKind.INVALID_TRANSITION_STATE,
                    "In transition: " + transition + ": State " + source + " does not exist");
        }
        if (target < 0 || target >= stateCount) {
            throw reject(ConstructionErrorKind.INVALID_TRANSITION_STATE,
                    "In transition: " + transition + ": State " + target + " does not exist");
        }
        if (symbol.isEpsilon()) {
            if (!allowEpsilon) {
                throw reject(ConstructionErrorKind.UNKNOWN_SYMBOL,
                        "In transition: " + transition + ": epsilon transitions are not allowed in a DFA");
            }
        } else if (!alphabet.contains(symbol)) {
            throw reject(ConstructionErrorKind.UNKNOWN_SYMBOL,
                    "In transition: " + transition + ": Symbol '" + symbol + "' is not in the alphabet " + alphabet);
        }
    }

    static AutomatonConstructionException reject(ConstructionErrorKind kind, String message) {
        logger.warn("拒绝构造（{}，{}）：{}", kind, kind.getDescription(), message);
        return new AutomatonConstructionException(kind, message);
    }

    /**
     * 构造后的查询越界属于内部不变量被破坏，而不是可恢复的错误。
     * 每次查询只检查状态范围，符号由调用方（run 的输入检查）保证。
     */
    static void checkState(int stateCount, int state) {
        if (state < 0 || state >= stateCount) {
            logger.error("迁移表查询越界：状态 {} 不在 [0, {}) 内", state, stateCount);
            throw new IllegalStateException("State " + state + " is outside [0, " + stateCount + ")");
        }
    }

    /**
     * 查询未命中时才调用，用来区分"没有迁移"与"符号不在字母表中"。
     */
    static IllegalStateException unknownSymbol(Alphabet alphabet, Symbol symbol) {
        logger.error("迁移表查询越界：符号 {} 不在字母表 {} 中", symbol, alphabet);
        return new IllegalStateException("Symbol '" + symbol + "' is not in the alphabet " + alphabet);
    }
}
