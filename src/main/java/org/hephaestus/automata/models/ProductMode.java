package org.hephaestus.automata.models;

/**
 * 乘积构造中决定乘积状态 (i, j) 是否接受的方式。
 */
public enum ProductMode {

    UNION,
    INTERSECTION,
    DIFFERENCE,
    SYMMETRIC_DIFFERENCE;

    /**
     * @param left  左操作数中的分量状态是否接受。
     * @param right 右操作数中的分量状态是否接受。
     * @return 乘积状态是否接受。
     */
    public boolean accepts(boolean left, boolean right) {
        return switch (this) {
            case UNION -> left || right;
            case INTERSECTION -> left && right;
            case DIFFERENCE -> left && !right;
            case SYMMETRIC_DIFFERENCE -> left ^ right;
        };
    }
}
