package org.hephaestus.automata;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试辅助：穷举字母表上长度不超过给定值的所有串。
 */
public final class Words {

    private Words() {
    }

    public static List<List<Symbol>> upTo(Alphabet alphabet, int maxLength) {
        List<List<Symbol>> all = new ArrayList<>();
        List<List<Symbol>> layer = new ArrayList<>();
        layer.add(List.of());
        all.addAll(layer);
        for (int length = 1; length <= maxLength; length++) {
            List<List<Symbol>> next = new ArrayList<>();
            for (List<Symbol> prefix : layer) {
                for (Symbol symbol : alphabet.getSymbols()) {
                    List<Symbol> word = new ArrayList<>(prefix);
                    word.add(symbol);
                    next.add(List.copyOf(word));
                }
            }
            all.addAll(next);
            layer = next;
        }
        return all;
    }
}
