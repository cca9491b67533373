package org.hephaestus.automata.models;

import org.hephaestus.automata.base.Alphabet;
import org.hephaestus.automata.base.Symbol;
import org.hephaestus.automata.base.Transition;
import org.hephaestus.automata.exceptions.AutomatonConstructionException;
import org.hephaestus.automata.exceptions.ConstructionErrorKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NFATest {

    private static Alphabet ab;
    private static Alphabet binary;

    // a b* a b* a
    private static NFA threeAs;
    // 恰好是 "00"
    private static NFA doubleZero;

    @BeforeAll
    static void setUp() {
        ab = Alphabet.of('a', 'b');
        binary = Alphabet.of('0', '1');

        threeAs = NFA.of(4, ab, List.of(
                Transition.of(0, 'a', 1), Transition.of(1, 'a', 2), Transition.of(1, 'b', 1),
                Transition.of(2, 'a', 3), Transition.of(2, 'b', 2)), 0, Set.of(3));

        doubleZero = NFA.of(3, binary, List.of(
                Transition.of(0, '0', 1), Transition.of(1, '0', 2)), 0, Set.of(2));
    }

    @Nested
    @DisplayName("构造与校验")
    class ConstructionTests {

        @Test
        @DisplayName("不完全的迁移关系是合法的")
        void testPartialRelationAccepted() {
            assertDoesNotThrow(() -> NFA.of(2, ab, List.of(), 0, Set.of()));
        }

        @Test
        @DisplayName("越界状态与未知符号被拒绝")
        void testInvalidReferences() {
            AutomatonConstructionException e = assertThrows(AutomatonConstructionException.class,
                    () -> NFA.of(1, binary, List.of(Transition.of(0, '1', 0), Transition.of(0, '1', 5)), 0, Set.of(0)));
            assertAll(
                    () -> assertEquals(ConstructionErrorKind.INVALID_TRANSITION_STATE, e.getKind()),
                    () -> assertEquals("In transition: (0, '1') -> 5: State 5 does not exist", e.getMessage())
            );

            assertEquals(ConstructionErrorKind.UNKNOWN_SYMBOL, assertThrows(AutomatonConstructionException.class,
                    () -> NFA.of(1, binary, List.of(Transition.of(0, 'z', 0)), 0, Set.of())).getKind());
            assertEquals(ConstructionErrorKind.INVALID_START, assertThrows(AutomatonConstructionException.class,
                    () -> NFA.of(1, binary, List.of(), 2, Set.of())).getKind());
            assertEquals(ConstructionErrorKind.INVALID_ACCEPT_STATE, assertThrows(AutomatonConstructionException.class,
                    () -> NFA.of(1, binary, List.of(), 0, Set.of(1))).getKind());
        }
    }

    @Nested
    @DisplayName("并行模拟 (run)")
    class RunTests {

        @Test
        @DisplayName("a b* a b* a：\"aaa\" 与 \"abbbaba\" 接受，\"baba\" 拒绝")
        void testThreeAs() {
            assertAll(
                    () -> assertTrue(threeAs.run("aaa")),
                    () -> assertTrue(threeAs.run("abbbaba")),
                    () -> assertFalse(threeAs.run("baba")),
                    () -> assertFalse(threeAs.run("aaaa")),
                    () -> assertFalse(threeAs.run(""))
            );
        }

        @Test
        @DisplayName("只接受 \"00\"")
        void testDoubleZero() {
            assertTrue(doubleZero.run("00"));
            for (String s : List.of("", "01", "10", "11", "0", "1", "001")) {
                assertFalse(doubleZero.run(s), s);
            }
        }

        @Test
        @DisplayName("同一符号的多个目标被并行跟踪")
        void testNondeterministicChoice() {
            // 以 "ab" 结尾
            NFA endsWithAb = NFA.of(3, ab, List.of(
                    Transition.of(0, 'a', 0), Transition.of(0, 'b', 0),
                    Transition.of(0, 'a', 1), Transition.of(1, 'b', 2)), 0, Set.of(2));

            assertAll(
                    () -> assertTrue(endsWithAb.run("ab")),
                    () -> assertTrue(endsWithAb.run("bbaab")),
                    () -> assertFalse(endsWithAb.run("aba")),
                    () -> assertFalse(endsWithAb.run("b"))
            );
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "0a"})
        @DisplayName("字母表之外的输入符号是调用方错误")
        void testInvalidInput(String input) {
            assertThrows(IllegalArgumentException.class, () -> doubleZero.run(input));
            assertThrows(IllegalArgumentException.class, () -> doubleZero.run(List.of(Symbol.EPSILON)));
        }
    }

    @Nested
    @DisplayName("epsilon 迁移")
    class EpsilonTests {

        @Test
        @DisplayName("epsilon 环：空串接受，\"0\" 拒绝")
        void testEpsilonCycle() {
            NFA nfa = NFA.of(2, Alphabet.of('0'), List.of(
                    Transition.of(0, '_', 1), Transition.of(1, '_', 0)), 0, Set.of(1));

            assertTrue(nfa.run(""));
            assertFalse(nfa.run("0"));
        }

        @Test
        @DisplayName("读入符号后同样取 epsilon 闭包 (a+)")
        void testClosureAfterStep() {
            NFA aPlus = NFA.of(3, ab, List.of(
                    Transition.of(0, '_', 1), Transition.of(1, 'a', 2), Transition.of(2, '_', 0)), 0, Set.of(2));

            assertAll(
                    () -> assertFalse(aPlus.run("")),
                    () -> assertTrue(aPlus.run("a")),
                    () -> assertTrue(aPlus.run("aaaa")),
                    () -> assertFalse(aPlus.run("ab")),
                    () -> assertFalse(aPlus.run("b"))
            );
        }
    }

    @Test
    @DisplayName("toString 按键顺序列出目标集合")
    void testToString() {
        NFA nfa = NFA.of(2, ab, List.of(
                Transition.of(1, 'a', 0), Transition.of(0, 'a', 1), Transition.of(0, 'a', 0)), 0, List.of(1, 1));
        String expected = "Alphabet: [a, b]\n"
                + "Start State: 0\n"
                + "Accept States: {1}\n"
                + "Transitions:\n"
                + "  (0, 'a') -> {0, 1}\n"
                + "  (1, 'a') -> {0}\n";
        assertEquals(expected, nfa.toString());
    }
}
