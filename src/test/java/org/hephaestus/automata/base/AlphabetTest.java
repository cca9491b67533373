package org.hephaestus.automata.base;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AlphabetTest {

    @Nested
    @DisplayName("符号 (Symbol)")
    class SymbolTests {

        @Test
        @DisplayName("相同标签的符号相等")
        void testEquality_ByLabel() {
            assertEquals(Symbol.of("a"), Symbol.of('a'));
            assertEquals(Symbol.of("a").hashCode(), Symbol.of('a').hashCode());
            assertNotEquals(Symbol.of("a"), Symbol.of("b"));
        }

        @Test
        @DisplayName("'_' 与空标签都表示 epsilon")
        void testEpsilonForms() {
            assertAll(
                    () -> assertSame(Symbol.EPSILON, Symbol.of('_')),
                    () -> assertSame(Symbol.EPSILON, Symbol.of("")),
                    () -> assertTrue(Symbol.EPSILON.isEpsilon()),
                    () -> assertEquals("ε", Symbol.EPSILON.toString())
            );
        }

        @Test
        @DisplayName("epsilon 排在所有普通符号之前")
        void testOrdering() {
            assertTrue(Symbol.EPSILON.compareTo(Symbol.of('a')) < 0);
            assertTrue(Symbol.of('a').compareTo(Symbol.of('b')) < 0);
        }
    }

    @Nested
    @DisplayName("字母表构造")
    class ConstructionTests {

        @Test
        @DisplayName("字符与标签两种工厂方法得到相同的字母表")
        void testFactoriesAgree() {
            Alphabet fromChars = Alphabet.of('b', 'a');
            Alphabet fromLabels = Alphabet.of("a", "b");
            Alphabet fromSet = Alphabet.of(Set.of(Symbol.of('a'), Symbol.of('b')));

            assertAll(
                    () -> assertEquals(fromChars, fromLabels),
                    () -> assertEquals(fromLabels, fromSet),
                    () -> assertEquals(fromChars.hashCode(), fromSet.hashCode()),
                    () -> assertEquals(2, fromChars.size())
            );
        }

        @Test
        @DisplayName("符号按规范顺序排列")
        void testSortedIteration() {
            Alphabet alphabet = Alphabet.of('c', 'a', 'b');
            assertEquals(List.of(Symbol.of('a'), Symbol.of('b'), Symbol.of('c')), List.copyOf(alphabet.getSymbols()));
            assertEquals("[a, b, c]", alphabet.toString());
        }

        @Test
        @DisplayName("重复的标签应抛出异常")
        void testDuplicateLabels_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of('a', 'a'));
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of("x", "y", "x"));
        }

        @Test
        @DisplayName("字母表不能包含 epsilon")
        void testEpsilonMember_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of('a', '_'));
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of(Set.of(Symbol.EPSILON)));
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of("_", "a"));
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of(Set.of(Symbol.of("_"), Symbol.of("a"))));
        }

        @Test
        @DisplayName("按标签查找符号")
        void testLookupByLabel() {
            Alphabet alphabet = Alphabet.of("zero", "one");
            assertAll(
                    () -> assertEquals(Symbol.of("one"), alphabet.getSymbolByLabel("one")),
                    () -> assertNull(alphabet.getSymbolByLabel("two")),
                    () -> assertTrue(alphabet.contains(Symbol.of("zero"))),
                    () -> assertFalse(alphabet.contains(Symbol.EPSILON))
            );
        }

        @Test
        @DisplayName("空字母表是合法的")
        void testEmptyAlphabet() {
            Alphabet empty = Alphabet.of(new char[0]);
            assertEquals(0, empty.size());
            assertEquals("[]", empty.toString());
        }
    }
}
