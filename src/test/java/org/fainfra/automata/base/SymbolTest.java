package org.fainfra.automata.base;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTest {

    @Nested
    @DisplayName("符号 (Symbol)")
    class SymbolTests {

        @Test
        @DisplayName("空标签与 null 都得到 EPSILON")
        void testEmptyLabel_ShouldBeEpsilon() {
            assertAll("epsilon",
                    () -> assertSame(Symbol.EPSILON, Symbol.of("")),
                    () -> assertSame(Symbol.EPSILON, Symbol.of((String) null)),
                    () -> assertTrue(Symbol.EPSILON.isEpsilon()),
                    () -> assertEquals("ε", Symbol.EPSILON.toString())
            );
        }

        @Test
        @DisplayName("相同字符得到相等的符号")
        void testSameCharacter_ShouldBeEqual() {
            assertEquals(Symbol.of("a"), Symbol.of('a'));
            assertNotEquals(Symbol.of('a'), Symbol.of('b'));
        }

        @Test
        @DisplayName("多字符标签应被拒绝")
        void testMultiCharacterLabel_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Symbol.of("ab"));
        }
    }

    @Nested
    @DisplayName("字母表 (Alphabet)")
    class AlphabetTests {

        @Test
        @DisplayName("字母表按标签排序且去重")
        void testAlphabet_ShouldBeSortedAndDistinct() {
            Alphabet alphabet = Alphabet.of("b", "a", "b");

            assertEquals(2, alphabet.size());
            assertEquals(List.of(Symbol.of('a'), Symbol.of('b')), List.copyOf(alphabet.getSymbols()));
        }

        @Test
        @DisplayName("字母表不能包含 epsilon")
        void testAlphabetWithEpsilon_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of("a", ""));
        }

        @Test
        @DisplayName("并集包含双方的全部符号")
        void testUnion() {
            Alphabet union = Alphabet.of("0", "1").union(Alphabet.of("1", "2"));

            assertEquals(Alphabet.of("0", "1", "2"), union);
            assertTrue(union.contains(Symbol.of('2')));
        }
    }

    @Nested
    @DisplayName("状态 (State)")
    class StateTests {

        @Test
        @DisplayName("状态身份只由标签决定")
        void testStateIdentity_IsNominal() {
            assertEquals(State.of("q1"), State.indexed("q", 1));
        }

        @Test
        @DisplayName("带序号的状态按数值顺序排序")
        void testIndexedStates_ShouldSortNumerically() {
            assertTrue(State.of("q2").compareTo(State.of("q10")) < 0);
        }
    }
}
