package org.fainfra.automata.models;

import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.base.Transition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DFATest {

    /**
     * 辅助方法：以 a 结尾的串，q0 -a-> q1，q1 -b-> q0。
     */
    private static DFA endsWithA() {
        return DFA.of(
                List.of("q0", "q1"),
                List.of("a", "b"),
                "q0",
                List.of("q1"),
                Map.of("q0", Map.of("a", "q1", "b", "q0"),
                        "q1", Map.of("a", "q1", "b", "q0")));
    }

    @Nested
    @DisplayName("构造")
    class ConstructionTests {

        @Test
        @DisplayName("从原始标签构造，组件被规范化为集合")
        void testOf_ShouldNormalizeComponents() {
            DFA dfa = endsWithA();

            assertAll("components",
                    () -> assertEquals(Set.of(State.of("q0"), State.of("q1")), dfa.getStates()),
                    () -> assertEquals(Alphabet.of("a", "b"), dfa.getAlphabet()),
                    () -> assertEquals(State.of("q0"), dfa.getStartState()),
                    () -> assertEquals(Set.of(State.of("q1")), dfa.getAcceptStates()),
                    () -> assertEquals(State.of("q1"), dfa.next(State.of("q0"), Symbol.of('a'))),
                    () -> assertEquals(AutomatonKind.DFA, dfa.getKind())
            );
        }

        @Test
        @DisplayName("初始状态不在状态集合中应抛出异常")
        void testUnknownStart_ShouldThrow() {
            assertThrows(IllegalArgumentException.class,
                    () -> DFA.of(List.of("q0"), List.of("a"), "q9", List.of(), Map.of()));
        }

        @Test
        @DisplayName("接受状态不在状态集合中应抛出异常")
        void testUnknownAccept_ShouldThrow() {
            assertThrows(IllegalArgumentException.class,
                    () -> DFA.of(List.of("q0"), List.of("a"), "q0", List.of("q1"), Map.of()));
        }

        @Test
        @DisplayName("指向未知状态或使用字母表外符号的迁移被丢弃")
        void testDanglingTransitions_ShouldBeDropped() {
            DFA dfa = DFA.of(
                    List.of("q0", "q1"),
                    List.of("a"),
                    "q0",
                    List.of("q1"),
                    Map.of("q0", Map.of("a", "q7", "b", "q1"),
                            "q5", Map.of("a", "q1")));

            assertAll("dropped",
                    () -> assertNull(dfa.next(State.of("q0"), Symbol.of('a'))),
                    () -> assertNull(dfa.next(State.of("q0"), Symbol.of('b'))),
                    () -> assertTrue(dfa.getTransitions().isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("完全性与补全")
    class CompletenessTests {

        @Test
        @DisplayName("全函数 DFA 是完全的，补全返回自身")
        void testCompleteDFA() {
            DFA dfa = endsWithA();

            assertTrue(dfa.isComplete());
            assertSame(dfa, dfa.complete());
        }

        @Test
        @DisplayName("部分 DFA 补全后加入非接受的陷阱状态")
        void testPartialDFA_ShouldGainSink() {
            DFA partial = DFA.of(List.of("q0", "q1"), List.of("a", "b"), "q0", List.of("q1"),
                    Map.of("q0", Map.of("a", "q1")));

            DFA completed = partial.complete();
            State sink = State.of(DFA.SINK_LABEL);

            assertAll("completed",
                    () -> assertFalse(partial.isComplete()),
                    () -> assertTrue(completed.isComplete()),
                    () -> assertEquals(3, completed.getStates().size()),
                    () -> assertTrue(completed.getStates().contains(sink)),
                    () -> assertFalse(completed.isAccepting(sink)),
                    () -> assertEquals(sink, completed.next(State.of("q1"), Symbol.of('a'))),
                    () -> assertEquals(sink, completed.next(sink, Symbol.of('b'))),
                    () -> assertEquals(2, partial.getStates().size(), "原 DFA 不应被修改")
            );
        }

        @Test
        @DisplayName("陷阱状态名已被占用时使用新名字")
        void testSinkLabelClash() {
            DFA partial = DFA.of(List.of("sink", "q1"), List.of("a"), "sink", List.of("q1"),
                    Map.of("sink", Map.of("a", "q1")));

            DFA completed = partial.complete();

            assertTrue(completed.getStates().contains(State.of("sink1")));
            assertEquals(State.of("sink1"), completed.next(State.of("q1"), Symbol.of('a')));
        }

        @Test
        @DisplayName("在更大的字母表上补全")
        void testCompleteOverLargerAlphabet() {
            DFA completed = endsWithA().complete(Alphabet.of("c"));

            assertEquals(Alphabet.of("a", "b", "c"), completed.getAlphabet());
            assertTrue(completed.isComplete());
            assertFalse(completed.accepts("ca"));
            assertTrue(completed.accepts("ba"));
        }
    }

    @Test
    @DisplayName("可达状态不包含孤立状态")
    void testReachableStates() {
        DFA dfa = DFA.of(List.of("q0", "q1", "q2"), List.of("a"), "q0", List.of("q1"),
                Map.of("q0", Map.of("a", "q1"), "q2", Map.of("a", "q0")));

        assertEquals(Set.of(State.of("q0"), State.of("q1")), dfa.reachableStates());
    }

    @Test
    @DisplayName("结构摘要给出状态数、接受状态数和完全性")
    void testSummary() {
        StructureSummary summary = endsWithA().summarize();

        assertAll("summary",
                () -> assertEquals(AutomatonKind.DFA, summary.getKind()),
                () -> assertEquals(2, summary.getNumStates()),
                () -> assertEquals(1, summary.getNumAcceptStates()),
                () -> assertTrue(summary.isComplete()),
                () -> assertFalse(summary.hasEpsilon()),
                () -> assertEquals(List.of("q0", "q1"), summary.getStates()),
                () -> assertEquals(List.of("a", "b"), summary.getAlphabet()),
                () -> assertEquals("q0", summary.getStartState()),
                () -> assertEquals(List.of("q1"), summary.getTransitions().get("q0").get("a"))
        );
        assertEquals(4, endsWithA().getTransitionList().size());
        assertEquals(new Transition(State.of("q0"), Symbol.of('a'), State.of("q1")),
                endsWithA().getTransitionList().get(0));
    }
}
