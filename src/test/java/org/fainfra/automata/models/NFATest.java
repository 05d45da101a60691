package org.fainfra.automata.models;

import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NFATest {

    private final State q0 = State.of("q0");
    private final State q1 = State.of("q1");
    private final State q2 = State.of("q2");
    private final Symbol a = Symbol.of('a');
    private final Symbol b = Symbol.of('b');

    @Test
    @DisplayName("迁移是累加的，目标集合被合并")
    void testAddTransition_ShouldUnionDestinations() {
        NFA nfa = NFA.builder()
                .addTransition(q0, a, q1)
                .addTransition(q0, a, q2)
                .addTransition(q0, a, q1)
                .setStartState(q0)
                .addAcceptState(q2)
                .build();

        assertEquals(Set.of(q1, q2), nfa.next(q0, a));
        assertEquals(Set.of(q0, q1, q2), nfa.getStates(), "迁移中的状态应被自动登记");
    }

    @Test
    @DisplayName("字母表由非 epsilon 迁移导出")
    void testAlphabet_ShouldBeDerived() {
        NFA nfa = NFA.builder()
                .addEpsilonTransition(q0, q1)
                .addTransition(q1, b, q2)
                .addTransition(q1, a, q2)
                .setStartState(q0)
                .addAcceptState(q2)
                .build();

        assertEquals(Alphabet.of("a", "b"), nfa.getAlphabet());
        assertTrue(nfa.hasEpsilonTransitions());
    }

    @Test
    @DisplayName("没有迁移时返回空集")
    void testMissingTransition_ShouldBeEmpty() {
        NFA nfa = NFA.builder().setStartState(q0).build();

        assertTrue(nfa.next(q0, a).isEmpty());
        assertEquals(Set.of(q0), nfa.getStates(), "初始状态应被登记");
    }

    @Test
    @DisplayName("未设置初始状态时构造失败")
    void testBuildWithoutStart_ShouldThrow() {
        NFA.Builder builder = NFA.builder().addTransition(q0, a, q1);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    @DisplayName("结构摘要报告 epsilon 迁移")
    void testSummary() {
        NFA nfa = NFA.builder()
                .addEpsilonTransition(q0, q1)
                .addTransition(q1, a, q2)
                .setStartState(q0)
                .addAcceptState(q2)
                .build();

        StructureSummary summary = nfa.summarize();

        assertAll("summary",
                () -> assertEquals(AutomatonKind.NFA, summary.getKind()),
                () -> assertEquals(3, summary.getNumStates()),
                () -> assertEquals(1, summary.getNumAcceptStates()),
                () -> assertTrue(summary.hasEpsilon()),
                () -> assertFalse(summary.isComplete()),
                () -> assertEquals(List.of("q1"), summary.getTransitions().get("q0").get("")),
                () -> assertEquals(2, nfa.getTransitionList().size())
        );
    }
}
