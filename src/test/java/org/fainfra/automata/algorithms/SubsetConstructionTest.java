package org.fainfra.automata.algorithms;

import org.fainfra.automata.Words;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.DFA;
import org.fainfra.automata.models.NFA;
import org.fainfra.regex.RegexCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubsetConstructionTest {

    @Test
    @DisplayName("确定化结果与 NFA 接受相同的串")
    void testDeterminize_ShouldPreserveLanguage() {
        for (String pattern : new String[]{"a(b|a)*", "(a|b)*abb", "a*b*", "(ab|c)*"}) {
            NFA nfa = RegexCompiler.compile(pattern);
            DFA dfa = SubsetConstruction.determinize(nfa);
            for (String word : Words.upTo("abc", 5)) {
                assertEquals(nfa.accepts(word), dfa.accepts(word), pattern + " on '" + word + "'");
            }
        }
    }

    @Test
    @DisplayName("初始状态为 D0，字母表取自 NFA")
    void testNamingAndAlphabet() {
        NFA nfa = NFA.builder()
                .addTransition(State.of("x"), Symbol.of('a'), State.of("y"))
                .addTransition(State.of("x"), Symbol.of('a'), State.of("x"))
                .setStartState(State.of("x"))
                .addAcceptState(State.of("y"))
                .build();

        DFA dfa = SubsetConstruction.determinize(nfa);

        assertAll("determinized",
                () -> assertEquals(State.of("D0"), dfa.getStartState()),
                () -> assertEquals(nfa.getAlphabet(), dfa.getAlphabet()),
                () -> assertEquals(2, dfa.getStates().size()),
                () -> assertTrue(dfa.accepts("aaa")),
                () -> assertFalse(dfa.accepts(""))
        );
    }

    @Test
    @DisplayName("(a|b)*abb 的最小 DFA 有 4 个状态")
    void testClassicMinimalDFA() {
        DFA minimal = RegexCompiler.compileToMinimalDFA("(a|b)*abb");

        assertEquals(4, minimal.getStates().size());
        assertTrue(minimal.accepts("babb"));
        assertFalse(minimal.accepts("abba"));
    }
}
