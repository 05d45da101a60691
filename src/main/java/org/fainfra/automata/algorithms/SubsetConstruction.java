package org.fainfra.automata.algorithms;

import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.engine.NFASimulator;
import org.fainfra.automata.models.DFA;
import org.fainfra.automata.models.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 子集构造：把 NFA 转换为等价的 DFA，字母表取 NFA 导出的字母表。
 * 只生成从初始闭包可达的非空子集，空子集对应的迁移不生成（结果可能是部分 DFA）。
 */
public final class SubsetConstruction {

    private static final Logger logger = LoggerFactory.getLogger(SubsetConstruction.class);

    public static final String STATE_PREFIX = "D";

    private SubsetConstruction() {
    }

    public static DFA determinize(NFA nfa) {
        Objects.requireNonNull(nfa, "NFA cannot be null.");

        Map<SortedSet<State>, State> named = new LinkedHashMap<>();
        Deque<SortedSet<State>> worklist = new ArrayDeque<>();
        Map<State, Map<Symbol, State>> table = new TreeMap<>();
        Set<State> accept = new TreeSet<>();

        SortedSet<State> initial = NFASimulator.epsilonClosure(nfa, Set.of(nfa.getStartState()));
        named.put(initial, State.indexed(STATE_PREFIX, 0));
        worklist.add(initial);

        while (!worklist.isEmpty()) {
            SortedSet<State> subset = worklist.poll();
            State source = named.get(subset);
            if (!Collections.disjoint(subset, nfa.getAcceptStates())) {
                accept.add(source);
            }
            for (Symbol symbol : nfa.getAlphabet()) {
                SortedSet<State> next = NFASimulator.step(nfa, subset, symbol);
                if (next.isEmpty()) {
                    continue;
                }
                State target = named.get(next);
                if (target == null) {
                    target = State.indexed(STATE_PREFIX, named.size());
                    named.put(next, target);
                    worklist.add(next);
                }
                table.computeIfAbsent(source, s -> new TreeMap<>()).put(symbol, target);
            }
        }

        logger.debug("子集构造映射: {}", named);
        logger.info("子集构造完成：NFA {} 个状态 -> DFA {} 个状态", nfa.getStates().size(), named.size());
        return new DFA(named.values(), nfa.getAlphabet(), named.get(initial), accept, table);
    }
}
