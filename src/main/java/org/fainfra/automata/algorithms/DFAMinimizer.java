package org.fainfra.automata.algorithms;

import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.DFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 基于划分精化（Hopcroft 风格）的 DFA 最小化。
 * <p>
 * 步骤：
 * 1. 删除从初始状态不可达的状态；
 * 2. 若 δ 不完全，加入一个陷阱状态补全（部分迁移函数下的划分精化才正确）；
 * 3. 以 [接受状态, 非接受状态] 为初始划分（丢弃空块），用等待队列反复分裂；
 * 4. 每个最终块成为一个新状态 S0, S1, ...；死块（无法到达接受状态的状态，包括陷阱状态）
 *    被丢弃，指向它的迁移也被省略，除非初始状态本身在死块中。
 * <p>
 * 复杂度是多项式的，但没有达到 Hopcroft 算法 O(n log n) 的界。
 */
public final class DFAMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(DFAMinimizer.class);

    public static final String STATE_PREFIX = "S";

    private DFAMinimizer() {
    }

    /**
     * @param dfa 输入 DFA，不会被修改。
     * @return 接受相同语言、状态数最少的新 DFA。
     */
    public static DFA minimize(DFA dfa) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");

        DFA reachable = restrictToReachable(dfa);
        DFA working = reachable.complete();

        List<SortedSet<State>> partition = refine(working);
        logger.debug("最终划分: {}", partition);

        // 块 -> 新状态，死块（含补全用的陷阱状态）没有对应的新状态
        Map<State, State> blockOf = new HashMap<>();
        List<State> newStates = new ArrayList<>();
        for (SortedSet<State> block : partition) {
            if (isDead(working, block) && !block.contains(dfa.getStartState())) {
                logger.debug("丢弃死块: {}", block);
                continue;
            }
            State merged = State.indexed(STATE_PREFIX, newStates.size());
            newStates.add(merged);
            for (State state : block) {
                blockOf.put(state, merged);
            }
        }

        Map<State, Map<Symbol, State>> table = new TreeMap<>();
        for (State state : working.getStates()) {
            State source = blockOf.get(state);
            if (source == null) {
                continue;
            }
            Map<Symbol, State> row = table.computeIfAbsent(source, s -> new TreeMap<>());
            for (Symbol symbol : working.getAlphabet()) {
                State dest = working.next(state, symbol);
                State mapped = dest == null ? null : blockOf.get(dest);
                if (mapped != null) {
                    row.put(symbol, mapped);
                }
            }
        }

        Set<State> newAccept = new TreeSet<>();
        for (State accept : working.getAcceptStates()) {
            newAccept.add(blockOf.get(accept));
        }

        DFA minimized = new DFA(newStates, dfa.getAlphabet(), blockOf.get(dfa.getStartState()), newAccept, table);
        logger.info("DFA 最小化完成：{} 个状态 -> {} 个状态", dfa.getStates().size(), newStates.size());
        return minimized;
    }

    /**
     * 完全 DFA 的最终划分中，死块是唯一一个非接受、且所有迁移都留在块内的块。
     */
    private static boolean isDead(DFA complete, SortedSet<State> block) {
        State representative = block.first();
        if (complete.isAccepting(representative)) {
            return false;
        }
        for (Symbol symbol : complete.getAlphabet()) {
            if (!block.contains(complete.next(representative, symbol))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 只保留从初始状态可达的状态及其迁移。
     */
    static DFA restrictToReachable(DFA dfa) {
        SortedSet<State> reachable = dfa.reachableStates();
        if (reachable.size() == dfa.getStates().size()) {
            return dfa;
        }
        logger.debug("删除不可达状态: {}", difference(dfa.getStates(), reachable));
        Map<State, SortedMap<Symbol, State>> table = new TreeMap<>();
        for (State state : reachable) {
            SortedMap<Symbol, State> row = dfa.getTransitions().get(state);
            if (row != null) {
                table.put(state, row);
            }
        }
        Set<State> accept = new TreeSet<>(dfa.getAcceptStates());
        accept.retainAll(reachable);
        return new DFA(reachable, dfa.getAlphabet(), dfa.getStartState(), accept, table);
    }

    /**
     * 对完全 DFA 做划分精化，返回按确定顺序排列的块列表。
     */
    static List<SortedSet<State>> refine(DFA dfa) {
        Alphabet alphabet = dfa.getAlphabet();

        List<SortedSet<State>> partition = new ArrayList<>();
        SortedSet<State> accepting = new TreeSet<>(dfa.getAcceptStates());
        SortedSet<State> rejecting = difference(dfa.getStates(), accepting);
        if (!accepting.isEmpty()) {
            partition.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            partition.add(rejecting);
        }

        Map<Symbol, Map<State, Set<State>>> predecessors = predecessors(dfa);
        Deque<SortedSet<State>> waiting = new ArrayDeque<>(partition);

        while (!waiting.isEmpty()) {
            SortedSet<State> splitter = waiting.poll();
            for (Symbol symbol : alphabet) {
                // X = 经 symbol 迁移落入 splitter 的全部状态
                Set<State> x = new TreeSet<>();
                Map<State, Set<State>> inverse = predecessors.getOrDefault(symbol, Collections.emptyMap());
                for (State target : splitter) {
                    x.addAll(inverse.getOrDefault(target, Collections.emptySet()));
                }
                if (x.isEmpty()) {
                    continue;
                }

                for (SortedSet<State> y : new ArrayList<>(partition)) {
                    SortedSet<State> inter = new TreeSet<>(y);
                    inter.retainAll(x);
                    SortedSet<State> diff = difference(y, x);
                    if (inter.isEmpty() || diff.isEmpty()) {
                        continue;
                    }
                    partition.remove(y);
                    partition.add(inter);
                    partition.add(diff);
                    logger.debug("按 ({}, {}) 分裂 {} -> {} | {}", splitter, symbol, y, inter, diff);

                    if (waiting.remove(y)) {
                        waiting.add(inter);
                        waiting.add(diff);
                    } else {
                        waiting.add(inter.size() <= diff.size() ? inter : diff);
                    }
                }
            }
        }
        return partition;
    }

    private static Map<Symbol, Map<State, Set<State>>> predecessors(DFA dfa) {
        Map<Symbol, Map<State, Set<State>>> inverse = new HashMap<>();
        dfa.getTransitions().forEach((source, row) ->
                row.forEach((symbol, target) -> inverse
                        .computeIfAbsent(symbol, s -> new HashMap<>())
                        .computeIfAbsent(target, t -> new TreeSet<>())
                        .add(source)));
        return inverse;
    }

    private static SortedSet<State> difference(Set<State> from, Set<State> remove) {
        SortedSet<State> result = new TreeSet<>(from);
        result.removeAll(remove);
        return result;
    }
}
