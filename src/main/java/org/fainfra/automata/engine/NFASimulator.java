package org.fainfra.automata.engine;

import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * NFA 的模拟：在线子集构造，每一步维护当前可能所在的状态集合并取 epsilon 闭包。
 * 没有迁移的 (状态, 符号) 只是贡献空集，拒绝不是错误。
 */
public final class NFASimulator {

    private static final Logger logger = LoggerFactory.getLogger(NFASimulator.class);

    private NFASimulator() {
    }

    /**
     * 计算状态集合的 epsilon 闭包：包含给定集合、且对 epsilon 迁移封闭的最小集合。
     *
     * @param nfa    所属 NFA。
     * @param states 起始状态集合。
     * @return 新的闭包集合，不修改参数。
     */
    public static SortedSet<State> epsilonClosure(NFA nfa, Collection<State> states) {
        SortedSet<State> closure = new TreeSet<>(states);
        Deque<State> stack = new ArrayDeque<>(states);
        while (!stack.isEmpty()) {
            State state = stack.pop();
            for (State next : nfa.next(state, Symbol.EPSILON)) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }
        return closure;
    }

    /**
     * 计算 closure(∪ δ(s, symbol))，s 取遍 current。
     *
     * @param nfa     所属 NFA。
     * @param current 当前状态集合（应已对 epsilon 封闭）。
     * @param symbol  非 epsilon 输入符号。
     * @return 后继状态集合的 epsilon 闭包。
     */
    public static SortedSet<State> step(NFA nfa, Set<State> current, Symbol symbol) {
        if (symbol.isEpsilon()) {
            return Collections.emptySortedSet();
        }
        Set<State> moved = new TreeSet<>();
        for (State state : current) {
            moved.addAll(nfa.next(state, symbol));
        }
        return epsilonClosure(nfa, moved);
    }

    /**
     * @param nfa   要运行的 NFA。
     * @param input 输入符号序列。
     * @return 消耗全部输入后当前集合与接受状态有交集时返回 true。
     */
    public static boolean simulate(NFA nfa, List<Symbol> input) {
        Objects.requireNonNull(nfa, "NFA cannot be null.");
        Objects.requireNonNull(input, "Input cannot be null.");

        Set<State> current = epsilonClosure(nfa, Set.of(nfa.getStartState()));
        for (Symbol symbol : input) {
            current = step(nfa, current, symbol);
            logger.debug("读入 {} 后的状态集合: {}", symbol, current);
            if (current.isEmpty()) {
                return false;
            }
        }
        return !Collections.disjoint(current, nfa.getAcceptStates());
    }

    /**
     * 以字符串为输入，每个字符对应一个符号。
     */
    public static boolean simulate(NFA nfa, String input) {
        return simulate(nfa, DFASimulator.toSymbols(input));
    }
}
