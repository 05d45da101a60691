package org.fainfra.automata.algorithms;

import org.apache.commons.lang3.tuple.Pair;
import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.DFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 通过乘积自动机上的同步广度优先搜索判断两个 DFA 是否接受相同的语言。
 * 两个 DFA 先在双方字母表的并集上补全，因此部分 DFA 与字母表不同的 DFA 也能得到正确结果。
 */
public final class DFAEquivalenceChecker {

    private static final Logger logger = LoggerFactory.getLogger(DFAEquivalenceChecker.class);

    private DFAEquivalenceChecker() {
    }

    /**
     * @param first  第一个 DFA。
     * @param second 第二个 DFA。
     * @return 两者语言相同时返回 true。
     */
    public static boolean isEquivalent(DFA first, DFA second) {
        Objects.requireNonNull(first, "First DFA cannot be null.");
        Objects.requireNonNull(second, "Second DFA cannot be null.");

        Alphabet shared = first.getAlphabet().union(second.getAlphabet());
        DFA left = first.complete(shared);
        DFA right = second.complete(shared);

        Set<Pair<State, State>> visited = new HashSet<>();
        Deque<Pair<State, State>> queue = new ArrayDeque<>();
        queue.add(Pair.of(left.getStartState(), right.getStartState()));

        while (!queue.isEmpty()) {
            Pair<State, State> pair = queue.poll();
            if (left.isAccepting(pair.getLeft()) != right.isAccepting(pair.getRight())) {
                logger.info("DFA 不等价：乘积状态 {} 的接受性不一致", pair);
                return false;
            }
            if (!visited.add(pair)) {
                continue;
            }
            for (Symbol symbol : shared) {
                State t1 = left.next(pair.getLeft(), symbol);
                State t2 = right.next(pair.getRight(), symbol);
                queue.add(Pair.of(t1, t2));
            }
        }
        logger.info("DFA 等价，共探索 {} 个乘积状态", visited.size());
        return true;
    }
}
