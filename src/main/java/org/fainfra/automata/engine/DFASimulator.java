package org.fainfra.automata.engine;

import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.DFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DFA 的确定性模拟：从初始状态出发逐个消耗符号，无回溯，O(|input|)。
 * 字母表外的符号或未定义的迁移直接导致拒绝，不抛出异常。
 */
public final class DFASimulator {

    private static final Logger logger = LoggerFactory.getLogger(DFASimulator.class);

    private DFASimulator() {
    }

    /**
     * @param dfa   要运行的 DFA。
     * @param input 输入符号序列。
     * @return 输入被接受时返回 true。
     */
    public static boolean simulate(DFA dfa, List<Symbol> input) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");
        Objects.requireNonNull(input, "Input cannot be null.");

        State current = dfa.getStartState();
        for (Symbol symbol : input) {
            if (!dfa.getAlphabet().contains(symbol)) {
                logger.debug("符号 {} 不在字母表中，拒绝", symbol);
                return false;
            }
            State next = dfa.next(current, symbol);
            if (next == null) {
                logger.debug("δ({}, {}) 未定义，拒绝", current, symbol);
                return false;
            }
            logger.debug("δ({}, {}) = {}", current, symbol, next);
            current = next;
        }
        return dfa.isAccepting(current);
    }

    /**
     * 以字符串为输入，每个字符对应一个符号。
     */
    public static boolean simulate(DFA dfa, String input) {
        return simulate(dfa, toSymbols(input));
    }

    static List<Symbol> toSymbols(String input) {
        Objects.requireNonNull(input, "Input cannot be null.");
        List<Symbol> symbols = new ArrayList<>(input.length());
        for (int i = 0; i < input.length(); i++) {
            symbols.add(Symbol.of(input.charAt(i)));
        }
        return symbols;
    }
}
