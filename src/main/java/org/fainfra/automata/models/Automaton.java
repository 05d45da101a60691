package org.fainfra.automata.models;

import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;

import java.util.List;
import java.util.Set;

/**
 * 有限自动机的公共视图。DFA 与 NFA 都实现此接口。
 * 所有实现都是构造后不可变的。
 */
public interface Automaton {

    Set<State> getStates();

    Alphabet getAlphabet();

    State getStartState();

    Set<State> getAcceptStates();

    /**
     * 判断自动机是否接受给定的符号序列。拒绝不是错误，此方法不会抛出异常。
     * @param input 输入符号序列。
     * @return 接受则返回 true。
     */
    boolean accepts(List<Symbol> input);

    /**
     * 判断自动机是否接受给定字符串，每个字符视为一个符号。
     * @param input 输入字符串。
     * @return 接受则返回 true。
     */
    boolean accepts(String input);

    /**
     * 生成供外部展示使用的结构摘要。
     */
    StructureSummary summarize();

    AutomatonKind getKind();
}
