package org.fainfra.automata.models;

import lombok.AccessLevel;
import lombok.Getter;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 自动机的结构摘要，只供外部展示层使用，核心算法不依赖它。
 * 所有内容都转换为字符串标签，epsilon 符号以空字符串表示。
 */
@Getter
public final class StructureSummary {

    private final AutomatonKind kind;
    private final List<String> states;
    private final List<String> alphabet;
    private final String startState;
    private final List<String> acceptStates;
    // 源状态 -> (符号 -> 目标状态列表)，DFA 的目标列表只有一个元素
    private final Map<String, Map<String, List<String>>> transitions;
    private final int numStates;
    private final int numAcceptStates;
    private final boolean complete;
    @Getter(AccessLevel.NONE)
    private final boolean hasEpsilon;

    private StructureSummary(AutomatonKind kind, Automaton automaton,
                             Map<String, Map<String, List<String>>> transitions,
                             boolean complete, boolean hasEpsilon) {
        this.kind = kind;
        this.states = labels(automaton.getStates().stream().map(State::getLabel).collect(Collectors.toList()));
        this.alphabet = labels(automaton.getAlphabet().getSymbols().stream().map(Symbol::getLabel).collect(Collectors.toList()));
        this.startState = automaton.getStartState().getLabel();
        this.acceptStates = labels(automaton.getAcceptStates().stream().map(State::getLabel).collect(Collectors.toList()));
        this.transitions = Collections.unmodifiableMap(transitions);
        this.numStates = automaton.getStates().size();
        this.numAcceptStates = automaton.getAcceptStates().size();
        this.complete = complete;
        this.hasEpsilon = hasEpsilon;
    }

    /**
     * DFA 摘要：complete 表示 δ 在 states × alphabet 上是否为全函数，hasEpsilon 恒为 false。
     */
    public static StructureSummary of(DFA dfa) {
        Map<String, Map<String, List<String>>> table = new LinkedHashMap<>();
        dfa.getTransitions().forEach((source, row) -> {
            Map<String, List<String>> cells = new LinkedHashMap<>();
            row.forEach((symbol, target) -> cells.put(symbol.getLabel(), List.of(target.getLabel())));
            table.put(source.getLabel(), Collections.unmodifiableMap(cells));
        });
        return new StructureSummary(AutomatonKind.DFA, dfa, table, dfa.isComplete(), false);
    }

    /**
     * NFA 摘要：complete 表示每个状态在导出字母表的每个符号上都至少有一个目标状态。
     */
    public static StructureSummary of(NFA nfa) {
        Map<String, Map<String, List<String>>> table = new LinkedHashMap<>();
        nfa.getTransitions().forEach((source, row) -> {
            Map<String, List<String>> cells = new LinkedHashMap<>();
            row.forEach((symbol, targets) -> cells.put(symbol.getLabel(),
                    targets.stream().map(State::getLabel).collect(Collectors.toUnmodifiableList())));
            table.put(source.getLabel(), Collections.unmodifiableMap(cells));
        });
        boolean complete = nfa.getStates().stream()
                .allMatch(state -> nfa.getAlphabet().getSymbols().stream()
                        .noneMatch(symbol -> nfa.next(state, symbol).isEmpty()));
        return new StructureSummary(AutomatonKind.NFA, nfa, table, complete, nfa.hasEpsilonTransitions());
    }

    public boolean hasEpsilon() {
        return hasEpsilon;
    }

    private static List<String> labels(List<String> labels) {
        return Collections.unmodifiableList(labels);
    }

    @Override
    public String toString() {
        return "StructureSummary{" +
                "kind=" + kind +
                ", states=" + numStates +
                ", acceptStates=" + numAcceptStates +
                ", complete=" + complete +
                ", hasEpsilon=" + hasEpsilon +
                '}';
    }
}
