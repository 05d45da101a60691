package org.fainfra.automata.models;

import lombok.Getter;
import org.fainfra.automata.algorithms.DFAEquivalenceChecker;
import org.fainfra.automata.algorithms.DFAMinimizer;
import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.base.Transition;
import org.fainfra.automata.engine.DFASimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 代表一个确定有限自动机 (Deterministic Finite Automaton, DFA)。
 * DFA 是一个五元组 (Q, Σ, δ, q0, F)，其中 δ 是部分函数：缺失的迁移在模拟时视为拒绝。
 * 此类是不可变的，minimize、complete 等操作都返回新的实例。
 */
@Getter
public final class DFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    /**
     * 补全 DFA 时使用的陷阱状态标签，若已被占用则追加序号。
     */
    public static final String SINK_LABEL = "sink";

    private final SortedSet<State> states;
    private final Alphabet alphabet;
    private final State startState;
    private final SortedSet<State> acceptStates;
    private final SortedMap<State, SortedMap<Symbol, State>> transitions;

    /**
     * 构造一个 DFA。
     * 引用未知状态或字母表外符号的迁移会被丢弃并记录警告，模拟时等同于未定义的迁移。
     *
     * @param states       状态集合。
     * @param alphabet     字母表。
     * @param startState   初始状态，必须属于 states。
     * @param acceptStates 接受状态集合，必须是 states 的子集。
     * @param transitions  迁移表 δ(q, a) = q'。
     */
    public DFA(Collection<State> states, Alphabet alphabet, State startState,
               Collection<State> acceptStates, Map<State, ? extends Map<Symbol, State>> transitions) {
        Objects.requireNonNull(states, "States cannot be null.");
        Objects.requireNonNull(acceptStates, "Accept states cannot be null.");
        Objects.requireNonNull(transitions, "Transitions cannot be null.");
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.startState = Objects.requireNonNull(startState, "Start state cannot be null.");
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));

        if (!this.states.contains(startState)) {
            logger.error("初始状态 {} 不在状态集合 {} 中", startState, this.states);
            throw new IllegalArgumentException("Start state '" + startState + "' is not one of the states");
        }
        for (State accept : acceptStates) {
            if (!this.states.contains(accept)) {
                logger.error("接受状态 {} 不在状态集合 {} 中", accept, this.states);
                throw new IllegalArgumentException("Accept state '" + accept + "' is not one of the states");
            }
        }
        this.acceptStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptStates));

        SortedMap<State, SortedMap<Symbol, State>> table = new TreeMap<>();
        for (Map.Entry<State, ? extends Map<Symbol, State>> row : transitions.entrySet()) {
            State source = row.getKey();
            if (!this.states.contains(source)) {
                logger.warn("忽略来自未知状态 {} 的迁移", source);
                continue;
            }
            SortedMap<Symbol, State> cells = new TreeMap<>();
            for (Map.Entry<Symbol, State> cell : row.getValue().entrySet()) {
                Symbol symbol = cell.getKey();
                State target = cell.getValue();
                if (!alphabet.contains(symbol)) {
                    logger.warn("忽略迁移 {} --[{}]-->：符号不在字母表 {} 中", source, symbol, alphabet);
                    continue;
                }
                if (target == null || !this.states.contains(target)) {
                    logger.warn("忽略迁移 {} --[{}]--> {}：目标状态未知", source, symbol, target);
                    continue;
                }
                cells.put(symbol, target);
            }
            if (!cells.isEmpty()) {
                table.put(source, Collections.unmodifiableSortedMap(cells));
            }
        }
        this.transitions = Collections.unmodifiableSortedMap(table);

        logger.info("创建 DFA：{} 个状态，{} 个接受状态，字母表 {}",
                this.states.size(), this.acceptStates.size(), alphabet);
    }

    /**
     * 工厂方法：从原始标签构造 DFA。
     *
     * @param states       状态标签。
     * @param alphabet     单字符符号标签。
     * @param startState   初始状态标签。
     * @param acceptStates 接受状态标签。
     * @param transitions  状态标签 -> (符号标签 -> 目标状态标签)。
     * @return 新的 DFA 实例。
     */
    public static DFA of(Collection<String> states, Collection<String> alphabet, String startState,
                         Collection<String> acceptStates, Map<String, Map<String, String>> transitions) {
        List<State> stateList = new ArrayList<>();
        for (String label : states) {
            stateList.add(State.of(label));
        }
        List<Symbol> symbolList = new ArrayList<>();
        for (String label : alphabet) {
            symbolList.add(Symbol.of(label));
        }
        List<State> acceptList = new ArrayList<>();
        for (String label : acceptStates) {
            acceptList.add(State.of(label));
        }
        Map<State, Map<Symbol, State>> table = new TreeMap<>();
        transitions.forEach((source, row) -> {
            Map<Symbol, State> cells = table.computeIfAbsent(State.of(source), s -> new TreeMap<>());
            row.forEach((symbol, target) -> cells.put(Symbol.of(symbol), target == null ? null : State.of(target)));
        });
        return new DFA(stateList, Alphabet.of(symbolList), State.of(startState), acceptList, table);
    }

    /**
     * 查询 δ(state, symbol)。
     * @param state 当前状态。
     * @param symbol 输入符号。
     * @return 目标状态，如果迁移未定义则返回 null。
     */
    public State next(State state, Symbol symbol) {
        Map<Symbol, State> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    public boolean isAccepting(State state) {
        return acceptStates.contains(state);
    }

    /**
     * 检查 δ 是否在 states × alphabet 上是全函数。
     * @return 每个 (状态, 符号) 都有迁移时返回 true。
     */
    public boolean isComplete() {
        for (State state : states) {
            for (Symbol symbol : alphabet) {
                if (next(state, symbol) == null) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 返回在给定字母表上补全的新 DFA。缺失的迁移全部指向一个新的非接受陷阱状态，
     * 陷阱状态在所有符号上自环。如果已经是完全的，则不添加陷阱状态。
     * 新字母表之外的原有符号不会被删除。
     *
     * @param over 要补全的字母表。
     * @return 补全后的 DFA；若无需补全且字母表不变，返回自身。
     */
    public DFA complete(Alphabet over) {
        Alphabet target = this.alphabet.union(over);
        boolean missing = false;
        for (State state : states) {
            for (Symbol symbol : target) {
                if (next(state, symbol) == null) {
                    missing = true;
                    break;
                }
            }
        }
        if (!missing) {
            return target.equals(this.alphabet) ? this
                    : new DFA(states, target, startState, acceptStates, transitions);
        }

        State sink = freshSink();
        Set<State> newStates = new TreeSet<>(states);
        newStates.add(sink);
        Map<State, Map<Symbol, State>> table = new TreeMap<>();
        for (State state : newStates) {
            Map<Symbol, State> row = new TreeMap<>();
            for (Symbol symbol : target) {
                State dest = next(state, symbol);
                row.put(symbol, dest == null ? sink : dest);
            }
            table.put(state, row);
        }
        logger.debug("以陷阱状态 {} 补全 DFA，字母表 {}", sink, target);
        return new DFA(newStates, target, startState, acceptStates, table);
    }

    public DFA complete() {
        return complete(this.alphabet);
    }

    /**
     * 计算从初始状态可达的状态集合（广度优先）。
     */
    public SortedSet<State> reachableStates() {
        SortedSet<State> visited = new TreeSet<>();
        Deque<State> queue = new ArrayDeque<>();
        visited.add(startState);
        queue.add(startState);
        while (!queue.isEmpty()) {
            State current = queue.poll();
            for (State dest : transitions.getOrDefault(current, Collections.emptySortedMap()).values()) {
                if (visited.add(dest)) {
                    queue.add(dest);
                }
            }
        }
        return visited;
    }

    /**
     * 以列表形式返回全部迁移，按源状态、符号排序。
     */
    public List<Transition> getTransitionList() {
        List<Transition> result = new ArrayList<>();
        transitions.forEach((source, row) ->
                row.forEach((symbol, target) -> result.add(new Transition(source, symbol, target))));
        return result;
    }

    @Override
    public boolean accepts(List<Symbol> input) {
        return DFASimulator.simulate(this, input);
    }

    @Override
    public boolean accepts(String input) {
        return DFASimulator.simulate(this, input);
    }

    /**
     * 返回与此 DFA 等价的最小 DFA，原对象不变。
     */
    public DFA minimize() {
        return DFAMinimizer.minimize(this);
    }

    public boolean isEquivalent(DFA other) {
        return DFAEquivalenceChecker.isEquivalent(this, other);
    }

    @Override
    public StructureSummary summarize() {
        return StructureSummary.of(this);
    }

    @Override
    public AutomatonKind getKind() {
        return AutomatonKind.DFA;
    }

    private State freshSink() {
        State sink = State.of(SINK_LABEL);
        int suffix = 1;
        while (states.contains(sink)) {
            sink = State.indexed(SINK_LABEL, suffix++);
        }
        return sink;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DFA dfa = (DFA) o;
        return states.equals(dfa.states) &&
                alphabet.equals(dfa.alphabet) &&
                startState.equals(dfa.startState) &&
                acceptStates.equals(dfa.acceptStates) &&
                transitions.equals(dfa.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, startState, acceptStates, transitions);
    }

    @Override
    public String toString() {
        return "DFA(states=" + states + ", start=" + startState.getLabel() + ", accept=" + acceptStates + ")";
    }
}
