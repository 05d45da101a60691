package org.fainfra.automata.models;

import lombok.Getter;
import org.fainfra.automata.base.Alphabet;
import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.base.Transition;
import org.fainfra.automata.engine.NFASimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 代表一个非确定有限自动机 (Non-deterministic Finite Automaton, NFA)。
 * 允许同一 (状态, 符号) 有多个目标状态，也允许 epsilon 迁移。
 * 字母表不单独给出，而是由迁移中出现的非 epsilon 符号导出。
 * 实例通过 {@link Builder} 增量构造，构造完成后不可变。
 */
@Getter
public final class NFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(NFA.class);

    private final SortedSet<State> states;
    private final Alphabet alphabet;
    private final State startState;
    private final SortedSet<State> acceptStates;
    private final SortedMap<State, SortedMap<Symbol, SortedSet<State>>> transitions;

    private NFA(Builder builder) {
        this.startState = Objects.requireNonNull(builder.startState, "Start state cannot be null.");

        SortedSet<State> allStates = new TreeSet<>(builder.states);
        allStates.add(builder.startState);
        allStates.addAll(builder.acceptStates);
        this.states = Collections.unmodifiableSortedSet(allStates);
        this.acceptStates = Collections.unmodifiableSortedSet(new TreeSet<>(builder.acceptStates));

        SortedSet<Symbol> symbols = new TreeSet<>();
        SortedMap<State, SortedMap<Symbol, SortedSet<State>>> table = new TreeMap<>();
        builder.transitions.forEach((source, row) -> {
            SortedMap<Symbol, SortedSet<State>> cells = new TreeMap<>();
            row.forEach((symbol, targets) -> {
                cells.put(symbol, Collections.unmodifiableSortedSet(new TreeSet<>(targets)));
                if (!symbol.isEpsilon()) {
                    symbols.add(symbol);
                }
            });
            table.put(source, Collections.unmodifiableSortedMap(cells));
        });
        this.transitions = Collections.unmodifiableSortedMap(table);
        this.alphabet = Alphabet.of(symbols);

        logger.debug("创建 NFA：{} 个状态，初始状态 {}，接受状态 {}", states.size(), startState, acceptStates);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 查询 δ(state, symbol)。
     * @param state 源状态。
     * @param symbol 输入符号，可以是 epsilon。
     * @return 目标状态集合，没有迁移时返回空集。
     */
    public Set<State> next(State state, Symbol symbol) {
        Map<Symbol, SortedSet<State>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        return row.getOrDefault(symbol, Collections.emptySortedSet());
    }

    public boolean hasEpsilonTransitions() {
        return transitions.values().stream().anyMatch(row -> row.containsKey(Symbol.EPSILON));
    }

    /**
     * 以列表形式返回全部迁移，按源状态、符号、目标状态排序。
     */
    public List<Transition> getTransitionList() {
        List<Transition> result = new ArrayList<>();
        transitions.forEach((source, row) ->
                row.forEach((symbol, targets) ->
                        targets.forEach(target -> result.add(new Transition(source, symbol, target)))));
        return result;
    }

    @Override
    public boolean accepts(List<Symbol> input) {
        return NFASimulator.simulate(this, input);
    }

    @Override
    public boolean accepts(String input) {
        return NFASimulator.simulate(this, input);
    }

    @Override
    public StructureSummary summarize() {
        return StructureSummary.of(this);
    }

    @Override
    public AutomatonKind getKind() {
        return AutomatonKind.NFA;
    }

    @Override
    public String toString() {
        return "NFA(states=" + states + ", start=" + startState.getLabel() + ", accept=" + acceptStates + ")";
    }

    /**
     * NFA 的增量构造器。迁移是累加的：对同一 (源状态, 符号) 多次添加会合并目标集合，
     * 迁移中出现的状态会被自动登记。
     */
    public static final class Builder {

        private final Set<State> states = new TreeSet<>();
        private final Set<State> acceptStates = new TreeSet<>();
        private final Map<State, Map<Symbol, Set<State>>> transitions = new TreeMap<>();
        private State startState;

        private Builder() {
        }

        public Builder addState(State state) {
            states.add(Objects.requireNonNull(state, "State cannot be null."));
            return this;
        }

        public Builder addTransition(State source, Symbol symbol, State target) {
            Objects.requireNonNull(source, "Source state cannot be null.");
            Objects.requireNonNull(symbol, "Symbol cannot be null.");
            Objects.requireNonNull(target, "Target state cannot be null.");
            transitions.computeIfAbsent(source, s -> new TreeMap<>())
                    .computeIfAbsent(symbol, s -> new TreeSet<>())
                    .add(target);
            states.add(source);
            states.add(target);
            return this;
        }

        public Builder addEpsilonTransition(State source, State target) {
            return addTransition(source, Symbol.EPSILON, target);
        }

        /**
         * 原样复制另一个 NFA 的全部状态和迁移，不复制其初始状态和接受状态。
         * @param other 被复制的 NFA。
         */
        public Builder addAll(NFA other) {
            states.addAll(other.getStates());
            for (Transition transition : other.getTransitionList()) {
                addTransition(transition.getSource(), transition.getSymbol(), transition.getTarget());
            }
            return this;
        }

        public Builder setStartState(State start) {
            this.startState = Objects.requireNonNull(start, "Start state cannot be null.");
            return this;
        }

        public Builder addAcceptState(State accept) {
            acceptStates.add(Objects.requireNonNull(accept, "Accept state cannot be null."));
            return this;
        }

        public Builder addAcceptStates(Set<State> accepts) {
            accepts.forEach(this::addAcceptState);
            return this;
        }

        /**
         * @return 不可变的 NFA 实例。
         * @throws IllegalStateException 如果尚未设置初始状态。
         */
        public NFA build() {
            if (startState == null) {
                logger.error("构造 NFA 时未设置初始状态");
                throw new IllegalStateException("NFA start state has not been set");
            }
            return new NFA(this);
        }
    }
}
