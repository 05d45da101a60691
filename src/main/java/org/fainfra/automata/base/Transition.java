package org.fainfra.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 一条迁移 (q, a, q')。用于遍历和展示自动机的迁移关系。
 */
@Getter
public final class Transition implements Comparable<Transition> {

    private final State source;
    private final Symbol symbol;
    private final State target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param symbol 触发迁移的符号 (a)，NFA 中可以是 epsilon
     * @param target 目标状态 (q')
     */
    public Transition(State source, Symbol symbol, State target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, symbol, target);
    }

    @Override
    public int compareTo(Transition other) {
        int bySource = source.compareTo(other.source);
        if (bySource != 0) {
            return bySource;
        }
        int bySymbol = symbol.compareTo(other.symbol);
        if (bySymbol != 0) {
            return bySymbol;
        }
        return target.compareTo(other.target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source.equals(that.source) &&
                symbol.equals(that.symbol) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s", source.getLabel(), symbol, target.getLabel());
    }
}
