package org.fainfra.automata.algorithms;

import lombok.Getter;
import org.fainfra.automata.models.DFA;

import java.util.Objects;

/**
 * 一次最小化的结果及其状态数统计。
 */
@Getter
public final class MinimizationReport {

    private final DFA original;
    private final DFA minimized;
    private final int originalStateCount;
    private final int minimizedStateCount;

    private MinimizationReport(DFA original, DFA minimized) {
        this.original = Objects.requireNonNull(original, "Original DFA cannot be null.");
        this.minimized = Objects.requireNonNull(minimized, "Minimized DFA cannot be null.");
        this.originalStateCount = original.getStates().size();
        this.minimizedStateCount = minimized.getStates().size();
    }

    /**
     * 最小化给定 DFA 并生成报告。
     * @param dfa 原始 DFA。
     * @return 包含原始与最小化 DFA 的报告。
     */
    public static MinimizationReport of(DFA dfa) {
        return new MinimizationReport(dfa, DFAMinimizer.minimize(dfa));
    }

    public int getRemovedStateCount() {
        return originalStateCount - minimizedStateCount;
    }

    /**
     * @return 状态数减少的百分比，原始 DFA 没有状态时为 0。
     */
    public double getReductionPercent() {
        if (originalStateCount == 0) {
            return 0.0;
        }
        return getRemovedStateCount() * 100.0 / originalStateCount;
    }

    @Override
    public String toString() {
        return String.format("MinimizationReport(%d -> %d, -%.1f%%)",
                originalStateCount, minimizedStateCount, getReductionPercent());
    }
}
