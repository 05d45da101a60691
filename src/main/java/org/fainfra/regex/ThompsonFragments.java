package org.fainfra.regex;

import org.fainfra.automata.base.State;
import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.NFA;

import java.util.Objects;

/**
 * Thompson 构造的基本片段。每个片段都从上下文中分配新状态，
 * 只通过 epsilon 迁移连接子 NFA，从不修改子 NFA 本身。
 */
final class ThompsonFragments {

    private final CompilationContext context;

    ThompsonFragments(CompilationContext context) {
        this.context = Objects.requireNonNull(context, "Compilation context cannot be null.");
    }

    /**
     * 只接受空串：一个既是初始又是接受的状态。
     */
    NFA empty() {
        State start = context.newState();
        return NFA.builder()
                .addState(start)
                .setStartState(start)
                .addAcceptState(start)
                .build();
    }

    /**
     * start --symbol--> end
     */
    NFA symbol(Symbol symbol) {
        State start = context.newState();
        State end = context.newState();
        return NFA.builder()
                .addTransition(start, symbol, end)
                .setStartState(start)
                .addAcceptState(end)
                .build();
    }

    /**
     * 新的初始状态 epsilon 到两个分支的初始状态，两个分支的接受状态 epsilon 到新的结束状态。
     */
    NFA union(NFA left, NFA right) {
        State start = context.newState();
        State end = context.newState();
        NFA.Builder builder = NFA.builder()
                .setStartState(start)
                .addAcceptState(end)
                .addEpsilonTransition(start, left.getStartState())
                .addEpsilonTransition(start, right.getStartState());
        for (State accept : left.getAcceptStates()) {
            builder.addEpsilonTransition(accept, end);
        }
        for (State accept : right.getAcceptStates()) {
            builder.addEpsilonTransition(accept, end);
        }
        return builder.addAll(left).addAll(right).build();
    }

    /**
     * 复用 first 的初始状态与 second 的接受状态，first 的每个接受状态 epsilon 到 second 的初始状态。
     */
    NFA concat(NFA first, NFA second) {
        NFA.Builder builder = NFA.builder()
                .addAll(first)
                .addAll(second)
                .setStartState(first.getStartState())
                .addAcceptStates(second.getAcceptStates());
        for (State accept : first.getAcceptStates()) {
            builder.addEpsilonTransition(accept, second.getStartState());
        }
        return builder.build();
    }

    /**
     * start -ε-> end（零次），start -ε-> inner.start，
     * inner 的每个接受状态 -ε-> inner.start（重复）以及 -ε-> end（结束）。
     */
    NFA star(NFA inner) {
        State start = context.newState();
        State end = context.newState();
        NFA.Builder builder = NFA.builder()
                .setStartState(start)
                .addAcceptState(end)
                .addEpsilonTransition(start, end)
                .addEpsilonTransition(start, inner.getStartState())
                .addAll(inner);
        for (State accept : inner.getAcceptStates()) {
            builder.addEpsilonTransition(accept, inner.getStartState());
            builder.addEpsilonTransition(accept, end);
        }
        return builder.build();
    }
}
