package org.fainfra.regex;

import org.fainfra.automata.base.State;

/**
 * 一次顶层编译的上下文，持有单调递增的状态计数器。
 * 同一次编译中的所有子构造共享计数器以保证状态名全局唯一；
 * 不同编译各自新建上下文，互不影响。
 */
public final class CompilationContext {

    public static final String STATE_PREFIX = "q";

    private int nextId;

    /**
     * @return 新状态 q0, q1, q2, ...
     */
    public State newState() {
        return State.indexed(STATE_PREFIX, nextId++);
    }

    public int getAllocatedStateCount() {
        return nextId;
    }
}
