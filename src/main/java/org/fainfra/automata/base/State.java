package org.fainfra.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表自动机中的一个状态。
 * 状态不携带任何数据，身份完全由标签决定。
 * State 是不可变对象。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final String label;

    private final int hashCode;

    private State(String label) {
        this.label = Objects.requireNonNull(label, "State label cannot be null");
        this.hashCode = Objects.hash(label);
        logger.debug("创建了一个State: {}", label);
    }

    /**
     * 工厂方法：以给定标签创建状态。
     * @param label 状态的标签/名称。
     * @return 新的 State 实例，与同标签的其他实例相等。
     */
    public static State of(String label) {
        return new State(label);
    }

    /**
     * 以前缀加序号创建状态，例如 "q" + 3 得到 q3。
     * @param prefix 标签前缀。
     * @param index 序号。
     * @return 新的 State 实例。
     */
    public static State indexed(String prefix, int index) {
        return new State(prefix + index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * 先按长度、再按字典序比较，使 q2 排在 q10 之前。
     */
    @Override
    public int compareTo(State other) {
        int byLength = Integer.compare(this.label.length(), other.label.length());
        if (byLength != 0) {
            return byLength;
        }
        return this.label.compareTo(other.label);
    }
}
