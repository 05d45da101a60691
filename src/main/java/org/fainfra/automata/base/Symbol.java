package org.fainfra.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 代表自动机字母表中的一个输入符号（单个字符）。
 * 空标签保留给 epsilon 符号，只允许出现在 NFA 的迁移中。
 * Symbol 是不可变对象，相同标签的实例相等。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    // 定义 epsilon 符号的常量
    public static final Symbol EPSILON = new Symbol("");

    private static final ConcurrentHashMap<String, Symbol> CACHE = new ConcurrentHashMap<>();

    private final String label;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 Symbol。
     * @param label 符号的标签。
     */
    private Symbol(String label) {
        this.label = Objects.requireNonNull(label, "Symbol label cannot be null");
        this.hashCode = Objects.hash(label);
        logger.debug("创建 Symbol: {}", label.isEmpty() ? "ε" : label);
    }

    /**
     * 工厂方法：创建或获取一个符号。
     * null 或空字符串返回 {@link #EPSILON}。
     * @param label 符号的标签，长度必须不超过 1。
     * @return 对应的 Symbol 实例。
     * @throws IllegalArgumentException 如果标签长度大于 1。
     */
    public static Symbol of(String label) {
        if (label == null || label.isEmpty()) {
            return EPSILON;
        }
        if (label.length() != 1) {
            logger.warn("符号标签 '{}' 不是单个字符", label);
            throw new IllegalArgumentException("Symbol label must be a single character: '" + label + "'");
        }
        return CACHE.computeIfAbsent(label, Symbol::new);
    }

    /**
     * 工厂方法：由单个字符创建符号。
     * @param c 输入字符。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(char c) {
        return of(String.valueOf(c));
    }

    /**
     * 检查此符号是否为 epsilon。
     * @return 如果是 epsilon 则返回 true。
     */
    public boolean isEpsilon() {
        return label.isEmpty();
    }

    @Override
    public String toString() {
        return label.isEmpty() ? "ε" : label;
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 排在最前面
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
