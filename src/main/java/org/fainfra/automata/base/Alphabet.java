package org.fainfra.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 代表一个有限自动机的字母表。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 * 字母表中不允许出现 epsilon，epsilon 只作为 NFA 迁移的标签存在。
 */
public final class Alphabet implements Iterable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    @Getter
    private final SortedSet<Symbol> symbols;
    private final int hashCode;

    /**
     * 私有构造函数，通过符号集合创建 Alphabet。
     * @param symbols 包含所有符号的集合。
     */
    private Alphabet(Collection<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");

        if (symbols.contains(Symbol.EPSILON)) {
            logger.warn("字母表中包含 epsilon 符号。");
            throw new IllegalArgumentException("Alphabet must not contain the epsilon symbol");
        }

        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
        this.hashCode = Objects.hash(this.symbols);
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从一个符号集合创建 Alphabet 实例。
     * @param symbols 构成字母表的符号集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列符号标签创建 Alphabet 实例。
     * @param labels 单字符标签。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... labels) {
        SortedSet<Symbol> symbolSet = new TreeSet<>();
        for (String label : labels) {
            symbolSet.add(Symbol.of(label));
        }
        return new Alphabet(symbolSet);
    }

    /**
     * 返回此字母表与另一个字母表的并集。
     * @param other 另一个字母表。
     * @return 新的 Alphabet 实例。
     */
    public Alphabet union(Alphabet other) {
        SortedSet<Symbol> merged = new TreeSet<>(this.symbols);
        merged.addAll(other.symbols);
        return new Alphabet(merged);
    }

    /**
     * 检查字母表是否包含某个符号。
     * @param symbol 要检查的符号。
     * @return 如果包含则返回 true。
     */
    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
