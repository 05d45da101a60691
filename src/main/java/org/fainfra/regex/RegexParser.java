package org.fainfra.regex;

import org.fainfra.automata.base.Symbol;
import org.fainfra.automata.models.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 递归下降解析器，直接在解析过程中生成 NFA。
 * 使用下标区间 [from, to) 而不是子串来表示当前解析的片段。
 * <pre>
 * R := E | E '|' R      选择，只在括号深度 0 处识别，优先级最低
 * E := T | T E          连接（相邻）
 * T := F | F '*'        Kleene 星号，只能跟在单个符号或分组之后
 * F := s | '(' R ')'
 * </pre>
 * 元字符为 ( ) | *，其余任何字符都是普通符号。
 */
final class RegexParser {

    private static final Logger logger = LoggerFactory.getLogger(RegexParser.class);

    private final String pattern;
    private final ThompsonFragments fragments;

    RegexParser(String pattern, ThompsonFragments fragments) {
        this.pattern = Objects.requireNonNull(pattern, "Pattern cannot be null.");
        this.fragments = Objects.requireNonNull(fragments, "Fragments cannot be null.");
    }

    NFA parse() {
        if (pattern.isEmpty()) {
            return fragments.empty();
        }
        return parseAlternation(0, pattern.length());
    }

    /**
     * 在深度 0 处按 '|' 切分，先按从左到右的顺序编译各分支，再从右向左合并。
     */
    private NFA parseAlternation(int from, int to) {
        List<int[]> branches = new ArrayList<>();
        int depth = 0;
        int branchStart = from;
        for (int i = from; i < to; i++) {
            char c = pattern.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new UnbalancedGroupException(pattern.substring(from, to), i);
                }
            } else if (c == '|' && depth == 0) {
                branches.add(new int[]{branchStart, i});
                branchStart = i + 1;
            }
        }
        if (depth > 0) {
            throw new UnbalancedGroupException(pattern.substring(from, to), lastOpenGroup(from, to));
        }
        branches.add(new int[]{branchStart, to});

        List<NFA> compiled = new ArrayList<>(branches.size());
        for (int[] branch : branches) {
            if (branch[0] == branch[1]) {
                throw new EmptySubexpressionException("alternative", branch[0]);
            }
            compiled.add(parseSequence(branch[0], branch[1]));
        }

        NFA result = compiled.get(compiled.size() - 1);
        for (int i = compiled.size() - 2; i >= 0; i--) {
            result = fragments.union(compiled.get(i), result);
        }
        return result;
    }

    /**
     * 区间内已保证括号平衡且深度 0 处没有 '|'。
     */
    private NFA parseSequence(int from, int to) {
        NFA result = null;
        int i = from;
        while (i < to) {
            char c = pattern.charAt(i);
            NFA element;
            if (c == '(') {
                int close = matchingClose(i, to);
                if (close == i + 1) {
                    throw new EmptySubexpressionException("group", i);
                }
                element = parseAlternation(i + 1, close);
                i = close + 1;
            } else if (c == ')') {
                throw new UnbalancedGroupException(pattern.substring(from, to), i);
            } else if (c == '*') {
                throw new MalformedPatternException(c, i, "nothing to repeat");
            } else if (c == '|') {
                throw new MalformedPatternException(c, i, "alternation outside of a group");
            } else {
                element = fragments.symbol(Symbol.of(c));
                i++;
            }

            if (i < to && pattern.charAt(i) == '*') {
                element = fragments.star(element);
                i++;
            }
            result = result == null ? element : fragments.concat(result, element);
        }
        logger.debug("解析片段 [{}, {}) '{}'", from, to, pattern.substring(from, to));
        return result;
    }

    private int matchingClose(int open, int to) {
        int depth = 0;
        for (int i = open; i < to; i++) {
            char c = pattern.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new UnbalancedGroupException(pattern.substring(open, to), open);
    }

    private int lastOpenGroup(int from, int to) {
        int depth = 0;
        for (int i = to - 1; i >= from; i--) {
            char c = pattern.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return from;
    }
}
