package org.fainfra.regex;

import org.fainfra.automata.algorithms.DFAMinimizer;
import org.fainfra.automata.algorithms.SubsetConstruction;
import org.fainfra.automata.models.DFA;
import org.fainfra.automata.models.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 使用 Thompson 构造把正则表达式编译为 NFA。
 * 支持符号连接、选择 '|'、Kleene 星号 '*' 和括号分组；空模式只匹配空串。
 * 每次调用使用独立的 {@link CompilationContext}，可以并发调用。
 */
public final class RegexCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RegexCompiler.class);

    private RegexCompiler() {
    }

    /**
     * @param pattern 正则表达式。
     * @return 等价的 NFA，状态命名为 q0, q1, ...
     * @throws RegexCompileException 模式不合法时抛出，不返回部分结果。
     */
    public static NFA compile(String pattern) {
        Objects.requireNonNull(pattern, "Pattern cannot be null.");
        CompilationContext context = new CompilationContext();
        try {
            NFA nfa = new RegexParser(pattern, new ThompsonFragments(context)).parse();
            logger.info("正则表达式 '{}' 编译完成，分配了 {} 个状态", pattern, context.getAllocatedStateCount());
            return nfa;
        } catch (RegexSyntaxException e) {
            logger.error("正则表达式 '{}' 编译失败: {}", pattern, e.getMessage());
            throw new RegexCompileException(pattern, e);
        }
    }

    /**
     * 编译后经子集构造与最小化得到最小 DFA。
     */
    public static DFA compileToMinimalDFA(String pattern) {
        return DFAMinimizer.minimize(SubsetConstruction.determinize(compile(pattern)));
    }

    /**
     * 判断整个输入是否匹配模式。
     */
    public static boolean matches(String pattern, String input) {
        return compile(pattern).accepts(input);
    }
}
