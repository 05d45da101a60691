package org.fainfra.regex;

import lombok.Getter;

/**
 * 解析阶段发现的语法错误的公共父类。
 * 编译器会把它包装进 {@link RegexCompileException} 再抛给调用者。
 */
@Getter
public abstract class RegexSyntaxException extends RuntimeException {

    // 在原始模式串中的下标
    private final int position;

    protected RegexSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    public abstract RegexErrorKind getKind();
}
