package org.fainfra.regex;

import lombok.Getter;

/**
 * 正则表达式编译失败。调用者只需要捕获这一种异常，
 * 具体原因通过 {@link #getKind()} 和 {@link #getCause()} 获得。
 */
@Getter
public class RegexCompileException extends RuntimeException {

    private final RegexErrorKind kind;
    private final String pattern;
    private final int position;

    public RegexCompileException(String pattern, RegexSyntaxException cause) {
        super("Failed to compile regex '" + pattern + "' (" + cause.getKind().getDescription() + "): "
                + cause.getMessage(), cause);
        this.kind = cause.getKind();
        this.pattern = pattern;
        this.position = cause.getPosition();
    }

    @Override
    public synchronized RegexSyntaxException getCause() {
        return (RegexSyntaxException) super.getCause();
    }
}
