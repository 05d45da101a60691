package org.fainfra.regex;

/**
 * 空分组 "()" 或空的选择分支，例如 "a|" 和 "|a"。
 */
public class EmptySubexpressionException extends RegexSyntaxException {

    public EmptySubexpressionException(String what, int position) {
        super("Empty " + what + " at position " + position, position);
    }

    @Override
    public RegexErrorKind getKind() {
        return RegexErrorKind.EMPTY_SUBEXPRESSION;
    }
}
