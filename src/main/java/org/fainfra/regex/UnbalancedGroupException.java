package org.fainfra.regex;

import lombok.Getter;

/**
 * 未闭合的 '(' 或多余的 ')'。
 */
@Getter
public class UnbalancedGroupException extends RegexSyntaxException {

    private final String fragment;

    public UnbalancedGroupException(String fragment, int position) {
        super("Unmatched parenthesis at position " + position + " in: " + fragment, position);
        this.fragment = fragment;
    }

    @Override
    public RegexErrorKind getKind() {
        return RegexErrorKind.UNBALANCED_GROUP;
    }
}
