package org.fainfra.regex;

import lombok.Getter;

/**
 * 位置正确但用法不合法的字符，例如没有可重复对象的 '*'。
 */
@Getter
public class MalformedPatternException extends RegexSyntaxException {

    private final char character;

    public MalformedPatternException(char character, int position, String reason) {
        super("Unexpected '" + character + "' at position " + position + ": " + reason, position);
        this.character = character;
    }

    @Override
    public RegexErrorKind getKind() {
        return RegexErrorKind.MALFORMED_PATTERN;
    }
}
