package org.fainfra.regex;

/**
 * 正则表达式编译错误的分类。
 */
public enum RegexErrorKind {

    UNBALANCED_GROUP("unbalanced group"),       // 括号不匹配
    MALFORMED_PATTERN("malformed pattern"),     // 例如没有操作数的 *
    EMPTY_SUBEXPRESSION("empty subexpression"); // 例如 () 或 a|

    private final String description;

    RegexErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
