package org.pragmatica.blatte.syntax;

import java.util.Arrays;
import java.util.Optional;

/**
 * Syntactic forms recognized when their keyword heads a group, e.g. {@code {\if ...}}.
 */
public enum SpecialForm {
    DEFINE("define"),
    SET("set!"),
    IF("if"),
    AND("and"),
    OR("or"),
    COND("cond"),
    WHILE("while"),
    LAMBDA("lambda"),
    LET("let"),
    LET_STAR("let*"),
    LETREC("letrec");

    private final String keyword;

    SpecialForm(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<SpecialForm> forKeyword(String keyword) {
        return Arrays.stream(values())
                     .filter(form -> form.keyword.equals(keyword))
                     .findFirst();
    }
}
