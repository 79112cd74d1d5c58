package org.sqlgate.guard;

// Machine-readable outcome of a guard check; code() is the wire form
public enum RejectReason {
    OK("ok"),
    NON_SELECT("non_select"),
    MULTIPLE_STATEMENTS("multiple_statements"),
    FORBIDDEN_KEYWORD("forbidden_keyword"),
    TABLE_NOT_WHITELISTED("table_not_whitelisted"),
    PARSE_AMBIGUOUS("parse_ambiguous");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
