package org.sqlgate.guard;

import java.util.Objects;

// Accept/reject outcome for one statement
public final class ValidationVerdict {

    private static final ValidationVerdict OK = new ValidationVerdict(true, RejectReason.OK, null, null);

    private final boolean accepted;
    private final RejectReason reason;
    private final String matchedRule;
    private final String detail;

    private ValidationVerdict(boolean accepted, RejectReason reason, String matchedRule, String detail) {
        this.accepted = accepted;
        this.reason = reason;
        this.matchedRule = matchedRule;
        this.detail = detail;
    }

    public static ValidationVerdict ok() {
        return OK;
    }

    public static ValidationVerdict reject(RejectReason reason, String matchedRule, String detail) {
        if (reason == RejectReason.OK) throw new IllegalArgumentException("reject needs a failure reason");
        return new ValidationVerdict(false, reason, matchedRule, detail);
    }

    // Used by the pipeline when the parser could not classify the text at all
    public static ValidationVerdict ambiguous(String detail) {
        return new ValidationVerdict(false, RejectReason.PARSE_AMBIGUOUS, "parse", detail);
    }

    public boolean accepted() {
        return accepted;
    }

    public RejectReason reason() {
        return reason;
    }

    public String matchedRule() {
        return matchedRule;
    }

    // Offending keyword, table or verb; null when accepted
    public String detail() {
        return detail;
    }

    public String message() {
        switch (reason) {
            case OK:
                return "query accepted";
            case NON_SELECT:
                return "query rejected: only SELECT statements are allowed"
                        + (detail == null ? "" : " (found " + detail + ")");
            case MULTIPLE_STATEMENTS:
                return "query rejected: multiple statements are not allowed";
            case FORBIDDEN_KEYWORD:
                return "query rejected: contains forbidden keyword " + detail;
            case TABLE_NOT_WHITELISTED:
                return "query rejected: table " + detail + " is not whitelisted";
            default:
                return "query rejected: " + (detail == null ? "statement could not be parsed reliably" : detail);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationVerdict)) return false;
        ValidationVerdict that = (ValidationVerdict) o;
        return accepted == that.accepted
                && reason == that.reason
                && Objects.equals(matchedRule, that.matchedRule)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accepted, reason, matchedRule, detail);
    }

    @Override
    public String toString() {
        return "ValidationVerdict{" + reason.code() + (matchedRule == null ? "" : ", rule=" + matchedRule)
                + (detail == null ? "" : ", detail=" + detail) + "}";
    }
}
