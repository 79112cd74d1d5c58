package org.sqlgate.guard;

// An accepted statement rewritten so its row limit never exceeds the ceiling
public final class NormalizedStatement {

    private final CandidateStatement candidate;
    private final String sql;
    private final int effectiveLimit;
    private final boolean rewritten;

    public NormalizedStatement(CandidateStatement candidate, String sql, int effectiveLimit, boolean rewritten) {
        this.candidate = candidate;
        this.sql = sql;
        this.effectiveLimit = effectiveLimit;
        this.rewritten = rewritten;
    }

    public CandidateStatement candidate() {
        return candidate;
    }

    public String sql() {
        return sql;
    }

    public int effectiveLimit() {
        return effectiveLimit;
    }

    // True when a limit was appended or lowered
    public boolean rewritten() {
        return rewritten;
    }

    @Override
    public String toString() {
        return sql;
    }
}
