package org.sqlgate.guard;

import java.math.BigInteger;
import java.util.List;

// Keeps, lowers or appends the trailing LIMIT / FETCH FIRST so the ceiling holds; idempotent
public class QueryNormalizer {
    private final int ceiling;

    public QueryNormalizer(int ceiling) {
        if (ceiling < 1) throw new IllegalArgumentException("ceiling must be positive");
        this.ceiling = ceiling;
    }

    public int ceiling() {
        return ceiling;
    }

    public NormalizedStatement normalize(CandidateStatement statement) {
        List<List<SqlToken>> segments = StatementParser.segments(statement.tokens());
        if (segments.size() != 1) {
            throw new IllegalStateException("only single statements can be normalized");
        }
        List<SqlToken> sig = segments.get(0);
        String raw = statement.rawText();
        int from = sig.get(0).start();
        int to = sig.get(sig.size() - 1).end();

        int limitAt = lastTopLevel(sig, "LIMIT");
        if (limitAt >= 0) {
            return rewriteLimit(statement, sig, limitAt, from, to);
        }
        int fetchAt = lastTopLevel(sig, "FETCH");
        if (fetchAt >= 0) {
            return rewriteFetch(statement, sig, fetchAt, from, to);
        }
        String sql = raw.substring(from, to) + " LIMIT " + ceiling;
        return new NormalizedStatement(statement, sql, ceiling, true);
    }

    // LIMIT n [OFFSET m [ROW|ROWS]] or LIMIT ALL
    private NormalizedStatement rewriteLimit(CandidateStatement st, List<SqlToken> sig, int at, int from, int to) {
        String raw = st.rawText();
        if (at + 1 >= sig.size()) throw new ParseAmbiguousException("LIMIT without a row count");
        SqlToken n = sig.get(at + 1);

        int rest = at + 2;
        if (rest < sig.size()) {
            boolean offset = sig.get(rest).isWord("OFFSET")
                    && rest + 1 < sig.size() && isInteger(sig.get(rest + 1));
            int end = rest + 2;
            if (offset && end < sig.size() && (sig.get(end).isWord("ROW") || sig.get(end).isWord("ROWS"))) end++;
            if (!offset || end != sig.size()) {
                throw new ParseAmbiguousException("unsupported LIMIT clause");
            }
        }

        if (n.isWord("ALL")) {
            String sql = raw.substring(from, n.start()) + ceiling + raw.substring(n.end(), to);
            return new NormalizedStatement(st, sql, ceiling, true);
        }
        return applyCount(st, n, from, to, "LIMIT");
    }

    // FETCH FIRST|NEXT n ROW|ROWS ONLY
    private NormalizedStatement rewriteFetch(CandidateStatement st, List<SqlToken> sig, int at, int from, int to) {
        boolean shape = at + 4 == sig.size() - 1
                && (sig.get(at + 1).isWord("FIRST") || sig.get(at + 1).isWord("NEXT"))
                && (sig.get(at + 3).isWord("ROW") || sig.get(at + 3).isWord("ROWS"))
                && sig.get(at + 4).isWord("ONLY");
        if (!shape) throw new ParseAmbiguousException("unsupported FETCH clause");
        return applyCount(st, sig.get(at + 2), from, to, "FETCH");
    }

    private NormalizedStatement applyCount(CandidateStatement st, SqlToken n, int from, int to, String clause) {
        if (!isInteger(n)) {
            throw new ParseAmbiguousException(clause + " row count must be an integer literal, found " + n.text());
        }
        String raw = st.rawText();
        BigInteger requested = new BigInteger(n.text());
        if (requested.compareTo(BigInteger.valueOf(ceiling)) <= 0) {
            return new NormalizedStatement(st, raw.substring(from, to), requested.intValue(), false);
        }
        String sql = raw.substring(from, n.start()) + ceiling + raw.substring(n.end(), to);
        return new NormalizedStatement(st, sql, ceiling, true);
    }

    private static int lastTopLevel(List<SqlToken> sig, String word) {
        for (int i = sig.size() - 1; i >= 0; i--) {
            SqlToken t = sig.get(i);
            if (t.depth() == 0 && t.isWord(word)) return i;
        }
        return -1;
    }

    private static boolean isInteger(SqlToken t) {
        if (t.type() != SqlToken.Type.NUMBER || t.text().isEmpty()) return false;
        for (int i = 0; i < t.text().length(); i++) {
            if (!Character.isDigit(t.text().charAt(i))) return false;
        }
        return true;
    }
}
