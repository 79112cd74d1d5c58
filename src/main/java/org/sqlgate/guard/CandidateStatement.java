package org.sqlgate.guard;

import java.util.List;
import java.util.Set;

// Raw SQL as classified by StatementParser
public final class CandidateStatement {

    private final String rawText;
    private final List<SqlToken> tokens;
    private final String verb;
    private final StatementKind kind;
    private final int statementCount;
    private final Set<String> cteNames;

    CandidateStatement(String rawText, List<SqlToken> tokens, String verb, StatementKind kind,
                       int statementCount, Set<String> cteNames) {
        this.rawText = rawText;
        this.tokens = List.copyOf(tokens);
        this.verb = verb;
        this.kind = kind;
        this.statementCount = statementCount;
        this.cteNames = Set.copyOf(cteNames);
    }

    public String rawText() {
        return rawText;
    }

    public List<SqlToken> tokens() {
        return tokens;
    }

    // Leading verb as written, uppercased; null when the text starts with no word
    public String verb() {
        return verb;
    }

    public StatementKind kind() {
        return kind;
    }

    public int statementCount() {
        return statementCount;
    }

    // Names introduced by a WITH clause, lowercased
    public Set<String> cteNames() {
        return cteNames;
    }
}
