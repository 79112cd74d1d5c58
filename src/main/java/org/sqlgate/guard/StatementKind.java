package org.sqlgate.guard;

import java.util.Locale;
import java.util.Set;

// Leading verb class of a statement
public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    DDL,
    UNKNOWN;

    private static final Set<String> DDL_VERBS = Set.of(
            "CREATE", "DROP", "ALTER", "TRUNCATE", "RENAME", "GRANT", "REVOKE", "COMMENT"
    );

    public static StatementKind fromVerb(String verb) {
        if (verb == null) return UNKNOWN;
        String v = verb.toUpperCase(Locale.ROOT);
        switch (v) {
            case "SELECT":
                return SELECT;
            case "INSERT":
                return INSERT;
            case "UPDATE":
                return UPDATE;
            case "DELETE":
                return DELETE;
            default:
                return DDL_VERBS.contains(v) ? DDL : UNKNOWN;
        }
    }
}
