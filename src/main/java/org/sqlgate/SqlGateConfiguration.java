package org.sqlgate;

import io.dropwizard.Configuration;
import org.sqlgate.guard.GuardPolicy;

import java.util.ArrayList;
import java.util.List;

public class SqlGateConfiguration extends Configuration {
    public String dbUrl;
    public String dbUser;
    public String dbPassword;

    // 0 means one unpooled connection per execution
    public int poolSize = 4;

    public int statementTimeoutMs = 10_000;
    public int fetchSize = 500;

    public int rowLimitCeiling = GuardPolicy.DEFAULT_ROW_LIMIT_CEILING;
    public int maxSqlChars = GuardPolicy.DEFAULT_MAX_SQL_CHARS;

    // Empty disables the table whitelist rule
    public List<String> schemaWhitelist = new ArrayList<>();
    // Empty keeps the built-in denylist
    public List<String> forbiddenKeywords = new ArrayList<>();

    public GuardPolicy toPolicy() {
        return GuardPolicy.builder()
                .rowLimitCeiling(rowLimitCeiling)
                .maxSqlChars(maxSqlChars)
                .schemaWhitelist(schemaWhitelist)
                .forbiddenKeywords(forbiddenKeywords)
                .build();
    }
}
