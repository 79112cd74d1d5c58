package org.sqlgate.repo;

import org.sqlgate.dto.TableDescription;
import org.sqlgate.guard.GuardPolicy;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

// Lists and describes the tables an agent may query, filtered by the whitelist when one is set
public class SchemaInspector {
    private static final Set<String> SYSTEM_SCHEMAS = Set.of("information_schema", "pg_catalog", "sys");

    private final ConnectionSource connections;
    private final GuardPolicy policy;

    public SchemaInspector(ConnectionSource connections, GuardPolicy policy) {
        this.connections = connections;
        this.policy = policy;
    }

    // Names as the database reports them; unquoted names are lowercase on PostgreSQL
    public List<String> listTables() throws SQLException {
        Set<String> out = new TreeSet<>();
        try (Connection c = connections.acquire();
             ResultSet rs = c.getMetaData().getTables(null, null, "%", new String[]{"TABLE", "BASE TABLE", "VIEW"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                String schema = rs.getString("TABLE_SCHEM");
                if (name == null) continue;

                if (policy.whitelistEnabled()) {
                    Set<String> allowed = policy.schemaWhitelist();
                    if (allowed.contains(name)) out.add(name);
                    if (schema != null && allowed.contains(schema + "." + name)) out.add(schema + "." + name);
                } else if (!isSystemSchema(schema)) {
                    out.add(name);
                }
            }
        }
        return List.copyOf(out);
    }

    // Empty when the table does not exist or the whitelist does not admit it
    public Optional<TableDescription> describe(String name) throws SQLException {
        String key = GuardPolicy.tableKey(name);
        if (key.isEmpty()) return Optional.empty();
        if (policy.whitelistEnabled() && !policy.schemaWhitelist().contains(key)) return Optional.empty();

        int dot = key.lastIndexOf('.');
        String schema = (dot > 0) ? key.substring(0, dot) : null;
        String table = key.substring(dot + 1);

        TableDescription out = new TableDescription(key);
        String matchedSchema = null;
        try (Connection c = connections.acquire()) {
            DatabaseMetaData md = c.getMetaData();
            String esc = md.getSearchStringEscape();
            try (ResultSet rs = md.getColumns(null, escape(schema, esc), escape(table, esc), "%")) {
                while (rs.next()) {
                    String rowSchema = rs.getString("TABLE_SCHEM");
                    // Escaping is best effort, so the name is checked again
                    if (!table.equals(rs.getString("TABLE_NAME"))) continue;
                    if (schema == null && isSystemSchema(rowSchema)) continue;
                    // An unqualified name present in several schemas describes the first one only
                    if (matchedSchema == null) matchedSchema = String.valueOf(rowSchema);
                    if (!matchedSchema.equals(String.valueOf(rowSchema))) continue;

                    out.columns.add(new TableDescription.Column(
                            rs.getString("COLUMN_NAME"),
                            rs.getString("TYPE_NAME"),
                            rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls));
                }
            }
        }
        return out.columns.isEmpty() ? Optional.empty() : Optional.of(out);
    }

    private static boolean isSystemSchema(String schema) {
        return schema != null && SYSTEM_SCHEMAS.contains(schema.toLowerCase(Locale.ROOT));
    }

    private static String escape(String pattern, String esc) {
        if (pattern == null || esc == null || esc.isEmpty()) return pattern;
        return pattern.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
    }
}
