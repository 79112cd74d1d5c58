package org.sqlgate.dto;

import java.util.ArrayList;
import java.util.List;

// Columns of one table, in ordinal order, as returned by GET /tables/{name}
public class TableDescription {
    public String table;
    public List<Column> columns = new ArrayList<>();

    public TableDescription() {}

    public TableDescription(String table) {
        this.table = table;
    }

    public static class Column {
        public String name;
        public String type;
        public boolean nullable;

        public Column() {}

        public Column(String name, String type, boolean nullable) {
            this.name = name;
            this.type = type;
            this.nullable = nullable;
        }
    }
}
