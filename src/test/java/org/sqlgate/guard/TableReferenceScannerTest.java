package org.sqlgate.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TableReferenceScannerTest {

    private final StatementParser parser = new StatementParser(10_000);

    private List<String> scan(String sql) {
        return TableReferenceScanner.scan(parser.parse(sql));
    }

    @Test
    void simpleFrom() {
        assertThat(scan("SELECT * FROM customers")).containsExactly("customers");
    }

    @Test
    void joinsAndCommaLists() {
        assertThat(scan("SELECT * FROM a x, b AS y JOIN c ON x.id = c.id CROSS JOIN d"))
                .containsExactly("a", "b", "c", "d");
    }

    @Test
    void qualifiedAndQuotedNames() {
        assertThat(scan("SELECT * FROM Sales.\"Orders\" o JOIN `inv`.items i ON o.id = i.order_id"))
                .containsExactly("sales.Orders", "inv.items");
    }

    @Test
    void subqueriesAtAnyDepth() {
        assertThat(scan("SELECT * FROM (SELECT id FROM a WHERE id IN (SELECT a_id FROM b)) t"))
                .containsExactly("a", "b");
    }

    @Test
    void skipsFromInsideFunctionArguments() {
        assertThat(scan("SELECT EXTRACT(YEAR FROM ts), SUBSTRING(name FROM 2) FROM events"))
                .containsExactly("events");
    }

    @Test
    void ignoresCommentedTables() {
        assertThat(scan("SELECT * FROM a /* JOIN secret */")).containsExactly("a");
    }

    @Test
    void onlyPrefix() {
        assertThat(scan("SELECT * FROM ONLY parent_table")).containsExactly("parent_table");
    }

    @Test
    void deduplicates() {
        assertThat(scan("SELECT * FROM a JOIN a b ON a.id = b.parent_id")).containsExactly("a");
    }

    @Test
    @DisplayName("an unreadable reference is ambiguous rather than skipped")
    void unreadableReference() {
        assertThatThrownBy(() -> scan("SELECT * FROM [secret_table]"))
                .isInstanceOf(ParseAmbiguousException.class);
        assertThatThrownBy(() -> scan("SELECT * FROM customers JOIN $1 ON true"))
                .isInstanceOf(ParseAmbiguousException.class);
    }

    @Test
    @DisplayName("the FROM list continues past derived tables, column aliases and function arguments")
    void continuesPastNestedItems() {
        assertThat(scan("SELECT * FROM (SELECT 1 AS x) t, secret_table")).containsExactly("secret_table");
        assertThat(scan("SELECT * FROM customers AS c(a, b), secret_table"))
                .containsExactly("customers", "secret_table");
        assertThat(scan("SELECT * FROM generate_series(1, 3) g, secret_table"))
                .containsExactly("generate_series", "secret_table");
        assertThat(scan("SELECT * FROM a JOIN b ON a.id = b.id, c WHERE a.x IN (1, 2)"))
                .containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    @DisplayName("parenthesized joins are read from the inside")
    void parenthesizedJoin() {
        assertThat(scan("SELECT * FROM (secret_table CROSS JOIN customers)"))
                .containsExactlyInAnyOrder("secret_table", "customers");
        assertThat(scan("SELECT * FROM ((a JOIN b ON true)) x")).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void quotedNamesKeepTheirCase() {
        assertThat(scan("SELECT * FROM \"Customers\", customers")).containsExactly("Customers", "customers");
    }
}
