package org.sqlgate.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SqlTokenizerTest {

    private static List<SqlToken.Type> types(String sql) {
        return SqlTokenizer.tokenize(sql).stream().map(SqlToken::type).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Quote and comment boundaries")
    class Boundaries {

        @Test
        @DisplayName("terminator inside a string literal is part of the string")
        void terminatorInsideString() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT 'a;b' FROM t");

            assertThat(tokens).extracting(SqlToken::type).containsExactly(
                    SqlToken.Type.WORD, SqlToken.Type.STRING, SqlToken.Type.WORD, SqlToken.Type.WORD);
            assertThat(tokens.get(1).text()).isEqualTo("'a;b'");
        }

        @Test
        @DisplayName("doubled quote is an escaped quote")
        void doubledQuote() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT 'it''s; fine'");

            assertThat(tokens).hasSize(2);
            assertThat(tokens.get(1).text()).isEqualTo("'it''s; fine'");
        }

        @Test
        @DisplayName("double-quoted and backtick identifiers")
        void quotedIdentifiers() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT \"drop\", `Delete` FROM t");

            assertThat(tokens.get(1).type()).isEqualTo(SqlToken.Type.QUOTED_IDENTIFIER);
            assertThat(tokens.get(1).identifier()).isEqualTo("drop");
            assertThat(tokens.get(3).type()).isEqualTo(SqlToken.Type.QUOTED_IDENTIFIER);
            assertThat(tokens.get(3).identifier()).isEqualTo("Delete");
        }

        @Test
        @DisplayName("line and block comments become comment tokens")
        void comments() {
            assertThat(types("SELECT 1 -- note; DROP\n/* block ; */ FROM t")).containsExactly(
                    SqlToken.Type.WORD, SqlToken.Type.NUMBER, SqlToken.Type.LINE_COMMENT,
                    SqlToken.Type.BLOCK_COMMENT, SqlToken.Type.WORD, SqlToken.Type.WORD);
        }

        @Test
        @DisplayName("dollar-quoted strings hide their content")
        void dollarQuoted() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT $body$ x; y $body$");

            assertThat(tokens).hasSize(2);
            assertThat(tokens.get(1).type()).isEqualTo(SqlToken.Type.STRING);
        }
    }

    @Nested
    @DisplayName("Other token kinds")
    class Kinds {

        @Test
        @DisplayName("bind parameters in their common spellings")
        void parameters() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("a = ? AND b = :name AND c = $1 AND d::int");

            assertThat(tokens).filteredOn(t -> t.type() == SqlToken.Type.PARAMETER)
                    .extracting(SqlToken::text)
                    .containsExactly("?", ":name", "$1");
            assertThat(tokens).filteredOn(t -> t.type() == SqlToken.Type.OPERATOR)
                    .extracting(SqlToken::text)
                    .contains("::");
        }

        @Test
        @DisplayName("identifiers containing keywords stay one word")
        void wordBoundaries() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT dropdown_id, exec_count FROM t");

            assertThat(tokens).extracting(SqlToken::text)
                    .containsExactly("SELECT", "dropdown_id", ",", "exec_count", "FROM", "t");
        }

        @Test
        @DisplayName("tracks parenthesis depth")
        void depth() {
            List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT (SELECT 1)");

            assertThat(tokens.get(0).depth()).isZero();
            assertThat(tokens.get(2).depth()).isEqualTo(1);
            assertThat(tokens.get(4).depth()).isZero();
        }

        @Test
        @DisplayName("records offsets into the raw text")
        void offsets() {
            String sql = "  SELECT  x";
            SqlToken x = SqlTokenizer.tokenize(sql).get(1);

            assertThat(sql.substring(x.start(), x.end())).isEqualTo("x");
        }
    }

    @Nested
    @DisplayName("Ambiguous input")
    class Ambiguous {

        @Test
        void unterminatedString() {
            assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT 'abc FROM t"))
                    .isInstanceOf(ParseAmbiguousException.class)
                    .hasMessageContaining("unterminated string literal");
        }

        @Test
        void unterminatedIdentifier() {
            assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT \"abc FROM t"))
                    .isInstanceOf(ParseAmbiguousException.class)
                    .hasMessageContaining("unterminated quoted identifier");
        }

        @Test
        void unterminatedBlockComment() {
            assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT 1 /* ; DROP TABLE t"))
                    .isInstanceOf(ParseAmbiguousException.class)
                    .hasMessageContaining("unterminated block comment");
        }

        @Test
        void unbalancedParentheses() {
            assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT (1"))
                    .isInstanceOf(ParseAmbiguousException.class);
            assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT 1)"))
                    .isInstanceOf(ParseAmbiguousException.class);
        }
    }
}
