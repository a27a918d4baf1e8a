package com.localization.catalog.parser;

import com.localization.catalog.parser.PoToken.TokenType;
import com.localization.catalog.parser.exception.LexException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PoTokenizer.
 */
class PoTokenizerTest {

    @Test
    void testTokenizeSimpleEntry() {
        List<PoToken> tokens = tokenize("""
                msgid "hello"
                msgstr "ciao"
                """);

        assertThat(tokens).extracting(PoToken::getType)
                .containsExactly(TokenType.MSGID, TokenType.STRING, TokenType.MSGSTR, TokenType.STRING);
        assertThat(tokens.get(1).getValue()).isEqualTo("hello");
        assertThat(tokens.get(1).getLine()).isEqualTo(1);
        assertThat(tokens.get(3).getValue()).isEqualTo("ciao");
        assertThat(tokens.get(3).getLine()).isEqualTo(2);
    }

    @Test
    void testTokenizePluralIndex() {
        List<PoToken> tokens = tokenize("""
                msgid "file"
                msgid_plural "files"
                msgstr[0] "fichier"
                msgstr[12] "fichiers"
                """);

        assertThat(tokens).extracting(PoToken::getType).containsExactly(
                TokenType.MSGID, TokenType.STRING,
                TokenType.MSGID_PLURAL, TokenType.STRING,
                TokenType.MSGSTR_PLURAL, TokenType.STRING,
                TokenType.MSGSTR_PLURAL, TokenType.STRING);
        assertThat(tokens.get(4).getPluralIndex()).isEqualTo(0);
        assertThat(tokens.get(6).getPluralIndex()).isEqualTo(12);
        assertThat(tokens.get(6).literal()).isEqualTo("msgstr[12]");
    }

    @Test
    void testEscapesAreDecoded() {
        List<PoToken> tokens = tokenize("msgid \"a\\nb\\tc\\\\d\\\"e\"\n");

        assertThat(tokens.get(1).getValue()).isEqualTo("a\nb\tc\\d\"e");
    }

    @Test
    void testCommentsAreKeptRaw() {
        List<PoToken> tokens = tokenize("""
                # translator note
                #: lib/app.ex:12
                #, fuzzy
                msgid "x"
                msgstr ""
                """);

        assertThat(tokens.subList(0, 3)).extracting(PoToken::getType).containsOnly(TokenType.COMMENT);
        assertThat(tokens.subList(0, 3)).extracting(PoToken::getValue)
                .containsExactly("# translator note", "#: lib/app.ex:12", "#, fuzzy");
        assertThat(tokens.get(2).getLine()).isEqualTo(3);
    }

    @Test
    void testObsoleteLinesAreFlagged() {
        List<PoToken> tokens = tokenize("""
                #~ msgid "old"
                #~ msgstr "vecchio"
                msgid "new"
                """);

        assertThat(tokens.subList(0, 4)).allMatch(PoToken::isObsolete);
        assertThat(tokens.get(4).isObsolete()).isFalse();
    }

    @Test
    void testBlankLinesAndCarriageReturnsAreIgnored() {
        List<PoToken> tokens = tokenize("msgid \"a\"\r\n\r\n\r\nmsgstr \"b\"\r\n");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(2).getLine()).isEqualTo(4);
    }

    static Stream<Arguments> lexErrors() {
        return Stream.of(
                Arguments.of("msgid\"foo\"", "1: no space after 'msgid'"),
                Arguments.of("msgstr[0]\"x\"", "1: no space after 'msgstr[0]'"),
                Arguments.of("msgid", "1: no space after 'msgid'"),
                Arguments.of("msgfoo \"x\"", "1: unknown keyword 'msgfoo'"),
                Arguments.of("msgstr[x] \"y\"", "1: invalid plural form index"),
                Arguments.of("msgstr[1 \"y\"", "1: invalid plural form index"),
                Arguments.of("msgid \"a\\q\"", "1: unsupported escape code"),
                Arguments.of("msgid \"abc", "1: missing string terminator"),
                Arguments.of("\nmsgid \"abc\\", "2: missing string terminator"),
                Arguments.of("@", "1: unexpected character '@'"));
    }

    @ParameterizedTest
    @MethodSource("lexErrors")
    void testLexErrors(String input, String message) {
        assertThatThrownBy(() -> tokenize(input))
                .isInstanceOf(LexException.class)
                .hasMessage(message);
    }

    @Test
    void testNewlineInString() {
        assertThatThrownBy(() -> tokenize("msgid \"ab\nc\"\n"))
                .isInstanceOf(LexException.class)
                .hasMessage("1: newline in string");
    }

    @Test
    void testErrorLineIsReported() {
        LexException error = catchThrowableOfType(
                () -> tokenize("msgid \"a\"\nmsgstr \"b\"\n\nmsgid \"\\x\"\n"), LexException.class);

        assertThat(error.getLine()).isEqualTo(4);
        assertThat(error.getReason()).isEqualTo("unsupported escape code");
    }

    private List<PoToken> tokenize(String source) {
        return new PoTokenizer(source).tokenize();
    }
}
