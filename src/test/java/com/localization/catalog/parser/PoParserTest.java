package com.localization.catalog.parser;

import com.localization.catalog.model.Catalog;
import com.localization.catalog.model.Entry;
import com.localization.catalog.model.EntryKey;
import com.localization.catalog.model.PluralEntry;
import com.localization.catalog.model.Reference;
import com.localization.catalog.model.SingularEntry;
import com.localization.catalog.parser.exception.DuplicateEntryException;
import com.localization.catalog.parser.exception.LexException;
import com.localization.catalog.parser.exception.SyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PoParser.
 */
class PoParserTest {

    @Test
    void testParseSingularEntry() {
        Catalog catalog = parse("""
                msgid "hello"
                msgstr "ciao"
                """);

        assertThat(catalog.getEntries()).hasSize(1);
        SingularEntry entry = (SingularEntry) catalog.getEntries().get(0);
        assertThat(entry.getMsgid()).containsExactly("hello");
        assertThat(entry.getMsgstr()).containsExactly("ciao");
        assertThat(entry.getMsgctxt()).isNull();
        assertThat(entry.getLine()).isEqualTo(1);
        assertThat(entry.isObsolete()).isFalse();
        assertThat(catalog.getHeaders()).isEmpty();
    }

    @Test
    void testParsePluralEntry() {
        Catalog catalog = parse("""
                msgid "foo"
                msgid_plural "foos"
                msgstr[0] "bar"
                msgstr[1] "bars"
                """);

        PluralEntry entry = (PluralEntry) catalog.getEntries().get(0);
        assertThat(entry.msgidText()).isEqualTo("foo");
        assertThat(entry.msgidPluralText()).isEqualTo("foos");
        assertThat(entry.getMsgstr()).isEqualTo(Map.of(0, List.of("bar"), 1, List.of("bars")));
    }

    @Test
    void testMultiLineStringsKeepFragments() {
        Catalog catalog = parse("""
                msgid ""
                "Hello, "
                "world"
                msgstr "Ciao, "
                "mondo"
                """);

        SingularEntry entry = (SingularEntry) catalog.getEntries().get(0);
        assertThat(entry.getMsgid()).containsExactly("", "Hello, ", "world");
        assertThat(entry.msgidText()).isEqualTo("Hello, world");
        assertThat(entry.msgstrText()).isEqualTo("Ciao, mondo");
        // an empty first fragment with more text is not a header
        assertThat(catalog.getHeaders()).isEmpty();
    }

    @Test
    void testParseHeaderAndTopComments() {
        Catalog catalog = parse("""
                # Italian translations.
                #, fuzzy
                msgid ""
                msgstr ""
                "Language: it\\n"
                "Plural-Forms: nplurals=2; plural=(n != 1);\\n"
                "Broken line\\n"
                "X-Empty:\\n"

                msgid "a"
                msgstr "b"
                """);

        assertThat(catalog.getTopComments()).containsExactly("# Italian translations.", "#, fuzzy");
        assertThat(catalog.getHeaders()).containsExactly(
                entry("Language", "it"),
                entry("Plural-Forms", "nplurals=2; plural=(n != 1);"),
                entry("X-Empty", ""));
        assertThat(catalog.getEntries()).hasSize(1);
        assertThat(catalog.getEntries().get(0).getLine()).isEqualTo(10);
    }

    @Test
    void testCommentOnlyFileBecomesTopComments() {
        Catalog catalog = parse("""
                # just a comment
                #. and another
                """);

        assertThat(catalog.getTopComments()).containsExactly("# just a comment", "#. and another");
        assertThat(catalog.getEntries()).isEmpty();
    }

    @Test
    void testEmptyInput() {
        Catalog catalog = parse("\n\n");

        assertThat(catalog).isEqualTo(Catalog.empty());
    }

    @Test
    void testCommentClassification() {
        Catalog catalog = parse("""
                #  Translator note
                #. Extracted note
                #: lib/a.ex:1 lib/b.ex:22
                #: C:\\\\path with space\\\\c.ex:3 nolines
                #, fuzzy, elixir-format
                #, c-format  no-wrap
                msgid "x"
                msgstr "y"
                """);

        Entry entry = catalog.getEntries().get(0);
        assertThat(entry.getComments()).containsExactly("  Translator note");
        assertThat(entry.getExtractedComments()).containsExactly("Extracted note");
        assertThat(entry.getReferences()).containsExactly(
                Reference.of("lib/a.ex", 1),
                Reference.of("lib/b.ex", 22),
                Reference.of("C:\\\\path with space\\\\c.ex", 3),
                Reference.of("nolines"));
        assertThat(entry.getFlags()).containsExactly("c-format", "elixir-format", "fuzzy", "no-wrap");
        assertThat(entry.isFuzzy()).isTrue();
    }

    @Test
    void testReferenceWithColonInPath() {
        assertThat(PoParser.parseReferences("a:b:c.ex:10"))
                .containsExactly(Reference.of("a:b:c.ex", 10));
        assertThat(PoParser.parseReferences("  "))
                .isEmpty();
    }

    @Test
    void testFlagsDropBlankPieces() {
        assertThat(PoParser.parseFlags(" fuzzy,, ,format ")).containsExactly("fuzzy", "format");
    }

    @Test
    void testPreviousMessage() {
        Catalog catalog = parse("""
                #, fuzzy
                #| msgctxt "ctx"
                #| msgid "old "
                #| "text"
                msgid "new text"
                msgstr "testo"
                """);

        Entry entry = catalog.getEntries().get(0);
        assertThat(entry.getPreviousMessage()).isNotNull();
        assertThat(entry.getPreviousMessage().getMsgctxt()).containsExactly("ctx");
        assertThat(entry.getPreviousMessage().getMsgid()).containsExactly("old ", "text");
        assertThat(entry.getPreviousMessage().msgidText()).isEqualTo("old text");
        assertThat(entry.getPreviousMessage().getMsgidPlural()).isNull();
    }

    @Test
    void testPreviousMessageErrorReportsItsOwnLine() {
        assertThatThrownBy(() -> parse("""
                #, fuzzy
                #| msgid "old"
                # translator note
                #| msgid_plural "olds" "
                msgid "new"
                msgstr ""
                """))
                .isInstanceOf(LexException.class)
                .hasMessage("4: missing string terminator");
    }

    @Test
    void testPreviousMessageSplitByOtherComments() {
        Catalog catalog = parse("""
                #| msgid "old"
                #: lib/a.ex:1
                #| msgid_plural "olds"
                msgid "new"
                msgid_plural "news"
                msgstr[0] ""
                """);

        Entry entry = catalog.getEntries().get(0);
        assertThat(entry.getPreviousMessage().msgidText()).isEqualTo("old");
        assertThat(entry.getPreviousMessage().getMsgidPlural()).containsExactly("olds");
    }

    @Test
    void testReferencesWithSpacesAndLineLessPaths() {
        assertThat(PoParser.parseReferences("my dir/a.ex:3 b.ex:4 README NOTES"))
                .containsExactly(Reference.of("my dir/a.ex", 3), Reference.of("b.ex", 4),
                        Reference.of("README"), Reference.of("NOTES"));
        assertThat(PoParser.parseReferences(":12 a.ex:3"))
                .containsExactly(Reference.of(":12 a.ex", 3));
        assertThat(PoParser.parseReferences("a.ex:1234567890"))
                .containsExactly(Reference.of("a.ex:1234567890"));
    }

    @Test
    void testLongReferenceLineWithoutLineNumbers() {
        String body = "lib/file.ex ".repeat(5000).trim();

        assertThat(PoParser.parseReferences(body)).hasSize(5000)
                .allSatisfy(reference -> assertThat(reference.hasLine()).isFalse());
    }

    @Test
    void testContextIsPartOfKey() {
        Catalog catalog = parse("""
                msgctxt "menu"
                msgid "Open"
                msgstr "Apri"

                msgid "Open"
                msgstr "Aperto"
                """);

        assertThat(catalog.getEntries()).hasSize(2);
        assertThat(catalog.find(EntryKey.of("menu", "Open"))).isPresent();
        assertThat(catalog.find(EntryKey.of("Open")).map(Entry::getLine)).contains(5);
    }

    @Test
    void testObsoleteEntries() {
        Catalog catalog = parse("""
                msgid "a"
                msgstr "b"

                # kept comment
                #, fuzzy
                #~ msgid "a"
                #~ msgstr "old"
                """);

        assertThat(catalog.getEntries()).hasSize(2);
        Entry obsolete = catalog.getEntries().get(1);
        assertThat(obsolete.isObsolete()).isTrue();
        assertThat(obsolete.getComments()).containsExactly(" kept comment");
        assertThat(obsolete.isFuzzy()).isTrue();
        assertThat(((SingularEntry) obsolete).msgstrText()).isEqualTo("old");
        assertThat(catalog.activeEntries()).hasSize(1);
    }

    @Test
    void testDuplicateEntry() {
        DuplicateEntryException error = catchThrowableOfType(() -> parse("""
                msgid "a"
                msgstr ""

                msgid "a"
                msgstr ""
                """), DuplicateEntryException.class);

        assertThat(error.getLine()).isEqualTo(4);
        assertThat(error.getOriginalLine()).isEqualTo(1);
        assertThat(error).hasMessage("4: found duplicate on line 1 for msgid: 'a'");
    }

    @Test
    void testDuplicatePluralEntryMentionsPlural() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                msgstr ""

                msgid "a"
                msgid_plural "as"
                msgstr[0] ""
                """))
                .isInstanceOf(DuplicateEntryException.class)
                .hasMessage("4: found duplicate on line 1 for msgid: 'a' and msgid_plural: 'as'")
                .satisfies(e -> {
                    DuplicateEntryException error = (DuplicateEntryException) e;
                    assertThat(error.getMsgid()).isEqualTo("a");
                    assertThat(error.getMsgidPlural()).isEqualTo("as");
                    assertThat(error.getOriginalLine()).isEqualTo(1);
                });
    }

    @Test
    void testCommentBetweenMsgidAndMsgstr() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                # stray
                msgstr "b"
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("2: syntax error before: # stray");
    }

    @Test
    void testMsgctxtAfterMsgid() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                msgctxt "c"
                msgstr ""
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("2: syntax error before: msgctxt");
    }

    @Test
    void testUnexpectedEndOfInput() {
        assertThatThrownBy(() -> parse("msgid \"a\"\n"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("1: syntax error before: end of input");
    }

    @Test
    void testTrailingCommentsAreRejected() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                msgstr "b"
                # trailing
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("3: syntax error before: # trailing");
    }

    @Test
    void testDuplicatePluralForm() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                msgid_plural "as"
                msgstr[0] "x"
                msgstr[0] "y"
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("4: duplicate plural form 0");
    }

    @Test
    void testIndexedMsgstrWithoutPlural() {
        assertThatThrownBy(() -> parse("""
                msgid "a"
                msgstr "b"
                msgstr[0] "c"
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("3: syntax error before: msgstr[0]");
    }

    @Test
    void testMixedObsoleteEntryIsRejected() {
        assertThatThrownBy(() -> parse("""
                #~ msgid "a"
                msgstr "b"
                """))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("2: syntax error before: msgstr");
    }

    @Test
    void testStringWhereKeywordExpected() {
        assertThatThrownBy(() -> parse("\"a\"\n"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("1: syntax error before: \"a\"");
    }

    private Catalog parse(String source) {
        return PoParser.parseString(source);
    }
}
