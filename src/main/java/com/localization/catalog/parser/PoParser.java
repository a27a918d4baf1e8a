package com.localization.catalog.parser;

import com.localization.catalog.model.Catalog;
import com.localization.catalog.model.CommentKind;
import com.localization.catalog.model.Entry;
import com.localization.catalog.model.EntryKey;
import com.localization.catalog.model.PluralEntry;
import com.localization.catalog.model.PreviousMessage;
import com.localization.catalog.model.Reference;
import com.localization.catalog.model.SingularEntry;
import com.localization.catalog.parser.PoToken.TokenType;
import com.localization.catalog.parser.exception.DuplicateEntryException;
import com.localization.catalog.parser.exception.SyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for PO/POT catalogs.
 * Converts tokens into an immutable {@link Catalog}.
 *
 * Grammar:
 * <pre>
 * catalog := entry*
 * entry   := comment* msgctxt? msgid (msgid_plural msgstr[N]+ | msgstr)
 * </pre>
 * Each keyword is followed by one or more strings that are concatenated.
 * The first entry with an empty msgid and no context is the header.
 */
public class PoParser {
    private static final Logger log = LoggerFactory.getLogger(PoParser.class);

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern LINE_SUFFIX = Pattern.compile(":(\\d{1,9})$");

    private final List<PoToken> tokens;
    private int pos = 0;

    public PoParser(List<PoToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses catalog text in one step.
     */
    public static Catalog parseString(String text) {
        return new PoParser(new PoTokenizer(text).tokenize()).parse();
    }

    public Catalog parse() {
        Catalog.CatalogBuilder catalog = Catalog.builder();
        Map<EntryKey, Entry> activeByKey = new HashMap<>();
        boolean first = true;

        while (!isAtEnd()) {
            List<PoToken> comments = collectComments();

            if (isAtEnd()) {
                if (!first) {
                    throw SyntaxException.before(comments.get(0).getLine(), comments.get(0).literal());
                }
                comments.forEach(comment -> catalog.topComment(comment.getValue()));
                break;
            }

            Entry entry = parseEntry(comments);

            if (first && entry.isHeaderCandidate()) {
                comments.forEach(comment -> catalog.topComment(comment.getValue()));
                parseHeaders(((SingularEntry) entry).msgstrText(), entry.getLine()).forEach(catalog::header);
                first = false;
                continue;
            }
            first = false;

            if (!entry.isObsolete()) {
                Entry original = activeByKey.putIfAbsent(entry.key(), entry);
                if (original != null) {
                    String plural = entry instanceof PluralEntry pluralEntry ? pluralEntry.msgidPluralText() : null;
                    throw new DuplicateEntryException(entry.getLine(), original.getLine(), entry.msgidText(), plural);
                }
            }
            catalog.entry(entry);
        }

        Catalog result = catalog.build();
        log.debug("Parsed catalog with {} headers and {} entries",
                result.getHeaders().size(), result.getEntries().size());
        return result;
    }

    private List<PoToken> collectComments() {
        List<PoToken> comments = new ArrayList<>();
        while (check(TokenType.COMMENT)) {
            comments.add(advance());
        }
        return comments;
    }

    private Entry parseEntry(List<PoToken> comments) {
        boolean obsolete = peek().isObsolete();

        List<String> msgctxt = null;
        if (check(TokenType.MSGCTXT)) {
            advance();
            msgctxt = parseStrings(obsolete);
        }

        PoToken msgidToken = expect(TokenType.MSGID, obsolete);
        List<String> msgid = parseStrings(obsolete);

        EntryComments parsed = classifyComments(comments);

        if (check(TokenType.MSGID_PLURAL)) {
            expect(TokenType.MSGID_PLURAL, obsolete);
            List<String> msgidPlural = parseStrings(obsolete);
            Map<Integer, List<String>> forms = parsePluralForms(obsolete);
            return PluralEntry.builder()
                    .msgctxt(msgctxt)
                    .msgid(msgid)
                    .msgidPlural(msgidPlural)
                    .msgstr(forms)
                    .comments(parsed.translator)
                    .extractedComments(parsed.extracted)
                    .references(parsed.references)
                    .flags(parsed.flags)
                    .previousMessage(parsed.previous)
                    .obsolete(obsolete)
                    .line(msgidToken.getLine())
                    .build();
        }

        expect(TokenType.MSGSTR, obsolete);
        List<String> msgstr = parseStrings(obsolete);
        return SingularEntry.builder()
                .msgctxt(msgctxt)
                .msgid(msgid)
                .msgstr(msgstr)
                .comments(parsed.translator)
                .extractedComments(parsed.extracted)
                .references(parsed.references)
                .flags(parsed.flags)
                .previousMessage(parsed.previous)
                .obsolete(obsolete)
                .line(msgidToken.getLine())
                .build();
    }

    private Map<Integer, List<String>> parsePluralForms(boolean obsolete) {
        Map<Integer, List<String>> forms = new LinkedHashMap<>();
        do {
            PoToken marker = expect(TokenType.MSGSTR_PLURAL, obsolete);
            if (forms.containsKey(marker.getPluralIndex())) {
                throw new SyntaxException(marker.getLine(), "duplicate plural form " + marker.getPluralIndex());
            }
            forms.put(marker.getPluralIndex(), parseStrings(obsolete));
        } while (check(TokenType.MSGSTR_PLURAL));
        return forms;
    }

    private List<String> parseStrings(boolean obsolete) {
        List<String> fragments = new ArrayList<>();
        fragments.add(expect(TokenType.STRING, obsolete).getValue());
        while (check(TokenType.STRING)) {
            fragments.add(expect(TokenType.STRING, obsolete).getValue());
        }
        return fragments;
    }

    private Map<String, String> parseHeaders(String text, int line) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String headerLine : text.split("\n")) {
            if (headerLine.isBlank()) {
                continue;
            }
            int colon = headerLine.indexOf(':');
            if (colon < 0) {
                log.warn("Skipping malformed header line in entry at line {}: '{}'", line, headerLine);
                continue;
            }
            headers.put(headerLine.substring(0, colon).trim(), headerLine.substring(colon + 1).trim());
        }
        return headers;
    }

    private EntryComments classifyComments(List<PoToken> comments) {
        EntryComments result = new EntryComments();
        List<PoToken> previousTokens = new ArrayList<>();

        for (PoToken comment : comments) {
            String raw = comment.getValue();
            CommentKind kind = CommentKind.of(raw);
            String body = kind.body(raw);
            switch (kind) {
                case REFERENCE -> result.references.addAll(parseReferences(body));
                case EXTRACTED -> result.extracted.add(body);
                case FLAG -> result.flags.addAll(parseFlags(body));
                case PREVIOUS -> previousTokens.addAll(new PoTokenizer(body, comment.getLine()).tokenize());
                case TRANSLATOR -> result.translator.add(body);
            }
        }

        if (!previousTokens.isEmpty()) {
            result.previous = new PoParser(previousTokens).parsePreviousBlock();
        }
        return result;
    }

    /**
     * Splits a {@code #:} body into references. A path runs up to the next word
     * ending in {@code :digits}, so paths may contain colons and spaces. Words
     * after the last such group are references without a line.
     */
    static List<Reference> parseReferences(String body) {
        List<Reference> references = new ArrayList<>();
        Matcher word = WORD.matcher(body);
        int start = -1;
        int end = 0;
        while (word.find()) {
            if (start < 0) {
                start = word.start();
            }
            Matcher suffix = LINE_SUFFIX.matcher(word.group());
            if (suffix.find() && word.start() + suffix.start() > start) {
                String path = body.substring(start, word.start() + suffix.start());
                references.add(Reference.of(path, Integer.parseInt(suffix.group(1))));
                start = -1;
                end = word.end();
            }
        }
        String rest = body.substring(end).trim();
        if (!rest.isEmpty()) {
            for (String path : rest.split("\\s+")) {
                references.add(Reference.of(path));
            }
        }
        return references;
    }

    static List<String> parseFlags(String body) {
        List<String> flags = new ArrayList<>();
        for (String part : body.split(",")) {
            for (String flag : part.trim().split("\\s+")) {
                if (!flag.isEmpty()) {
                    flags.add(flag);
                }
            }
        }
        return flags;
    }

    /**
     * Parses the tokens of {@code #|} lines as {@code msgctxt? msgid msgid_plural?}.
     * Each line is scanned on its own so errors report its line.
     */
    private PreviousMessage parsePreviousBlock() {
        PreviousMessage.PreviousMessageBuilder previous = PreviousMessage.builder();
        if (check(TokenType.MSGCTXT)) {
            advance();
            previous.msgctxt(parseStrings(false));
        }
        expect(TokenType.MSGID, false);
        previous.msgid(parseStrings(false));
        if (check(TokenType.MSGID_PLURAL)) {
            advance();
            previous.msgidPlural(parseStrings(false));
        }
        if (!isAtEnd()) {
            throw SyntaxException.before(peek().getLine(), peek().literal());
        }
        return previous.build();
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private PoToken peek() {
        return tokens.get(pos);
    }

    private PoToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private PoToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private PoToken expect(TokenType type, boolean obsolete) {
        if (isAtEnd()) {
            int line = tokens.isEmpty() ? 1 : previous().getLine();
            throw SyntaxException.before(line, "end of input");
        }
        PoToken token = peek();
        if (token.getType() != type || token.isObsolete() != obsolete) {
            throw SyntaxException.before(token.getLine(), token.literal());
        }
        return advance();
    }

    private static final class EntryComments {
        private final List<String> translator = new ArrayList<>();
        private final List<String> extracted = new ArrayList<>();
        private final List<Reference> references = new ArrayList<>();
        private final TreeSet<String> flags = new TreeSet<>();
        private PreviousMessage previous;
    }
}
