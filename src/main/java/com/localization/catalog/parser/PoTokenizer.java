package com.localization.catalog.parser;

import com.localization.catalog.parser.PoToken.TokenType;
import com.localization.catalog.parser.exception.LexException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for PO/POT catalog text.
 *
 * <p>Single forward pass. Whitespace and blank lines are skipped, comments are
 * kept as raw tokens, and {@code #~} marks the rest of its line as obsolete so
 * that obsolete entries tokenize like regular ones.
 */
public class PoTokenizer {
    private static final Logger log = LoggerFactory.getLogger(PoTokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("msgctxt", TokenType.MSGCTXT),
        Map.entry("msgid", TokenType.MSGID),
        Map.entry("msgid_plural", TokenType.MSGID_PLURAL),
        Map.entry("msgstr", TokenType.MSGSTR)
    );

    private final String source;
    private int pos = 0;
    private int line;
    private boolean obsoleteLine = false;

    public PoTokenizer(String source) {
        this(source, 1);
    }

    /**
     * @param firstLine line number of the first character, used when re-scanning
     *                  a fragment taken from a larger file
     */
    public PoTokenizer(String source, int firstLine) {
        this.source = source;
        this.line = firstLine;
    }

    /**
     * Tokenize the entire source.
     *
     * @throws LexException on the first malformed token
     */
    public List<PoToken> tokenize() {
        List<PoToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                pos++;
                obsoleteLine = false;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                readComment(tokens);
            } else if (c == '"') {
                tokens.add(readString());
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readKeyword());
            } else {
                throw new LexException(line, "unexpected character '" + c + "'");
            }
        }

        log.debug("Tokenized {} tokens over {} lines", tokens.size(), line);
        return tokens;
    }

    private void readComment(List<PoToken> tokens) {
        if (!obsoleteLine && pos + 1 < source.length() && source.charAt(pos + 1) == '~') {
            // "#~|" is the previous-msgid marker of an obsolete entry
            if (pos + 2 < source.length() && source.charAt(pos + 2) == '|') {
                String rest = restOfLine(pos + 3);
                tokens.add(PoToken.comment("#|" + rest, line));
                return;
            }
            pos += 2;
            obsoleteLine = true;
            return;
        }
        tokens.add(PoToken.comment(restOfLine(pos), line));
    }

    private String restOfLine(int start) {
        int end = source.indexOf('\n', start);
        if (end < 0) {
            end = source.length();
        }
        pos = end;
        String text = source.substring(start, end);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    private PoToken readKeyword() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String word = source.substring(start, pos);
        TokenType type = KEYWORDS.get(word);
        if (type == null) {
            throw new LexException(line, "unknown keyword '" + word + "'");
        }

        PoToken token;
        if (type == TokenType.MSGSTR && pos < source.length() && source.charAt(pos) == '[') {
            token = PoToken.pluralMsgstr(readPluralIndex(), line, obsoleteLine);
        } else {
            token = PoToken.keyword(type, line, obsoleteLine);
        }

        if (pos >= source.length() || !Character.isWhitespace(source.charAt(pos))) {
            throw new LexException(line, "no space after '" + token.getValue() + "'");
        }
        return token;
    }

    private int readPluralIndex() {
        pos++; // Skip '['
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos == start || pos >= source.length() || source.charAt(pos) != ']' || pos - start > 9) {
            throw new LexException(line, "invalid plural form index");
        }
        int index = Integer.parseInt(source.substring(start, pos));
        pos++; // Skip ']'
        return index;
    }

    private PoToken readString() {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote

        while (true) {
            if (pos >= source.length()) {
                throw new LexException(startLine, "missing string terminator");
            }
            char c = source.charAt(pos);

            if (c == '"') {
                pos++;
                return PoToken.string(sb.toString(), startLine, obsoleteLine);
            } else if (c == '\n') {
                throw new LexException(line, "newline in string");
            } else if (c == '\\') {
                if (pos + 1 >= source.length()) {
                    throw new LexException(startLine, "missing string terminator");
                }
                int unescaped = PoEscapes.unescape(source.charAt(pos + 1));
                if (unescaped < 0) {
                    throw new LexException(line, "unsupported escape code");
                }
                sb.append((char) unescaped);
                pos += 2;
            } else {
                sb.append(c);
                pos++;
            }
        }
    }
}
