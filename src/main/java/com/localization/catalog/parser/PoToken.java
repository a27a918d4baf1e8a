package com.localization.catalog.parser;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A token from the PO tokenizer. Keyword tokens carry no value, string tokens
 * carry their unescaped contents, comment tokens carry the raw line.
 * {@code obsolete} is set for tokens read from a {@code #~} line.
 */
@Value
@AllArgsConstructor
public class PoToken {
    TokenType type;
    String value;
    int line;
    boolean obsolete;
    int pluralIndex;

    public enum TokenType {
        MSGCTXT("msgctxt"),
        MSGID("msgid"),
        MSGID_PLURAL("msgid_plural"),
        MSGSTR("msgstr"),
        MSGSTR_PLURAL("msgstr"),
        STRING(null),
        COMMENT(null);

        private final String keyword;

        TokenType(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }

        public boolean isKeyword() {
            return keyword != null;
        }
    }

    public static PoToken keyword(TokenType type, int line, boolean obsolete) {
        return new PoToken(type, type.getKeyword(), line, obsolete, -1);
    }

    public static PoToken pluralMsgstr(int index, int line, boolean obsolete) {
        return new PoToken(TokenType.MSGSTR_PLURAL, "msgstr[" + index + "]", line, obsolete, index);
    }

    public static PoToken string(String value, int line, boolean obsolete) {
        return new PoToken(TokenType.STRING, value, line, obsolete, -1);
    }

    public static PoToken comment(String raw, int line) {
        return new PoToken(TokenType.COMMENT, raw, line, false, -1);
    }

    /**
     * How the token reads in an error message.
     */
    public String literal() {
        if (type == TokenType.STRING) {
            return "\"" + PoEscapes.escape(value) + "\"";
        }
        return value;
    }
}
