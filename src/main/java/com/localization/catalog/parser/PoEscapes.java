package com.localization.catalog.parser;

import lombok.experimental.UtilityClass;

/**
 * The escape sequences accepted inside quoted catalog strings.
 */
@UtilityClass
public class PoEscapes {

    /**
     * Character an escape letter stands for, or {@code -1} for an unsupported code.
     */
    public int unescape(char code) {
        return switch (code) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case '"' -> '"';
            case '\\' -> '\\';
            default -> -1;
        };
    }

    public String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
