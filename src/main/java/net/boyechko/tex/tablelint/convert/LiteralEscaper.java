/*
 * TeX-Table-Lint - LaTeX document tree normalization and table linting
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.tex.tablelint.convert;

/**
 * Backslash escaping for literal text stored in {@code Chars} nodes.
 *
 * <table>
 *   <caption>Escape sequences</caption>
 *   <tr><th>Character</th><th>Escaped as</th></tr>
 *   <tr><td>backslash, single quote, double quote</td><td>{@code \\ \' \"}</td></tr>
 *   <tr><td>line feed, carriage return, tab</td><td>{@code \n \r \t}</td></tr>
 *   <tr><td>other U+0000-U+001F and U+007F-U+009F</td><td>{@code \xhh}</td></tr>
 *   <tr><td>unpaired surrogate</td><td>backslash, {@code u}, four hex digits</td></tr>
 * </table>
 *
 * Every other character, including well-formed surrogate pairs, is kept as is. Hex digits are
 * written in lower case and accepted in either case. {@code unescape(escape(s))} equals {@code s}
 * for every string.
 */
public final class LiteralEscaper {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private LiteralEscaper() {}

    public static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 16);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || (c >= 0x7f && c <= 0x9f)) {
                        sb.append("\\x").append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
                    } else if (Character.isHighSurrogate(c)
                            && i + 1 < raw.length()
                            && Character.isLowSurrogate(raw.charAt(i + 1))) {
                        sb.append(c).append(raw.charAt(++i));
                    } else if (Character.isSurrogate(c)) {
                        sb.append("\\u");
                        for (int shift = 12; shift >= 0; shift -= 4) {
                            sb.append(HEX[(c >> shift) & 0xf]);
                        }
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escape}.
     *
     * @throws IllegalArgumentException if {@code escaped} holds a backslash sequence that
     *     {@link #escape} never produces
     */
    public static String unescape(String escaped) {
        StringBuilder sb = new StringBuilder(escaped.length());
        int i = 0;
        while (i < escaped.length()) {
            char c = escaped.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= escaped.length()) {
                throw new IllegalArgumentException("Trailing backslash at index " + i);
            }
            char kind = escaped.charAt(i + 1);
            switch (kind) {
                case '\\', '\'', '"' -> {
                    sb.append(kind);
                    i += 2;
                }
                case 'n' -> {
                    sb.append('\n');
                    i += 2;
                }
                case 'r' -> {
                    sb.append('\r');
                    i += 2;
                }
                case 't' -> {
                    sb.append('\t');
                    i += 2;
                }
                case 'x' -> {
                    sb.append((char) parseHex(escaped, i + 2, 2));
                    i += 4;
                }
                case 'u' -> {
                    sb.append((char) parseHex(escaped, i + 2, 4));
                    i += 6;
                }
                default ->
                        throw new IllegalArgumentException(
                                "Unknown escape '\\" + kind + "' at index " + i);
            }
        }
        return sb.toString();
    }

    private static int parseHex(String s, int start, int digits) {
        if (start + digits > s.length()) {
            throw new IllegalArgumentException("Truncated escape at index " + (start - 2));
        }
        int value = 0;
        for (int k = start; k < start + digits; k++) {
            int digit = Character.digit(s.charAt(k), 16);
            if (digit < 0) {
                throw new IllegalArgumentException(
                        "Invalid hex digit '" + s.charAt(k) + "' at index " + k);
            }
            value = (value << 4) | digit;
        }
        return value;
    }
}
