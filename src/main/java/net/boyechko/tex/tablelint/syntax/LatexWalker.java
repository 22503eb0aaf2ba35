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
package net.boyechko.tex.tablelint.syntax;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal LaTeX reader producing a {@link SyntaxNode} tree.
 *
 * <p>It understands comments, macros with the argument signatures of an {@link ArgSpecs} table,
 * brace groups, {@code \begin}/{@code \end} environments, inline and display math, and the
 * specials {@code & ~ -- --- `` ''}. Everything else is read as literal characters. A walker
 * instance is single-use and not thread-safe.
 */
public class LatexWalker {
    private static final Logger logger = LoggerFactory.getLogger(LatexWalker.class);

    /** Nesting limit for groups, environments, math, bracket arguments and argument lists. */
    public static final int MAX_NESTING = 1000;

    private static final String[] SPECIALS = {"---", "--", "``", "''", "&", "~"};
    private static final String END_MARKER = "\\end";

    private final String source;
    private final ArgSpecs specs;
    private int pos;
    private int depth;

    public LatexWalker(String source) {
        this(source, ArgSpecs.loadDefault());
    }

    public LatexWalker(String source, ArgSpecs specs) {
        this.source = source;
        this.specs = specs;
    }

    /** Parses the whole source and returns its top-level nodes. */
    public List<SyntaxNode> getNodes() throws LatexParseException {
        pos = 0;
        depth = 0;
        List<SyntaxNode> nodes = readNodes(null);
        logger.debug("Parsed {} top-level nodes from {} characters", nodes.size(), source.length());
        return nodes;
    }

    /**
     * Reads nodes until {@code closer} is next in the input, without consuming it. A {@code null}
     * closer reads to the end of input.
     */
    private List<SyntaxNode> readNodes(String closer) throws LatexParseException {
        List<SyntaxNode> nodes = new ArrayList<>();
        while (pos < source.length()) {
            if (closer != null && atCloser(closer)) {
                return nodes;
            }
            char c = source.charAt(pos);
            if (c == '%') {
                nodes.add(readComment());
            } else if (c == '\\') {
                nodes.add(readBackslash());
            } else if (c == '{') {
                nodes.add(readGroup());
            } else if (c == '}') {
                throw new LatexParseException("Unmatched '}'", pos);
            } else if (c == '$') {
                nodes.add(readDollarMath());
            } else if (specialAt(pos) != null) {
                String specials = specialAt(pos);
                nodes.add(new SpecialsNode(specials, null, pos, specials.length()));
                pos += specials.length();
            } else {
                nodes.add(readChars(closer));
            }
        }
        if (closer != null) {
            throw new LatexParseException("Expected '" + closer + "' before end of input", pos);
        }
        return nodes;
    }

    private boolean atCloser(String closer) {
        if (END_MARKER.equals(closer)) {
            return atEnd();
        }
        return source.startsWith(closer, pos);
    }

    private boolean atEnd() {
        int after = pos + END_MARKER.length();
        return source.startsWith(END_MARKER, pos)
                && (after >= source.length() || !Character.isLetter(source.charAt(after)));
    }

    private CommentNode readComment() {
        int start = pos;
        int eol = source.indexOf('\n', pos);
        int textEnd = eol < 0 ? source.length() : eol;
        String comment = source.substring(pos + 1, textEnd);
        pos = eol < 0 ? source.length() : eol + 1;
        return new CommentNode(comment, start, pos - start);
    }

    private SyntaxNode readBackslash() throws LatexParseException {
        if (atEnd()) {
            throw new LatexParseException("Unexpected \\end", pos);
        }
        if (source.startsWith("\\(", pos)) {
            return readMath(MathNode.INLINE, "\\(", "\\)");
        }
        if (source.startsWith("\\[", pos)) {
            return readMath(MathNode.DISPLAY, "\\[", "\\]");
        }
        if (source.startsWith("\\)", pos) || source.startsWith("\\]", pos)) {
            String closer = source.substring(pos, pos + 2);
            throw new LatexParseException("Unmatched '" + closer + "'", pos);
        }
        return readMacro();
    }

    private SyntaxNode readMacro() throws LatexParseException {
        int start = pos;
        pos++;
        if (pos >= source.length()) {
            throw new LatexParseException("Dangling backslash", start);
        }

        String name;
        if (Character.isLetter(source.charAt(pos))) {
            int nameStart = pos;
            while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
                pos++;
            }
            name = source.substring(nameStart, pos);
            skipSpaces();
        } else {
            name = String.valueOf(source.charAt(pos));
            pos++;
        }

        if ("begin".equals(name)) {
            return readEnvironment(start);
        }
        String spec = specs.forMacro(name);
        if (spec.isEmpty()) {
            return new MacroNode(name, ArgumentList.empty(), start, pos - start);
        }
        // arguments may themselves be macros with arguments
        enter(start);
        ArgumentList args = readArguments(spec);
        leave();
        return new MacroNode(name, args, start, pos - start);
    }

    private EnvironmentNode readEnvironment(int start) throws LatexParseException {
        String name = readEnvironmentName("\\begin");
        enter(start);
        ArgumentList args = readArguments(specs.forEnvironment(name));
        List<SyntaxNode> children = readNodes(END_MARKER);

        int endPos = pos;
        pos += END_MARKER.length();
        skipSpaces();
        String endName = readEnvironmentName("\\end");
        if (!name.equals(endName)) {
            throw new LatexParseException(
                    "\\end{" + endName + "} does not match \\begin{" + name + "}", endPos);
        }
        leave();
        return new EnvironmentNode(name, args, children, start, pos - start);
    }

    private String readEnvironmentName(String command) throws LatexParseException {
        skipWhitespace();
        if (pos >= source.length() || source.charAt(pos) != '{') {
            throw new LatexParseException("Expected '{' after " + command, pos);
        }
        int close = source.indexOf('}', pos);
        if (close < 0) {
            throw new LatexParseException("Unterminated environment name after " + command, pos);
        }
        String name = source.substring(pos + 1, close).trim();
        pos = close + 1;
        return name;
    }

    private ArgumentList readArguments(String spec) throws LatexParseException {
        if (spec.isEmpty()) {
            return ArgumentList.empty();
        }
        List<SyntaxNode> args = new ArrayList<>(spec.length());
        for (char marker : spec.toCharArray()) {
            switch (marker) {
                case '*' -> args.add(readStar());
                case '[' -> args.add(readOptionalArgument());
                case '{' -> args.add(readMandatoryArgument());
                default -> throw new IllegalStateException("Unknown argument marker " + marker);
            }
        }
        return new ArgumentList(args);
    }

    private SyntaxNode readStar() {
        if (pos < source.length() && source.charAt(pos) == '*') {
            pos++;
            return new CharsNode("*", pos - 1, 1);
        }
        return null;
    }

    private SyntaxNode readOptionalArgument() throws LatexParseException {
        int saved = pos;
        skipWhitespace();
        if (pos >= source.length() || source.charAt(pos) != '[') {
            pos = saved;
            return null;
        }
        int start = pos;
        pos++;
        enter(start);
        List<SyntaxNode> content = readNodes("]");
        pos++;
        leave();
        return new GroupNode("[", "]", content, start, pos - start);
    }

    private SyntaxNode readMandatoryArgument() throws LatexParseException {
        skipWhitespace();
        if (pos >= source.length()) {
            throw new LatexParseException("Missing mandatory argument", pos);
        }
        char c = source.charAt(pos);
        if (c == '{') {
            return readGroup();
        } else if (c == '\\') {
            return readMacro();
        } else if (c == '}' || c == '%') {
            throw new LatexParseException("Missing mandatory argument", pos);
        }
        pos++;
        return new CharsNode(String.valueOf(c), pos - 1, 1);
    }

    private GroupNode readGroup() throws LatexParseException {
        int start = pos;
        pos++;
        enter(start);
        List<SyntaxNode> children = readNodes("}");
        pos++;
        leave();
        return new GroupNode("{", "}", children, start, pos - start);
    }

    private MathNode readDollarMath() throws LatexParseException {
        if (source.startsWith("$$", pos)) {
            return readMath(MathNode.DISPLAY, "$$", "$$");
        }
        return readMath(MathNode.INLINE, "$", "$");
    }

    private MathNode readMath(String displayType, String open, String close)
            throws LatexParseException {
        int start = pos;
        pos += open.length();
        enter(start);
        List<SyntaxNode> children = readNodes(close);
        pos += close.length();
        leave();
        return new MathNode(displayType, open, close, children, start, pos - start);
    }

    private CharsNode readChars(String closer) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if ("%\\{}$".indexOf(c) >= 0 || specialAt(pos) != null) {
                break;
            }
            if (closer != null && pos > start && atCloser(closer)) {
                break;
            }
            pos++;
        }
        return new CharsNode(source.substring(start, pos), start, pos - start);
    }

    private String specialAt(int at) {
        for (String specials : SPECIALS) {
            if (source.startsWith(specials, at)) {
                return specials;
            }
        }
        return null;
    }

    private void skipSpaces() {
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private void enter(int start) throws LatexParseException {
        if (++depth > MAX_NESTING) {
            throw new LatexParseException("Nesting deeper than " + MAX_NESTING + " levels", start);
        }
    }

    private void leave() {
        depth--;
    }
}
