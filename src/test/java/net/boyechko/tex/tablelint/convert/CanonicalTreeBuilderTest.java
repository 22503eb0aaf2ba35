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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.Delimiters;
import net.boyechko.tex.tablelint.syntax.ArgumentList;
import net.boyechko.tex.tablelint.syntax.CharsNode;
import net.boyechko.tex.tablelint.syntax.CommentNode;
import net.boyechko.tex.tablelint.syntax.EnvironmentNode;
import net.boyechko.tex.tablelint.syntax.GroupNode;
import net.boyechko.tex.tablelint.syntax.MacroNode;
import net.boyechko.tex.tablelint.syntax.MathNode;
import net.boyechko.tex.tablelint.syntax.SpecialsNode;
import net.boyechko.tex.tablelint.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

class CanonicalTreeBuilderTest {
    private final CanonicalTreeBuilder builder = new CanonicalTreeBuilder();

    /** A node kind the builder has never heard of. */
    record VerbatimNode(String text, int pos, int len) implements SyntaxNode {}

    @Test
    void nullConvertsToAbsent() {
        assertEquals(Optional.empty(), builder.convert(null));
    }

    @Test
    void macroKeepsArgumentOrderAndAbsentSlots() {
        SyntaxNode caption =
                new MacroNode(
                        "caption",
                        ArgumentList.of(
                                null,
                                new GroupNode("[", "]", List.of(new CharsNode("short"))),
                                new GroupNode("{", "}", List.of(new CharsNode("A table.")))));

        CanonicalNode converted = builder.convert(caption).orElseThrow();

        CanonicalNode expected =
                new CanonicalNode.Macro(
                        "caption",
                        Arrays.asList(
                                Optional.empty(),
                                Optional.of(group("[", "]", new CanonicalNode.Chars("short"))),
                                Optional.of(group("{", "}", new CanonicalNode.Chars("A table.")))));
        assertEquals(expected, converted);
    }

    @Test
    void groupKeepsDelimitersEvenWhenMissing() {
        SyntaxNode unnamed = new GroupNode(null, "", List.of(new CharsNode("x")));

        CanonicalNode converted = builder.convert(unnamed).orElseThrow();

        assertEquals(group("", "", new CanonicalNode.Chars("x")), converted);
    }

    @Test
    void charsAreEscaped() {
        CanonicalNode converted = builder.convert(new CharsNode("a\n'b'")).orElseThrow();

        assertEquals(new CanonicalNode.Chars("a\\n\\'b\\'"), converted);
        assertEquals(
                "a\n'b'", LiteralEscaper.unescape(((CanonicalNode.Chars) converted).text()));
    }

    @Test
    void commentIsVerbatim() {
        CanonicalNode converted = builder.convert(new CommentNode(" it's \"raw\"")).orElseThrow();

        assertEquals(new CanonicalNode.Comment(" it's \"raw\""), converted);
    }

    @Test
    void environmentPutsArgumentsBeforeChildren() {
        SyntaxNode table =
                new EnvironmentNode(
                        "table",
                        ArgumentList.of(new GroupNode("[", "]", List.of(new CharsNode("H")))),
                        List.of(
                                new CharsNode("\n"),
                                new MacroNode("centering", ArgumentList.empty())));

        CanonicalNode converted = builder.convert(table).orElseThrow();

        assertEquals(
                new CanonicalNode.Environment(
                        "table",
                        CanonicalNode.slots(group("[", "]", new CanonicalNode.Chars("H"))),
                        CanonicalNode.slots(
                                new CanonicalNode.Chars("\\n"),
                                new CanonicalNode.Macro("centering", List.of()))),
                converted);
    }

    @Test
    void specialsWithoutDescriptorEqualSpecialsWithEmptyDescriptor() {
        CanonicalNode noDescriptor = builder.convert(new SpecialsNode("&")).orElseThrow();
        CanonicalNode emptyDescriptor =
                builder.convert(new SpecialsNode("&", ArgumentList.empty())).orElseThrow();

        assertEquals(new CanonicalNode.Specials("&", List.of()), noDescriptor);
        assertEquals(noDescriptor, emptyDescriptor);
    }

    @Test
    void specialsKeepTheirArguments() {
        SyntaxNode specials = new SpecialsNode("~", ArgumentList.of(new CharsNode("x")));

        CanonicalNode converted = builder.convert(specials).orElseThrow();

        assertEquals(
                new CanonicalNode.Specials("~", List.of(Optional.of(new CanonicalNode.Chars("x")))),
                converted);
    }

    @Test
    void mathKeepsOnlyChildren() {
        SyntaxNode math =
                new MathNode(
                        MathNode.DISPLAY,
                        "\\[",
                        "\\]",
                        List.of(new CharsNode("x"), new SpecialsNode("&")),
                        0,
                        0);

        CanonicalNode converted = builder.convert(math).orElseThrow();

        assertEquals(
                new CanonicalNode.Math(
                        CanonicalNode.slots(
                                new CanonicalNode.Chars("x"),
                                new CanonicalNode.Specials("&", List.of()))),
                converted);
    }

    @Test
    void unknownKindBecomesUnknownWithItsTypeName() {
        CanonicalNode converted =
                builder.convert(new VerbatimNode("\\verb|x|", 0, 8)).orElseThrow();

        assertEquals(new CanonicalNode.Unknown("VerbatimNode"), converted);
    }

    @Test
    void anonymousKindUsesItsFullClassName() {
        SyntaxNode anonymous =
                new SyntaxNode() {
                    @Override
                    public int pos() {
                        return 0;
                    }

                    @Override
                    public int len() {
                        return 0;
                    }
                };

        CanonicalNode converted = builder.convert(anonymous).orElseThrow();

        assertEquals(new CanonicalNode.Unknown(anonymous.getClass().getName()), converted);
    }

    @Test
    void unknownKindDeepInsideTreeDoesNotFailConversion() {
        SyntaxNode tree =
                new GroupNode(
                        "{",
                        "}",
                        List.of(
                                new MacroNode(
                                        "textbf",
                                        ArgumentList.of(new VerbatimNode("x", 0, 1)))));

        CanonicalNode converted = builder.convert(tree).orElseThrow();

        assertEquals(
                group(
                        "{",
                        "}",
                        new CanonicalNode.Macro(
                                "textbf",
                                List.of(Optional.of(new CanonicalNode.Unknown("VerbatimNode"))))),
                converted);
    }

    @Test
    void macroWithoutDescriptorIsMalformed() {
        SyntaxNode macro = new MacroNode("caption", null);

        var ex = assertThrows(MalformedSyntaxTreeException.class, () -> builder.convert(macro));
        assertTrue(ex.getMessage().contains("\\caption"), ex.getMessage());
    }

    @Test
    void environmentWithoutDescriptorIsMalformed() {
        SyntaxNode nested =
                new GroupNode("{", "}", List.of(new EnvironmentNode("table", null, List.of())));

        assertThrows(MalformedSyntaxTreeException.class, () -> builder.convert(nested));
    }

    @Test
    void nullChildBecomesAbsentSlot() {
        SyntaxNode group =
                new GroupNode(
                        "{", "}", Arrays.asList(new CharsNode("a"), null, new CharsNode("b")));

        CanonicalNode converted = builder.convert(group).orElseThrow();

        assertEquals(
                new CanonicalNode.Group(
                        Delimiters.of("{", "}"),
                        Arrays.asList(
                                Optional.of(new CanonicalNode.Chars("a")),
                                Optional.empty(),
                                Optional.of(new CanonicalNode.Chars("b")))),
                converted);
    }

    @Test
    void nullChildDeepInsideEnvironmentIsKept() {
        SyntaxNode table =
                new EnvironmentNode(
                        "table",
                        ArgumentList.empty(),
                        List.of(new MathNode(Arrays.asList((SyntaxNode) null))));

        CanonicalNode.Environment converted =
                (CanonicalNode.Environment) builder.convert(table).orElseThrow();

        CanonicalNode.Math math = (CanonicalNode.Math) converted.children().get(0).orElseThrow();
        assertEquals(List.of(Optional.empty()), math.children());
    }

    @Test
    void convertRootKeepsOrder() {
        List<SyntaxNode> roots =
                List.of(
                        new CommentNode("first"),
                        new CharsNode("second"),
                        new MacroNode("third", ArgumentList.empty()));

        List<Optional<CanonicalNode>> converted = builder.convertRoot(roots);

        assertEquals(
                CanonicalNode.slots(
                        new CanonicalNode.Comment("first"),
                        new CanonicalNode.Chars("second"),
                        new CanonicalNode.Macro("third", List.of())),
                converted);
        assertThrows(
                UnsupportedOperationException.class,
                () -> converted.add(Optional.of(new CanonicalNode.Comment("x"))));
    }

    @Test
    void convertRootMapsNullEntriesToAbsent() {
        List<SyntaxNode> roots = Arrays.asList(new CharsNode("a"), null);

        List<Optional<CanonicalNode>> converted = builder.convertRoot(roots);

        assertEquals(
                Arrays.asList(Optional.of(new CanonicalNode.Chars("a")), Optional.empty()),
                converted);
    }

    @Test
    void deeplyNestedInputDoesNotExhaustTheStack() {
        int depth = 100_000;
        SyntaxNode node = new CharsNode("leaf");
        for (int i = 0; i < depth; i++) {
            node = new GroupNode("{", "}", List.of(node));
        }

        CanonicalNode converted = builder.convert(node).orElseThrow();

        int seen = 0;
        CanonicalNode current = converted;
        while (current instanceof CanonicalNode.Group g) {
            seen++;
            current = g.children().get(0).orElseThrow();
        }
        assertEquals(depth, seen);
        assertEquals(new CanonicalNode.Chars("leaf"), current);
    }

    @Test
    void canonicalTreeDoesNotAliasSyntaxLists() {
        List<SyntaxNode> children = new ArrayList<>(List.of(new CharsNode("a")));
        SyntaxNode group = new GroupNode("{", "}", children);

        CanonicalNode converted = builder.convert(group).orElseThrow();
        children.add(new CharsNode("b"));

        assertEquals(1, ((CanonicalNode.Group) converted).children().size());
    }

    private static CanonicalNode group(String open, String close, CanonicalNode... children) {
        return new CanonicalNode.Group(
                Delimiters.of(open, close), CanonicalNode.slots(children));
    }
}
