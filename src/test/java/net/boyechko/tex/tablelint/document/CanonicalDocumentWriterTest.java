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
package net.boyechko.tex.tablelint.document;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.Delimiters;
import net.boyechko.tex.tablelint.syntax.LatexWalker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CanonicalDocumentWriterTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CanonicalDocumentWriter writer = new CanonicalDocumentWriter(false);

    @Test
    void writesDocumentAsArrayOfRoots() throws Exception {
        List<Optional<CanonicalNode>> roots =
                CanonicalNode.slots(
                        new CanonicalNode.Comment(" header"), new CanonicalNode.Chars("text"));

        JsonNode json = MAPPER.readTree(writer.writeToString(roots));

        assertTrue(json.isArray());
        assertEquals(2, json.size());
        assertEquals("CommentNode", json.get(0).get("type").textValue());
        assertEquals(" header", json.get(0).get("text").textValue());
        assertEquals("text", json.get(1).textValue());
    }

    @Test
    void macroWritesNameAndArgumentsWithNullForAbsentSlots() throws Exception {
        CanonicalNode caption =
                new CanonicalNode.Macro(
                        "caption",
                        Arrays.asList(
                                Optional.empty(),
                                Optional.empty(),
                                Optional.of(
                                        new CanonicalNode.Group(
                                                Delimiters.of("{", "}"),
                                                CanonicalNode.slots(
                                                        new CanonicalNode.Chars("A table."))))));

        JsonNode json = MAPPER.readTree(writer.writeToString(CanonicalNode.slots(caption))).get(0);

        assertEquals("MacroNode", json.get("type").textValue());
        assertEquals("caption", json.get("macroname").textValue());
        JsonNode args = json.get("args");
        assertEquals(3, args.size());
        assertTrue(args.get(0).isNull());
        assertTrue(args.get(1).isNull());
        assertEquals("GroupNode", args.get(2).get("type").textValue());
        assertEquals("A table.", args.get(2).get("children").get(0).textValue());
    }

    @Test
    void groupWritesDelimitersAsPairAndOmitsEmptyArguments() throws Exception {
        CanonicalNode group =
                new CanonicalNode.Group(Delimiters.of("[", "]"), List.of());

        JsonNode json = MAPPER.readTree(writer.writeToString(CanonicalNode.slots(group))).get(0);

        assertEquals("[", json.get("delimiters").get(0).textValue());
        assertEquals("]", json.get("delimiters").get(1).textValue());
        assertFalse(json.has("args"));
        assertEquals(0, json.get("children").size());
    }

    @Test
    void groupWithArgumentsWritesThem() throws Exception {
        CanonicalNode group =
                new CanonicalNode.Group(
                        Delimiters.of("\\begin{table}", "\\end{table}"),
                        List.of(Optional.of(new CanonicalNode.Chars("[H]"))),
                        List.of());

        JsonNode json = MAPPER.readTree(writer.writeToString(CanonicalNode.slots(group))).get(0);

        assertEquals("[H]", json.get("args").get(0).textValue());
        assertEquals("\\begin{table}", json.get("delimiters").get(0).textValue());
    }

    @Test
    void writesRemainingVariants() throws Exception {
        List<Optional<CanonicalNode>> roots =
                CanonicalNode.slots(
                        new CanonicalNode.Environment(
                                "center",
                                List.of(),
                                CanonicalNode.slots(new CanonicalNode.Chars("x"))),
                        new CanonicalNode.Specials("&", List.of()),
                        new CanonicalNode.Math(CanonicalNode.slots(new CanonicalNode.Chars("y"))),
                        new CanonicalNode.Unknown("VerbatimNode"));

        JsonNode json = MAPPER.readTree(writer.writeToString(roots));

        assertEquals("EnvironmentNode", json.get(0).get("type").textValue());
        assertEquals("center", json.get(0).get("name").textValue());
        assertEquals(0, json.get(0).get("args").size());
        assertEquals("x", json.get(0).get("children").get(0).textValue());

        assertEquals("SpecialsNode", json.get(1).get("type").textValue());
        assertEquals("&", json.get(1).get("specials").textValue());
        assertTrue(json.get(1).get("args").isArray());

        assertEquals("MathNode", json.get(2).get("type").textValue());
        assertEquals("y", json.get(2).get("children").get(0).textValue());

        assertEquals("UnknownNode", json.get(3).get("type").textValue());
        assertEquals("VerbatimNode", json.get(3).get("label").textValue());
    }

    @Test
    void absentChildrenAndRootsAreWrittenAsNull() throws Exception {
        CanonicalNode group =
                new CanonicalNode.Group(
                        Delimiters.of("{", "}"),
                        Arrays.asList(Optional.of(new CanonicalNode.Chars("a")), Optional.empty()));

        JsonNode json =
                MAPPER.readTree(
                        writer.writeToString(Arrays.asList(Optional.of(group), Optional.empty())));

        assertEquals(2, json.size());
        assertTrue(json.get(1).isNull());
        JsonNode children = json.get(0).get("children");
        assertEquals(2, children.size());
        assertEquals("a", children.get(0).textValue());
        assertTrue(children.get(1).isNull());
    }

    @Test
    void writesTreesNestedToTheWalkerLimit() {
        CanonicalNode node = new CanonicalNode.Macro("relax", List.of());
        for (int i = 0; i < LatexWalker.MAX_NESTING; i++) {
            node = new CanonicalNode.Group(Delimiters.of("{", "}"), CanonicalNode.slots(node));
        }
        List<Optional<CanonicalNode>> roots = CanonicalNode.slots(node);

        String json = writer.writeToString(roots);

        assertTrue(json.startsWith("[{\"type\":\"GroupNode\""), json.substring(0, 40));
    }

    @Test
    void escapedTextIsWrittenAsIs() throws Exception {
        CanonicalNode chars = new CanonicalNode.Chars("line\\nbreak");

        JsonNode json = MAPPER.readTree(writer.writeToString(CanonicalNode.slots(chars)));

        assertEquals("line\\nbreak", json.get(0).textValue());
    }

    @Test
    void prettyOutputSpansLines() {
        String pretty =
                new CanonicalDocumentWriter(true)
                        .writeToString(CanonicalNode.slots(new CanonicalNode.Comment("x")));

        assertTrue(pretty.contains("\n"));
        assertFalse(
                writer.writeToString(CanonicalNode.slots(new CanonicalNode.Comment("x")))
                        .contains("\n"));
    }

    @Test
    void writesUtf8ToStreamWithoutClosingIt() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(CanonicalNode.slots(new CanonicalNode.Comment("für")), out);
        out.write('!');

        String written = out.toString(StandardCharsets.UTF_8);
        assertTrue(written.endsWith("]!"), written);
        assertTrue(written.contains("für"), written);
    }

    @Test
    void writesToFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("doc.json");

        writer.write(CanonicalNode.slots(new CanonicalNode.Chars("a")), file);

        assertEquals("[\"a\"]", Files.readString(file));
    }
}
