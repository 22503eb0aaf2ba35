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
package net.boyechko.tex.tablelint.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.core.VerbosityLevel;
import net.boyechko.tex.tablelint.document.CanonicalDocumentWriter;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.Delimiters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TexTableLintCLITest {
    @TempDir Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return TexTableLintCLI.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path writeTex(String name, String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private Path writeJson(String name, List<Optional<CanonicalNode>> roots) throws Exception {
        Path json = tempDir.resolve(name);
        new CanonicalDocumentWriter().write(roots, json);
        return json;
    }

    @Test
    void defaultOutputReplacesTexSuffix() {
        assertEquals(
                Path.of("dir", "paper.json"),
                TexTableLintCLI.defaultOutputPath(Path.of("dir", "paper.tex")));
        assertEquals(
                Path.of("notes.txt.json"), TexTableLintCLI.defaultOutputPath(Path.of("notes.txt")));
    }

    @Test
    void parsesConversionArguments() throws Exception {
        Path tex = writeTex("paper.tex", "x");

        TexTableLintCLI.CLIConfig config =
                TexTableLintCLI.parseArguments(new String[] {"-v", tex.toString()});

        assertEquals(tex, config.inputPath());
        assertEquals(tempDir.resolve("paper.json"), config.outputPath());
        assertFalse(config.lintOnly());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @Test
    void parsesLintArgumentsWithProfile() throws Exception {
        Path json = writeJson("doc.json", List.of());
        Path profile = Files.writeString(tempDir.resolve("p.yaml"), "caption_macro: caption\n");

        TexTableLintCLI.CLIConfig config =
                TexTableLintCLI.parseArguments(
                        new String[] {"--lint", "--profile=" + profile, "-q", json.toString()});

        assertTrue(config.lintOnly());
        assertNull(config.outputPath());
        assertEquals(profile, config.profilePath());
        assertEquals(VerbosityLevel.QUIET, config.verbosity());
    }

    @Test
    void rejectsBadArguments() throws Exception {
        Path tex = writeTex("paper.tex", "x");

        assertThrows(
                TexTableLintCLI.CLIException.class,
                () ->
                        TexTableLintCLI.parseArguments(
                                new String[] {"--frobnicate", tex.toString()}));
        assertThrows(
                TexTableLintCLI.CLIException.class,
                () -> TexTableLintCLI.parseArguments(new String[] {"-l", "-t", tex.toString()}));
        assertThrows(
                TexTableLintCLI.CLIException.class,
                () ->
                        TexTableLintCLI.parseArguments(
                                new String[] {tempDir.resolve("missing.tex").toString()}));
        assertThrows(
                TexTableLintCLI.CLIException.class,
                () -> TexTableLintCLI.parseArguments(new String[] {"--profile"}));
        assertThrows(
                TexTableLintCLI.CLIException.class,
                () -> TexTableLintCLI.parseArguments(new String[0]));
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(TexTableLintCLI.EXIT_OK, run("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void convertWritesJsonAndSucceeds() throws Exception {
        Path tex = writeTex("paper.tex", "\\begin{table}[H]\\caption{x}\\end{table}\n");

        assertEquals(TexTableLintCLI.EXIT_OK, run(tex.toString()));

        assertTrue(Files.exists(tempDir.resolve("paper.json")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("saved result to"));
    }

    @Test
    void parseErrorExitsWithError() throws Exception {
        Path tex = writeTex("broken.tex", "}");

        assertEquals(TexTableLintCLI.EXIT_ERROR, run(tex.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot parse"));
    }

    @Test
    void lintWithWarningsExitsWithWarningStatus() throws Exception {
        Path json =
                writeJson(
                        "doc.json",
                        CanonicalNode.slots(
                                new CanonicalNode.Group(
                                        Delimiters.of("\\begin{table}", "\\end{table}"),
                                        List.of())));

        assertEquals(TexTableLintCLI.EXIT_WARNINGS, run("--lint", json.toString()));
        assertTrue(
                out.toString(StandardCharsets.UTF_8)
                        .contains("Table does not have a [H] positioning directive."));
        assertTrue(
                out.toString(StandardCharsets.UTF_8)
                        .contains("1 tables without a positioning directive"));
        assertBoxesClosed();
    }

    @Test
    void unreadableLintDocumentClosesItsBox() throws Exception {
        Path json = Files.writeString(tempDir.resolve("doc.json"), "[42]");

        assertEquals(TexTableLintCLI.EXIT_ERROR, run("--lint", json.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("┌─ Linting doc.json"));
        assertBoxesClosed();
    }

    @Test
    void verboseConversionClosesItsBox() throws Exception {
        Path tex = writeTex("paper.tex", "\\begin{table}[H]\\caption{x}\\end{table}\n");

        assertEquals(TexTableLintCLI.EXIT_OK, run("-v", tex.toString()));
        assertBoxesClosed();
    }

    private void assertBoxesClosed() {
        List<String> lines = out.toString(StandardCharsets.UTF_8).lines().toList();
        long opened = lines.stream().filter(l -> l.startsWith("┌")).count();
        long closed = lines.stream().filter(l -> l.startsWith("└")).count();
        assertEquals(opened, closed, String.join("\n", lines));
        assertTrue(lines.get(lines.size() - 1).startsWith("└"), String.join("\n", lines));
    }

    @Test
    void lintOfCleanDocumentSucceeds() throws Exception {
        Path json = writeJson("doc.json", List.of());

        assertEquals(TexTableLintCLI.EXIT_OK, run("-l", json.toString()));
    }

    @Test
    void dumpTreePrintsTree() throws Exception {
        Path tex = writeTex("paper.tex", "\\label{t}");

        assertEquals(TexTableLintCLI.EXIT_OK, run("--dump-tree", tex.toString()));
        assertEquals("\\label\n--({, })\n----t\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void invalidProfileExitsWithError() throws Exception {
        Path json = writeJson("doc.json", List.of());
        Path profile = Files.writeString(tempDir.resolve("p.yaml"), "caption_macro: ''\n");

        assertEquals(
                TexTableLintCLI.EXIT_ERROR,
                run("--lint", "--profile", profile.toString(), json.toString()));
    }
}
