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
package net.boyechko.tex.tablelint.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.convert.CanonicalTreeBuilder;
import net.boyechko.tex.tablelint.document.CanonicalDocumentReader;
import net.boyechko.tex.tablelint.document.CanonicalDocumentWriter;
import net.boyechko.tex.tablelint.issue.Issue;
import net.boyechko.tex.tablelint.issue.IssueList;
import net.boyechko.tex.tablelint.lint.TableLintEngine;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.CanonicalTrees;
import net.boyechko.tex.tablelint.syntax.ArgSpecs;
import net.boyechko.tex.tablelint.syntax.LatexParseException;
import net.boyechko.tex.tablelint.syntax.LatexWalker;
import net.boyechko.tex.tablelint.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Ties the walker, builder, codec and lint engine together for file-based processing. */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private final ArgSpecs argSpecs;
    private final CanonicalTreeBuilder builder;
    private final CanonicalDocumentWriter writer;
    private final CanonicalDocumentReader reader;
    private final TableLintEngine lintEngine;
    private final ProcessingListener listener;

    public static class ProcessingServiceBuilder {
        private ArgSpecs argSpecs;
        private TableLintEngine lintEngine;
        private ProcessingListener listener;
        private boolean prettyPrint = true;

        public ProcessingServiceBuilder withArgSpecs(ArgSpecs argSpecs) {
            this.argSpecs = argSpecs;
            return this;
        }

        public ProcessingServiceBuilder withLintEngine(TableLintEngine lintEngine) {
            this.lintEngine = lintEngine;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public ProcessingService build() {
            if (listener == null) {
                throw new IllegalStateException("listener is required");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder b) {
        this.argSpecs = b.argSpecs != null ? b.argSpecs : ArgSpecs.loadDefault();
        this.lintEngine = b.lintEngine != null ? b.lintEngine : new TableLintEngine();
        this.listener = b.listener;
        this.builder = new CanonicalTreeBuilder();
        this.writer = new CanonicalDocumentWriter(b.prettyPrint);
        this.reader = new CanonicalDocumentReader();
    }

    /** Parses {@code texFile} and writes its canonical tree as JSON to {@code jsonFile}. */
    public ConversionResult convert(Path texFile, Path jsonFile)
            throws IOException, LatexParseException {
        listener.onPhaseStart("Converting " + texFile.getFileName());
        List<Optional<CanonicalNode>> roots = parse(texFile);

        Path parent = jsonFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.write(roots, jsonFile);
        logger.info("Wrote canonical tree of {} to {}", texFile, jsonFile);

        listener.onSuccess("Processed " + texFile + " and saved result to " + jsonFile);
        return new ConversionResult(texFile, jsonFile, roots);
    }

    /** Parses {@code texFile} and renders its canonical tree as indented text. */
    public String dumpTree(Path texFile) throws IOException, LatexParseException {
        return CanonicalTrees.toIndentedTreeString(parse(texFile));
    }

    /** Lints every top-level node of a canonical JSON document; absent nodes fail the gate. */
    public List<TableLintResult> lint(Path jsonFile) throws IOException {
        listener.onPhaseStart("Linting " + jsonFile.getFileName());
        List<Optional<CanonicalNode>> roots = reader.read(jsonFile);
        logger.info("Linting {} top-level nodes from {}", roots.size(), jsonFile);

        List<TableLintResult> results = lint(roots);
        listener.onSummary(results);
        return results;
    }

    public List<TableLintResult> lint(List<Optional<CanonicalNode>> roots) {
        List<TableLintResult> results = new ArrayList<>(roots.size());
        for (int i = 0; i < roots.size(); i++) {
            IssueList issues = lintEngine.findIssues(roots.get(i).orElse(null));
            results.add(new TableLintResult(i, issues));
            if (issues.isEmpty()) {
                listener.onVerboseOutput("Node " + i + ": no table issues");
            } else {
                listener.onVerboseOutput("Node " + i + ": " + issues.size() + " issue(s)");
                for (Issue issue : issues) {
                    listener.onWarning(issue);
                }
            }
        }
        return results;
    }

    private List<Optional<CanonicalNode>> parse(Path texFile)
            throws IOException, LatexParseException {
        String source = Files.readString(texFile, StandardCharsets.UTF_8);
        List<SyntaxNode> nodes = new LatexWalker(source, argSpecs).getNodes();
        List<Optional<CanonicalNode>> roots = builder.convertRoot(nodes);
        listener.onVerboseOutput("Parsed " + roots.size() + " top-level nodes");
        return roots;
    }
}
