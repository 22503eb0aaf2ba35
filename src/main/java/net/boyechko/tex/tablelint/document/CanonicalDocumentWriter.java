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

import static net.boyechko.tex.tablelint.document.DocumentFields.*;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.syntax.LatexWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a canonical tree as a JSON array, one value per root node.
 *
 * <p>Each node becomes an object with a {@code type} field plus its variant's fields, except
 * {@code Chars}, which becomes a bare string. Absent roots, arguments and children are written as
 * {@code null}. A {@code Group} writes {@code args} only when it has some, which never happens for
 * trees built from syntax nodes.
 *
 * <p>Output depth is capped at {@link #MAX_NESTING_DEPTH}, which fits every tree the walker can
 * produce. Deeper trees fail with an {@link IOException}.
 */
public class CanonicalDocumentWriter {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalDocumentWriter.class);

    /**
     * JSON nesting limit for documents. Each node level with arguments or children takes two JSON
     * levels (the object and its array), the walker allows {@link LatexWalker#MAX_NESTING} such
     * levels plus one argument-less macro below them, and the document array adds one more.
     */
    public static final int MAX_NESTING_DEPTH = 2 * (LatexWalker.MAX_NESTING + 2);

    private final JsonFactory factory;
    private final boolean pretty;

    public CanonicalDocumentWriter() {
        this(true);
    }

    public CanonicalDocumentWriter(boolean pretty) {
        this.factory =
                JsonFactory.builder()
                        .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                        .streamWriteConstraints(
                                StreamWriteConstraints.builder()
                                        .maxNestingDepth(MAX_NESTING_DEPTH)
                                        .build())
                        .build();
        this.pretty = pretty;
    }

    public void write(List<Optional<CanonicalNode>> roots, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(roots, out);
        }
        logger.debug("Wrote {} root nodes to {}", roots.size(), path);
    }

    public void write(List<Optional<CanonicalNode>> roots, OutputStream out) throws IOException {
        try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
            writeDocument(roots, gen);
        }
    }

    public void write(List<Optional<CanonicalNode>> roots, Writer out) throws IOException {
        try (JsonGenerator gen = factory.createGenerator(out)) {
            writeDocument(roots, gen);
        }
    }

    public String writeToString(List<Optional<CanonicalNode>> roots) {
        StringWriter out = new StringWriter();
        try {
            write(roots, out);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private void writeDocument(List<Optional<CanonicalNode>> roots, JsonGenerator gen)
            throws IOException {
        if (pretty) {
            gen.useDefaultPrettyPrinter();
        }
        gen.writeStartArray();
        for (Optional<CanonicalNode> root : roots) {
            writeSlot(root, gen);
        }
        gen.writeEndArray();
    }

    private void writeNode(CanonicalNode node, JsonGenerator gen) throws IOException {
        if (node instanceof CanonicalNode.Chars chars) {
            gen.writeString(chars.text());
            return;
        }

        gen.writeStartObject();
        gen.writeStringField(TYPE, node.typeLabel());
        if (node instanceof CanonicalNode.Macro macro) {
            gen.writeStringField(MACRONAME, macro.name());
            writeSlots(ARGS, macro.args(), gen);
        } else if (node instanceof CanonicalNode.Group group) {
            gen.writeArrayFieldStart(DELIMITERS);
            gen.writeString(group.delimiters().open());
            gen.writeString(group.delimiters().close());
            gen.writeEndArray();
            if (!group.args().isEmpty()) {
                writeSlots(ARGS, group.args(), gen);
            }
            writeSlots(CHILDREN, group.children(), gen);
        } else if (node instanceof CanonicalNode.Comment comment) {
            gen.writeStringField(TEXT, comment.text());
        } else if (node instanceof CanonicalNode.Environment env) {
            gen.writeStringField(NAME, env.name());
            writeSlots(ARGS, env.args(), gen);
            writeSlots(CHILDREN, env.children(), gen);
        } else if (node instanceof CanonicalNode.Specials specials) {
            gen.writeStringField(SPECIALS, specials.chars());
            writeSlots(ARGS, specials.args(), gen);
        } else if (node instanceof CanonicalNode.Math math) {
            writeSlots(CHILDREN, math.children(), gen);
        } else if (node instanceof CanonicalNode.Unknown unknown) {
            gen.writeStringField(LABEL, unknown.label());
        }
        gen.writeEndObject();
    }

    private void writeSlots(String field, List<Optional<CanonicalNode>> slots, JsonGenerator gen)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Optional<CanonicalNode> slot : slots) {
            writeSlot(slot, gen);
        }
        gen.writeEndArray();
    }

    private void writeSlot(Optional<CanonicalNode> slot, JsonGenerator gen) throws IOException {
        if (slot.isPresent()) {
            writeNode(slot.get(), gen);
        } else {
            gen.writeNull();
        }
    }
}
