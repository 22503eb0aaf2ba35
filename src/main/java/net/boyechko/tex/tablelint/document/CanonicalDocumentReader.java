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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.Delimiters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes JSON written by {@link CanonicalDocumentWriter} back into canonical nodes.
 *
 * <p>The top level may be an array of nodes or a single node. Records whose {@code type} is not
 * recognized decode to {@link CanonicalNode.Unknown} labelled with that type. A {@code Group} may
 * carry an {@code args} array, which is how hand-written documents describe a table's placement
 * argument. A {@code null} root, argument or child decodes to an absent slot. Input nesting is
 * limited to {@link CanonicalDocumentWriter#MAX_NESTING_DEPTH}, so anything the writer produces
 * can be read back.
 */
public class CanonicalDocumentReader {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalDocumentReader.class);
    private static final ObjectMapper MAPPER =
            new ObjectMapper(
                    JsonFactory.builder()
                            .streamReadConstraints(
                                    StreamReadConstraints.builder()
                                            .maxNestingDepth(
                                                    CanonicalDocumentWriter.MAX_NESTING_DEPTH)
                                            .build())
                            .build());

    public List<Optional<CanonicalNode>> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public List<Optional<CanonicalNode>> read(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
        return decodeDocument(root);
    }

    public List<Optional<CanonicalNode>> readFromString(String json)
            throws DocumentFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
        return decodeDocument(root);
    }

    private List<Optional<CanonicalNode>> decodeDocument(JsonNode root)
            throws DocumentFormatException {
        if (root == null || root.isMissingNode()) {
            throw new DocumentFormatException("Empty document");
        }
        if (!root.isArray()) {
            return List.of(decodeSlot(root, "$"));
        }
        List<Optional<CanonicalNode>> nodes = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            nodes.add(decodeSlot(root.get(i), "$[" + i + "]"));
        }
        logger.debug("Decoded {} root nodes", nodes.size());
        return List.copyOf(nodes);
    }

    private CanonicalNode decodeNode(JsonNode json, String path) throws DocumentFormatException {
        if (json.isTextual()) {
            return new CanonicalNode.Chars(json.textValue());
        }
        if (!json.isObject()) {
            throw new DocumentFormatException(
                    "Expected a node at " + path + " but found " + json.getNodeType());
        }

        String type = requireText(json, TYPE, path);
        switch (type) {
            case "MacroNode":
                return new CanonicalNode.Macro(
                        requireText(json, MACRONAME, path), decodeArgs(json, path, true));
            case "GroupNode":
                return new CanonicalNode.Group(
                        decodeDelimiters(json, path),
                        decodeArgs(json, path, false),
                        decodeChildren(json, path));
            case "CharsNode":
                return new CanonicalNode.Chars(requireText(json, TEXT, path));
            case "CommentNode":
                return new CanonicalNode.Comment(requireText(json, TEXT, path));
            case "EnvironmentNode":
                return new CanonicalNode.Environment(
                        requireText(json, NAME, path),
                        decodeArgs(json, path, true),
                        decodeChildren(json, path));
            case "SpecialsNode":
                return new CanonicalNode.Specials(
                        requireText(json, SPECIALS, path), decodeArgs(json, path, false));
            case "MathNode":
                return new CanonicalNode.Math(decodeChildren(json, path));
            case "UnknownNode":
                return new CanonicalNode.Unknown(requireText(json, LABEL, path));
            default:
                logger.debug("Unrecognized node type '{}' at {}", type, path);
                return new CanonicalNode.Unknown(type);
        }
    }

    private List<Optional<CanonicalNode>> decodeArgs(JsonNode json, String path, boolean required)
            throws DocumentFormatException {
        if (json.get(ARGS) == null && !required) {
            return List.of();
        }
        return decodeSlots(json, ARGS, path);
    }

    private List<Optional<CanonicalNode>> decodeChildren(JsonNode json, String path)
            throws DocumentFormatException {
        return decodeSlots(json, CHILDREN, path);
    }

    private List<Optional<CanonicalNode>> decodeSlots(JsonNode json, String field, String path)
            throws DocumentFormatException {
        JsonNode slots = json.get(field);
        requireArray(slots, field, path);
        List<Optional<CanonicalNode>> decoded = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            decoded.add(decodeSlot(slots.get(i), path + "." + field + "[" + i + "]"));
        }
        return decoded;
    }

    private Optional<CanonicalNode> decodeSlot(JsonNode json, String path)
            throws DocumentFormatException {
        return json.isNull() ? Optional.empty() : Optional.of(decodeNode(json, path));
    }

    private Delimiters decodeDelimiters(JsonNode json, String path)
            throws DocumentFormatException {
        JsonNode delimiters = json.get(DELIMITERS);
        requireArray(delimiters, DELIMITERS, path);
        if (delimiters.size() != 2
                || !delimiters.get(0).isTextual()
                || !delimiters.get(1).isTextual()) {
            throw new DocumentFormatException(
                    "Field '" + DELIMITERS + "' at " + path + " must hold two strings");
        }
        return Delimiters.of(delimiters.get(0).textValue(), delimiters.get(1).textValue());
    }

    private static String requireText(JsonNode json, String field, String path)
            throws DocumentFormatException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw new DocumentFormatException(
                    "Missing string field '" + field + "' at " + path);
        }
        return value.textValue();
    }

    private static void requireArray(JsonNode value, String field, String path)
            throws DocumentFormatException {
        if (value == null || !value.isArray()) {
            throw new DocumentFormatException("Missing array field '" + field + "' at " + path);
        }
    }
}
