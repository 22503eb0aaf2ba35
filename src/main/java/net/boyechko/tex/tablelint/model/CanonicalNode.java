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
package net.boyechko.tex.tablelint.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized, serializable representation of one LaTeX syntax node.
 *
 * <p>The variant set is closed. Every value is immutable and owns unmodifiable copies of its
 * argument and child lists, so a canonical tree never aliases the syntax tree it was built from.
 * Argument and child slots may be absent, as when an optional argument is omitted or the parser
 * left a {@code null} in a node list.
 */
public sealed interface CanonicalNode {

    /** Label written to the {@code type} field of the serialized record. */
    String typeLabel();

    /** A command invocation such as {@code \caption{...}}. */
    record Macro(String name, List<Optional<CanonicalNode>> args) implements CanonicalNode {
        public Macro {
            Objects.requireNonNull(name, "name");
            args = copySlots(args);
        }

        @Override
        public String typeLabel() {
            return "MacroNode";
        }
    }

    /**
     * A delimited group. Trees built from syntax nodes always carry empty {@code args}; decoded
     * documents may fill the slot, which is where the lint engine reads a table's placement.
     */
    record Group(
            Delimiters delimiters,
            List<Optional<CanonicalNode>> args,
            List<Optional<CanonicalNode>> children)
            implements CanonicalNode {
        public Group {
            Objects.requireNonNull(delimiters, "delimiters");
            args = copySlots(args);
            children = copySlots(children);
        }

        public Group(Delimiters delimiters, List<Optional<CanonicalNode>> children) {
            this(delimiters, List.of(), children);
        }

        @Override
        public String typeLabel() {
            return "GroupNode";
        }
    }

    /** Literal text, held in the escaped form produced by {@code LiteralEscaper}. */
    record Chars(String text) implements CanonicalNode {
        public Chars {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String typeLabel() {
            return "CharsNode";
        }
    }

    record Comment(String text) implements CanonicalNode {
        public Comment {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String typeLabel() {
            return "CommentNode";
        }
    }

    /** A {@code \begin{name} ... \end{name}} block. */
    record Environment(
            String name,
            List<Optional<CanonicalNode>> args,
            List<Optional<CanonicalNode>> children)
            implements CanonicalNode {
        public Environment {
            Objects.requireNonNull(name, "name");
            args = copySlots(args);
            children = copySlots(children);
        }

        @Override
        public String typeLabel() {
            return "EnvironmentNode";
        }
    }

    /** A special character sequence such as {@code &} or {@code ~}. */
    record Specials(String chars, List<Optional<CanonicalNode>> args) implements CanonicalNode {
        public Specials {
            Objects.requireNonNull(chars, "chars");
            args = copySlots(args);
        }

        @Override
        public String typeLabel() {
            return "SpecialsNode";
        }
    }

    record Math(List<Optional<CanonicalNode>> children) implements CanonicalNode {
        public Math {
            children = copySlots(children);
        }

        @Override
        public String typeLabel() {
            return "MathNode";
        }
    }

    /** Fallback for node kinds the builder does not recognize. */
    record Unknown(String label) implements CanonicalNode {
        public Unknown {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public String typeLabel() {
            return "UnknownNode";
        }
    }

    /** Wraps present nodes as argument or child slots. */
    static List<Optional<CanonicalNode>> slots(CanonicalNode... nodes) {
        List<Optional<CanonicalNode>> slots = new ArrayList<>(nodes.length);
        for (CanonicalNode node : nodes) {
            slots.add(Optional.of(node));
        }
        return Collections.unmodifiableList(slots);
    }

    /** Copies a slot list; {@code null} entries become absent slots. */
    private static List<Optional<CanonicalNode>> copySlots(List<Optional<CanonicalNode>> slots) {
        if (slots == null || slots.isEmpty()) {
            return List.of();
        }
        List<Optional<CanonicalNode>> copy = new ArrayList<>(slots.size());
        for (Optional<CanonicalNode> slot : slots) {
            copy.add(slot != null ? slot : Optional.empty());
        }
        return Collections.unmodifiableList(copy);
    }
}
