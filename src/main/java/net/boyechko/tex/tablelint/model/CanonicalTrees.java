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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Static helpers for inspecting and printing canonical trees. */
public final class CanonicalTrees {
    private static final String INDENT = "--";
    private static final String ABSENT = "<absent>";

    private CanonicalTrees() {}

    /** Returns the argument slots of {@code node}, or an empty list for variants without any. */
    public static List<Optional<CanonicalNode>> argsOf(CanonicalNode node) {
        if (node instanceof CanonicalNode.Macro macro) {
            return macro.args();
        } else if (node instanceof CanonicalNode.Group group) {
            return group.args();
        } else if (node instanceof CanonicalNode.Environment env) {
            return env.args();
        } else if (node instanceof CanonicalNode.Specials specials) {
            return specials.args();
        }
        return List.of();
    }

    /** Returns the child slots of {@code node}, or an empty list for leaf variants. */
    public static List<Optional<CanonicalNode>> childrenOf(CanonicalNode node) {
        if (node instanceof CanonicalNode.Group group) {
            return group.children();
        } else if (node instanceof CanonicalNode.Environment env) {
            return env.children();
        } else if (node instanceof CanonicalNode.Math math) {
            return math.children();
        }
        return List.of();
    }

    /** One-line description of a node, without its arguments or children. */
    public static String label(CanonicalNode node) {
        if (node instanceof CanonicalNode.Macro macro) {
            return "\\" + macro.name();
        } else if (node instanceof CanonicalNode.Group group) {
            return group.delimiters().toString();
        } else if (node instanceof CanonicalNode.Chars chars) {
            return chars.text();
        } else if (node instanceof CanonicalNode.Comment comment) {
            return "%" + comment.text();
        } else if (node instanceof CanonicalNode.Environment env) {
            return "env:" + env.name();
        } else if (node instanceof CanonicalNode.Specials specials) {
            return "specials:" + specials.chars();
        } else if (node instanceof CanonicalNode.Math) {
            return "math";
        } else if (node instanceof CanonicalNode.Unknown unknown) {
            return "unknown:" + unknown.label();
        }
        throw new IllegalStateException("Unhandled canonical node " + node);
    }

    /**
     * Renders {@code roots} one node per line, arguments before children, each level indented by
     * {@value #INDENT}.
     */
    public static String toIndentedTreeString(List<Optional<CanonicalNode>> roots) {
        StringBuilder sb = new StringBuilder();
        Deque<Entry> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(new Entry(roots.get(i), 0));
        }

        while (!pending.isEmpty()) {
            Entry entry = pending.pop();
            sb.append(INDENT.repeat(entry.depth()));
            if (entry.node().isEmpty()) {
                sb.append(ABSENT).append('\n');
                continue;
            }
            CanonicalNode node = entry.node().get();
            sb.append(label(node)).append('\n');

            List<Optional<CanonicalNode>> children = childrenOf(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Entry(children.get(i), entry.depth() + 1));
            }
            List<Optional<CanonicalNode>> args = argsOf(node);
            for (int i = args.size() - 1; i >= 0; i--) {
                pending.push(new Entry(args.get(i), entry.depth() + 1));
            }
        }
        return sb.toString();
    }

    private record Entry(Optional<CanonicalNode> node, int depth) {}
}
