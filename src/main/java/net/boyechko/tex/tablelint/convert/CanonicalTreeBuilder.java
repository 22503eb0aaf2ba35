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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a parser's {@link SyntaxNode} tree into {@link CanonicalNode} values.
 *
 * <p>Conversion is depth-first and keeps argument and child order. It runs on an explicit stack,
 * so arbitrarily deep input cannot exhaust the thread stack. Node kinds outside the known set
 * become {@link CanonicalNode.Unknown}. The builder holds no state and may be shared between
 * threads.
 */
public class CanonicalTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalTreeBuilder.class);

    /** Converts the top-level node list of a document; {@code null} entries become absent. */
    public List<Optional<CanonicalNode>> convertRoot(List<? extends SyntaxNode> nodes) {
        List<Optional<CanonicalNode>> roots = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            roots.add(convert(node));
        }
        logger.debug("Converted {} root nodes", roots.size());
        return List.copyOf(roots);
    }

    /**
     * Converts one node and everything below it.
     *
     * @return the canonical node, or empty when {@code node} is {@code null}
     * @throws MalformedSyntaxTreeException if a macro or environment lacks its argument
     *     descriptor
     */
    public Optional<CanonicalNode> convert(SyntaxNode node) {
        if (node == null) {
            return Optional.empty();
        }
        Frame rootFrame = openFrame(node);
        if (rootFrame == null) {
            return Optional.of(convertLeaf(node));
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(rootFrame);
        while (true) {
            Frame top = stack.peek();
            if (top.hasNext()) {
                SyntaxNode input = top.next();
                if (input == null) {
                    top.accept(Optional.empty());
                    continue;
                }
                Frame frame = openFrame(input);
                if (frame != null) {
                    stack.push(frame);
                } else {
                    top.accept(Optional.of(convertLeaf(input)));
                }
            } else {
                stack.pop();
                CanonicalNode built = top.build();
                if (stack.isEmpty()) {
                    return Optional.of(built);
                }
                stack.peek().accept(Optional.of(built));
            }
        }
    }

    /** Returns a frame for node kinds with arguments or children, {@code null} for leaves. */
    private Frame openFrame(SyntaxNode node) {
        if (node instanceof MacroNode macro) {
            return new Frame(
                    requireArgs(node, macro.nodeargd()),
                    List.of(),
                    f -> new CanonicalNode.Macro(macro.macroname(), f.args));
        } else if (node instanceof GroupNode group) {
            Delimiters delimiters =
                    Delimiters.of(
                            nullToEmpty(group.openDelimiter()),
                            nullToEmpty(group.closeDelimiter()));
            return new Frame(
                    List.of(),
                    group.nodelist(),
                    f -> new CanonicalNode.Group(delimiters, f.children));
        } else if (node instanceof EnvironmentNode env) {
            return new Frame(
                    requireArgs(node, env.nodeargd()),
                    env.nodelist(),
                    f -> new CanonicalNode.Environment(env.environmentname(), f.args, f.children));
        } else if (node instanceof SpecialsNode specials) {
            // A missing descriptor and an empty one both mean "no arguments"
            List<SyntaxNode> args =
                    specials.nodeargd() != null ? specials.nodeargd().argnlist() : List.of();
            return new Frame(
                    args,
                    List.of(),
                    f -> new CanonicalNode.Specials(specials.specialsChars(), f.args));
        } else if (node instanceof MathNode math) {
            return new Frame(List.of(), math.nodelist(), f -> new CanonicalNode.Math(f.children));
        }
        return null;
    }

    private CanonicalNode convertLeaf(SyntaxNode node) {
        if (node instanceof CharsNode chars) {
            return new CanonicalNode.Chars(LiteralEscaper.escape(chars.chars()));
        } else if (node instanceof CommentNode comment) {
            return new CanonicalNode.Comment(comment.comment());
        }
        String label = unknownLabel(node);
        logger.debug("Unrecognized node kind {}, recording it as unknown", label);
        return new CanonicalNode.Unknown(label);
    }

    private static List<SyntaxNode> requireArgs(SyntaxNode node, ArgumentList nodeargd) {
        if (nodeargd == null) {
            throw new MalformedSyntaxTreeException(describe(node) + " has no argument descriptor");
        }
        return nodeargd.argnlist();
    }

    private static String unknownLabel(SyntaxNode node) {
        String simpleName = node.getClass().getSimpleName();
        return simpleName.isEmpty() ? node.getClass().getName() : simpleName;
    }

    private static String describe(SyntaxNode node) {
        if (node instanceof MacroNode macro) {
            return "macro \\" + macro.macroname() + " at offset " + node.pos();
        } else if (node instanceof EnvironmentNode env) {
            return "environment " + env.environmentname() + " at offset " + node.pos();
        }
        return unknownLabel(node) + " at offset " + node.pos();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    /** Conversion state of one composite node: inputs still to visit and outputs so far. */
    private static final class Frame {
        final List<SyntaxNode> argInputs;
        final List<SyntaxNode> childInputs;
        final List<Optional<CanonicalNode>> args;
        final List<Optional<CanonicalNode>> children;
        final Function<Frame, CanonicalNode> assembler;
        int next;

        Frame(
                List<SyntaxNode> argInputs,
                List<SyntaxNode> childInputs,
                Function<Frame, CanonicalNode> assembler) {
            this.argInputs = argInputs;
            this.childInputs = childInputs;
            this.args = new ArrayList<>(argInputs.size());
            this.children = new ArrayList<>(childInputs.size());
            this.assembler = assembler;
        }

        boolean hasNext() {
            return next < argInputs.size() + childInputs.size();
        }

        SyntaxNode next() {
            int index = next++;
            return index < argInputs.size()
                    ? argInputs.get(index)
                    : childInputs.get(index - argInputs.size());
        }

        /** Stores the result for the input most recently returned by {@link #next}. */
        void accept(Optional<CanonicalNode> converted) {
            if (next - 1 < argInputs.size()) {
                args.add(converted);
            } else {
                children.add(converted);
            }
        }

        CanonicalNode build() {
            return assembler.apply(this);
        }
    }
}
