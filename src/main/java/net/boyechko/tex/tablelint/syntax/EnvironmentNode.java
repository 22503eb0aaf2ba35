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

import java.util.List;

/** A {@code \begin{environmentname} ... \end{environmentname}} block. */
public record EnvironmentNode(
        String environmentname,
        ArgumentList nodeargd,
        List<SyntaxNode> nodelist,
        int pos,
        int len)
        implements SyntaxNode {

    public EnvironmentNode {
        nodelist = SyntaxNodes.copyOf(nodelist);
    }

    public EnvironmentNode(
            String environmentname, ArgumentList nodeargd, List<SyntaxNode> nodelist) {
        this(environmentname, nodeargd, nodelist, 0, 0);
    }
}
