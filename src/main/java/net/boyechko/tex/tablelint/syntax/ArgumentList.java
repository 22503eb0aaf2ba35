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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed arguments of a macro, environment or specials node, in source order. A {@code null}
 * entry stands for an optional argument that was not given.
 */
public record ArgumentList(List<SyntaxNode> argnlist) {
    public ArgumentList {
        argnlist =
                argnlist == null
                        ? List.of()
                        : Collections.unmodifiableList(new ArrayList<>(argnlist));
    }

    public static ArgumentList empty() {
        return new ArgumentList(List.of());
    }

    public static ArgumentList of(SyntaxNode... args) {
        List<SyntaxNode> list = new ArrayList<>(args.length);
        Collections.addAll(list, args);
        return new ArgumentList(list);
    }
}
