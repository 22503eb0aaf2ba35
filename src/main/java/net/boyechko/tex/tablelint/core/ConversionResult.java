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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.model.CanonicalNode;

/** Outcome of converting one LaTeX file into a canonical JSON document. */
public record ConversionResult(
        Path inputPath, Path outputPath, List<Optional<CanonicalNode>> roots) {
    public int rootCount() {
        return roots.size();
    }
}
