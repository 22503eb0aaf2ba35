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

import java.util.List;
import java.util.Objects;

/** Opening and closing markers of a delimited group, e.g. {@code ("{", "}")}. */
public record Delimiters(String open, String close) {
    public Delimiters {
        Objects.requireNonNull(open, "open delimiter");
        Objects.requireNonNull(close, "close delimiter");
    }

    public static Delimiters of(String open, String close) {
        return new Delimiters(open, close);
    }

    /** Builds a pair from a two-element list, as found in YAML profiles and JSON documents. */
    public static Delimiters fromList(List<String> pair) {
        if (pair == null || pair.size() != 2) {
            throw new IllegalArgumentException(
                    "Delimiters must have exactly two entries, got " + pair);
        }
        return new Delimiters(pair.get(0), pair.get(1));
    }

    public List<String> toList() {
        return List.of(open, close);
    }

    @Override
    public String toString() {
        return "(" + open + ", " + close + ")";
    }
}
