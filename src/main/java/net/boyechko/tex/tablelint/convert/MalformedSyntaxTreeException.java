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

/**
 * Thrown when a syntax tree breaks the parser contract in a way no canonical shape can represent,
 * such as a macro without an argument descriptor.
 */
public class MalformedSyntaxTreeException extends RuntimeException {
    public MalformedSyntaxTreeException(String message) {
        super(message);
    }
}
