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

/** Field names of the serialized canonical node records. */
final class DocumentFields {
    static final String TYPE = "type";
    static final String MACRONAME = "macroname";
    static final String NAME = "name";
    static final String DELIMITERS = "delimiters";
    static final String ARGS = "args";
    static final String CHILDREN = "children";
    static final String TEXT = "text";
    static final String SPECIALS = "specials";
    static final String LABEL = "label";

    private DocumentFields() {}
}
