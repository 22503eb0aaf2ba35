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
package net.boyechko.tex.tablelint.lint;

import net.boyechko.tex.tablelint.issue.IssueType;
import net.boyechko.tex.tablelint.model.CanonicalNode;

/**
 * One structural rule applied to a table that already passed the environment check. Checks are
 * independent of each other and must not look deeper than the table's direct children and
 * argument slots.
 */
public interface TableCheck {

    String name();

    IssueType type();

    /** Warning reported when {@link #passes} returns {@code false}. */
    String failedMessage();

    boolean passes(CanonicalNode.Group table);
}
