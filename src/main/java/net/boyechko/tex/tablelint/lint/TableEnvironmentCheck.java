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

import java.util.Optional;
import net.boyechko.tex.tablelint.issue.IssueType;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import net.boyechko.tex.tablelint.model.Delimiters;

/** Detects whether a node is a table group at all; every other check depends on it. */
public class TableEnvironmentCheck {
    private final Delimiters tableDelimiters;

    public TableEnvironmentCheck(LintProfile profile) {
        this.tableDelimiters = profile.tableDelimiters();
    }

    public String name() {
        return "Table Environment";
    }

    public IssueType type() {
        return IssueType.TABLE_ENVIRONMENT_NOT_DETECTED;
    }

    public String failedMessage() {
        return "Table environment not detected.";
    }

    /** Returns {@code root} as a table group, or empty if it is not one. */
    public Optional<CanonicalNode.Group> detect(CanonicalNode root) {
        if (root instanceof CanonicalNode.Group group
                && tableDelimiters.equals(group.delimiters())) {
            return Optional.of(group);
        }
        return Optional.empty();
    }
}
