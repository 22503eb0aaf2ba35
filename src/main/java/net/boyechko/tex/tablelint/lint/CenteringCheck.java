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

/** Requires a centering group among the table's direct children. */
public class CenteringCheck implements TableCheck {
    private final Delimiters centerDelimiters;

    public CenteringCheck(LintProfile profile) {
        this.centerDelimiters = profile.centerDelimiters();
    }

    @Override
    public String name() {
        return "Centering";
    }

    @Override
    public IssueType type() {
        return IssueType.NOT_CENTERED;
    }

    @Override
    public String failedMessage() {
        return "Table is not centered using "
                + centerDelimiters.open()
                + " and "
                + centerDelimiters.close()
                + ".";
    }

    @Override
    public boolean passes(CanonicalNode.Group table) {
        for (Optional<CanonicalNode> child : table.children()) {
            if (child.orElse(null) instanceof CanonicalNode.Group group
                    && centerDelimiters.equals(group.delimiters())) {
                return true;
            }
        }
        return false;
    }
}
