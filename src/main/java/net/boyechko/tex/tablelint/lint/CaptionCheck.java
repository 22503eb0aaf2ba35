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

/** Requires a caption macro among the table's direct children. */
public class CaptionCheck implements TableCheck {
    private final String captionMacro;

    public CaptionCheck(LintProfile profile) {
        this.captionMacro = profile.captionMacro();
    }

    @Override
    public String name() {
        return "Caption";
    }

    @Override
    public IssueType type() {
        return IssueType.MISSING_CAPTION;
    }

    @Override
    public String failedMessage() {
        return "Table does not have a caption using \\" + captionMacro + ".";
    }

    @Override
    public boolean passes(CanonicalNode.Group table) {
        for (Optional<CanonicalNode> child : table.children()) {
            if (child.orElse(null) instanceof CanonicalNode.Macro macro
                    && captionMacro.equals(macro.name())) {
                return true;
            }
        }
        return false;
    }
}
