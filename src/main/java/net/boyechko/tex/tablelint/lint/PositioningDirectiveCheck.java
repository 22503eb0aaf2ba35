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

import java.util.List;
import java.util.Optional;
import net.boyechko.tex.tablelint.issue.IssueType;
import net.boyechko.tex.tablelint.model.CanonicalNode;

/**
 * Requires the table's first argument to be text containing the positioning token. A missing
 * argument, an absent slot or a non-text argument all count as a missing directive.
 */
public class PositioningDirectiveCheck implements TableCheck {
    private final String token;

    public PositioningDirectiveCheck(LintProfile profile) {
        this.token = profile.positioningToken();
    }

    @Override
    public String name() {
        return "Positioning Directive";
    }

    @Override
    public IssueType type() {
        return IssueType.MISSING_POSITIONING_DIRECTIVE;
    }

    @Override
    public String failedMessage() {
        return "Table does not have a " + token + " positioning directive.";
    }

    @Override
    public boolean passes(CanonicalNode.Group table) {
        List<Optional<CanonicalNode>> args = table.args();
        if (args.isEmpty()) {
            return false;
        }
        Optional<CanonicalNode> first = args.get(0);
        return first.isPresent()
                && first.get() instanceof CanonicalNode.Chars chars
                && chars.text().contains(token);
    }
}
