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
import net.boyechko.tex.tablelint.issue.Issue;
import net.boyechko.tex.tablelint.issue.IssueList;
import net.boyechko.tex.tablelint.model.CanonicalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the table checks against one canonical node.
 *
 * <p>The {@link TableEnvironmentCheck} runs first. If it fails, its warning is the only result.
 * Otherwise every {@link TableCheck} runs in list order, and each one that fails adds its warning.
 * Checks never stop one another. The engine never modifies its input.
 */
public class TableLintEngine {
    private static final Logger logger = LoggerFactory.getLogger(TableLintEngine.class);

    private final TableEnvironmentCheck gate;
    private final List<TableCheck> checks;

    public TableLintEngine() {
        this(LintProfile.loadDefault());
    }

    public TableLintEngine(LintProfile profile) {
        this(new TableEnvironmentCheck(profile), LintDefaults.checks(profile));
    }

    public TableLintEngine(TableEnvironmentCheck gate, List<TableCheck> checks) {
        this.gate = gate;
        this.checks = List.copyOf(checks);
    }

    public List<TableCheck> getChecks() {
        return checks;
    }

    /** Returns the warnings for {@code root}, empty when the table passes every check. */
    public List<String> lint(CanonicalNode root) {
        return findIssues(root).messages();
    }

    /** Returns the failed checks for {@code root}; a {@code null} root fails the gate. */
    public IssueList findIssues(CanonicalNode root) {
        Optional<CanonicalNode.Group> table = gate.detect(root);
        if (table.isEmpty()) {
            logger.debug("{}: root is not a table group", gate.name());
            return new IssueList(new Issue(gate.type(), gate.failedMessage()));
        }

        IssueList issues = new IssueList();
        for (TableCheck check : checks) {
            if (check.passes(table.get())) {
                logger.debug("{}: passed", check.name());
            } else {
                logger.debug("{}: failed", check.name());
                issues.add(new Issue(check.type(), check.failedMessage()));
            }
        }
        return issues;
    }
}
