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
package net.boyechko.tex.tablelint.ui;

import java.io.PrintStream;
import java.util.List;
import net.boyechko.tex.tablelint.core.ProcessingListener;
import net.boyechko.tex.tablelint.core.TableLintResult;
import net.boyechko.tex.tablelint.core.VerbosityLevel;
import net.boyechko.tex.tablelint.issue.Issue;
import net.boyechko.tex.tablelint.issue.IssueType;

/** Renders processing events as boxed, symbol-prefixed lines on a {@link PrintStream}. */
public class ProcessingReporter implements ProcessingListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;

    private boolean phaseOpen = false;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS, VerbosityLevel.NORMAL);
    }

    @Override
    public void onWarning(Issue issue) {
        printLine(issue.message(), WARNING, VerbosityLevel.NORMAL);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO, VerbosityLevel.NORMAL);
    }

    @Override
    public void onVerboseOutput(String message) {
        printLine(message, INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onSummary(List<TableLintResult> results) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        long failing = results.stream().filter(r -> !r.passed()).count();
        int warnings = results.stream().mapToInt(r -> r.issues().size()).sum();

        closePhaseBoxIfOpen();
        printBoxHeader("Summary");
        phaseOpen = true;
        if (failing == 0) {
            printLine("Checked " + results.size() + " node(s) and found no table issues", SUCCESS);
        } else {
            printLine(
                    warnings + " warning(s) in " + failing + " of " + results.size() + " node(s)",
                    WARNING);
            for (IssueType type : IssueType.values()) {
                long count = results.stream().filter(r -> r.issues().hasType(type)).count();
                if (count > 0) {
                    printLine(count + " " + type.groupLabel(), WARNING);
                }
            }
        }
        closePhaseBoxIfOpen();
    }

    /** Closes the current box; callers use it when output ends without a new phase. */
    public void finish() {
        closePhaseBoxIfOpen();
    }

    private void printLine(String message, String symbol, VerbosityLevel required) {
        if (verbosity.isAtLeast(required)) {
            printLine(message, symbol);
        }
    }

    private void printLine(String message, String symbol) {
        String prefix = phaseOpen ? INDENT : "";
        output.println(prefix + symbol + " " + message);
    }

    private void printBoxHeader(String title) {
        String head = "┌─ " + title + " ";
        int fill = Math.max(0, HEADER_WIDTH - head.length());
        output.println(head + "─".repeat(fill));
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen) {
            output.println("└" + "─".repeat(HEADER_WIDTH - 1));
            phaseOpen = false;
        }
    }
}
