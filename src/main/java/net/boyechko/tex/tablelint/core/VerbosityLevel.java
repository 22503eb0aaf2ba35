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
package net.boyechko.tex.tablelint.core;

/**
 * How much the CLI reports while converting and linting.
 *
 * <p>Each level also fixes the root logging level, so that log output grows together with
 * reporter output.
 */
public enum VerbosityLevel {
    /** Errors only; lint warnings still decide the exit status. */
    QUIET(0, "ERROR"),

    /** Lint warnings, conversion results and the summary (default). */
    NORMAL(1, "WARN"),

    /** Adds per-node lint results and parse statistics. */
    VERBOSE(2, "INFO"),

    /** Adds per-check debug logging. */
    DEBUG(3, "DEBUG");

    private final int level;
    private final String rootLogLevel;

    VerbosityLevel(int level, String rootLogLevel) {
        this.level = level;
        this.rootLogLevel = rootLogLevel;
    }

    /** Name of the root logger level that matches this verbosity. */
    public String rootLogLevel() {
        return rootLogLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
