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
package net.boyechko.tex.tablelint.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import net.boyechko.tex.tablelint.convert.MalformedSyntaxTreeException;
import net.boyechko.tex.tablelint.core.ProcessingService;
import net.boyechko.tex.tablelint.core.TableLintResult;
import net.boyechko.tex.tablelint.core.VerbosityLevel;
import net.boyechko.tex.tablelint.lint.LintProfile;
import net.boyechko.tex.tablelint.lint.TableLintEngine;
import net.boyechko.tex.tablelint.syntax.LatexParseException;
import net.boyechko.tex.tablelint.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TexTableLintCLI {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_WARNINGS = 2;

    private static final String TEX_SUFFIX = ".tex";
    private static final String JSON_SUFFIX = ".json";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            boolean lintOnly,
            boolean dumpTree,
            Path profilePath,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (!lintOnly && !dumpTree && outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        boolean lintOnly;
        boolean dumpTree;
        Path profilePath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (lintOnly && dumpTree) {
                throw new CLIException("--lint and --dump-tree cannot be combined");
            }
            if ((lintOnly || dumpTree) && outputPath != null) {
                throw new CLIException("An output file is only accepted when converting");
            }
            if (profilePath != null && !Files.exists(profilePath)) {
                throw new CLIException("Profile not found: " + profilePath);
            }
            resolveOutputPath();

            return new CLIConfig(inputPath, outputPath, lintOnly, dumpTree, profilePath, verbosity);
        }

        private void resolveOutputPath() {
            if (lintOnly || dumpTree || outputPath != null) {
                return;
            }
            outputPath = defaultOutputPath(inputPath);
        }
    }

    /** {@code paper.tex} becomes {@code paper.json}; other names get {@code .json} appended. */
    static Path defaultOutputPath(Path inputPath) {
        String name = inputPath.getFileName().toString();
        String outputName =
                name.endsWith(TEX_SUFFIX)
                        ? name.substring(0, name.length() - TEX_SUFFIX.length()) + JSON_SUFFIX
                        : name + JSON_SUFFIX;
        return inputPath.resolveSibling(outputName);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return EXIT_OK;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            return processFile(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--profile=")) {
                b.profilePath = Paths.get(args[i].substring("--profile=".length()));
            } else {
                switch (args[i]) {
                    case "--profile" -> {
                        if (i + 1 < args.length) {
                            b.profilePath = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Profile file not specified after --profile");
                        }
                    }
                    case "-l", "--lint" -> b.lintOnly = true;
                    case "-t", "--dump-tree" -> b.dumpTree = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-") && args[i].length() > 1) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Too many file arguments: " + args[i]);
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return """
                Usage: texlint [options] <input.tex> [output.json]
                       texlint --lint [options] <document.json>
                       texlint --dump-tree [options] <input.tex>

                Converts a LaTeX file into a canonical JSON document tree (default),
                lints the top-level nodes of a canonical JSON document as tables (--lint),
                or prints the canonical tree of a LaTeX file (--dump-tree).

                Options:
                  -l, --lint              Lint a canonical JSON document
                  -t, --dump-tree         Print the canonical tree instead of writing JSON
                  --profile=<file.yaml>   Use custom table markers for linting
                  -q, --quiet             Only show errors
                  -v, --verbose           Show per-node progress
                  -vv, --debug            Show debug logging
                  -h, --help              Show this message

                Exit status: 0 on success, 1 on errors, 2 when --lint reported warnings.
                """;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level = Level.toLevel(verbosity.rootLogLevel(), Level.WARN);
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(TexTableLintCLI.class);
        }
        return logger;
    }

    private static int processFile(CLIConfig config, PrintStream out, PrintStream err) {
        ProcessingReporter reporter = new ProcessingReporter(out, config.verbosity());
        try {
            TableLintEngine engine =
                    config.profilePath() != null
                            ? new TableLintEngine(LintProfile.fromFile(config.profilePath()))
                            : new TableLintEngine();
            ProcessingService service =
                    new ProcessingService.ProcessingServiceBuilder()
                            .withLintEngine(engine)
                            .withListener(reporter)
                            .build();

            if (config.dumpTree()) {
                out.print(service.dumpTree(config.inputPath()));
                return EXIT_OK;
            }
            if (config.lintOnly()) {
                List<TableLintResult> results = service.lint(config.inputPath());
                boolean anyWarnings = results.stream().anyMatch(r -> !r.passed());
                return anyWarnings ? EXIT_WARNINGS : EXIT_OK;
            }
            service.convert(config.inputPath(), config.outputPath());
            return EXIT_OK;
        } catch (LatexParseException e) {
            err.println("Error: cannot parse " + config.inputPath() + ": " + e.getMessage());
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            logger().debug("I/O failure", e);
        } catch (IllegalArgumentException | MalformedSyntaxTreeException e) {
            err.println("Error: " + e.getMessage());
        } finally {
            reporter.finish();
        }
        return EXIT_ERROR;
    }
}
