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
package net.boyechko.tex.tablelint.syntax;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Argument signatures of known macros and environments, used by {@link LatexWalker}.
 *
 * <p>A signature is a string of argument markers read left to right:
 *
 * <ul>
 *   <li><code>&#123;</code> a mandatory argument
 *   <li>{@code [} an optional bracket argument
 *   <li>{@code *} an optional star
 * </ul>
 *
 * Names missing from the tables take no arguments.
 */
public final class ArgSpecs {
    private static final String DEFAULT_RESOURCE = "/latex-argspecs.yaml";
    private static final String MARKERS = "{[*";
    private static final Logger logger = LoggerFactory.getLogger(ArgSpecs.class);

    public Map<String, String> macros;
    public Map<String, String> environments;

    public ArgSpecs() {
        this.macros = new HashMap<>();
        this.environments = new HashMap<>();
    }

    public String forMacro(String name) {
        return macros != null ? macros.getOrDefault(name, "") : "";
    }

    public String forEnvironment(String name) {
        return environments != null ? environments.getOrDefault(name, "") : "";
    }

    /**
     * Load ArgSpecs from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ArgSpecs fromResource(String resourcePath) {
        try (var inputStream = ArgSpecs.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(ArgSpecs.class, new LoaderOptions()));
            ArgSpecs specs = yaml.load(inputStream);
            if (specs == null) {
                throw new IllegalArgumentException("Resource is empty: " + resourcePath);
            }
            if (specs.macros == null) {
                specs.macros = new HashMap<>();
            }
            if (specs.environments == null) {
                specs.environments = new HashMap<>();
            }

            List<String> problems = specs.validate();
            if (!problems.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid argument signatures in " + resourcePath + ": " + problems);
            }

            logger.debug(
                    "Loaded {} macro and {} environment signatures from {}",
                    specs.macros.size(),
                    specs.environments.size(),
                    resourcePath);
            return specs;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load ArgSpecs from resource {}: {}", resourcePath, e.getMessage());
            throw new IllegalArgumentException(
                    "Failed to load argument signatures from " + resourcePath + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the bundled signatures. */
    public static ArgSpecs loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /** Signatures where every macro and environment takes no arguments. */
    public static ArgSpecs none() {
        return new ArgSpecs();
    }

    /** Returns one message per signature that uses an unknown marker. */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        collectProblems("macro", macros, problems);
        collectProblems("environment", environments, problems);
        return problems;
    }

    private static void collectProblems(
            String kind, Map<String, String> table, List<String> problems) {
        if (table == null) {
            return;
        }
        for (Map.Entry<String, String> entry : table.entrySet()) {
            String spec = entry.getValue() != null ? entry.getValue() : "";
            for (char c : spec.toCharArray()) {
                if (MARKERS.indexOf(c) < 0) {
                    problems.add(
                            kind + " '" + entry.getKey() + "' uses unknown marker '" + c + "'");
                }
            }
            if (entry.getValue() == null) {
                entry.setValue("");
            }
        }
    }
}
