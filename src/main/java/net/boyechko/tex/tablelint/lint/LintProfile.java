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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.tex.tablelint.model.Delimiters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Markers the table checks look for, loaded from YAML. */
public final class LintProfile {
    private static final String DEFAULT_PROFILE_RESOURCE = "/tablelint-default.yaml";
    private static final Logger logger = LoggerFactory.getLogger(LintProfile.class);

    /** Opening and closing delimiters of a table group. */
    public List<String> table_delimiters;

    /** Opening and closing delimiters of a centering group. */
    public List<String> center_delimiters;

    /** Name of the caption macro, without the backslash. */
    public String caption_macro;

    /** Substring of the first table argument that requests "place here". */
    public String positioning_token;

    public Delimiters tableDelimiters() {
        return Delimiters.fromList(table_delimiters);
    }

    public Delimiters centerDelimiters() {
        return Delimiters.fromList(center_delimiters);
    }

    public String captionMacro() {
        return caption_macro;
    }

    public String positioningToken() {
        return positioning_token;
    }

    /**
     * Load a LintProfile from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static LintProfile fromResource(String resourcePath) {
        try (InputStream inputStream = LintProfile.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read lint profile " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /** Load a LintProfile from a YAML file on disk. */
    public static LintProfile fromFile(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream, path.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read lint profile " + path + ": " + e.getMessage(), e);
        }
    }

    /** Load the bundled profile for standard LaTeX tables. */
    public static LintProfile loadDefault() {
        return fromResource(DEFAULT_PROFILE_RESOURCE);
    }

    private static LintProfile load(InputStream inputStream, String source) {
        LintProfile profile;
        try {
            var yaml = new Yaml(new Constructor(LintProfile.class, new LoaderOptions()));
            profile = yaml.load(inputStream);
        } catch (RuntimeException e) {
            logger.error("Failed to parse lint profile {}: {}", source, e.getMessage());
            throw new IllegalArgumentException(
                    "Malformed lint profile " + source + ": " + e.getMessage(), e);
        }
        if (profile == null) {
            throw new IllegalArgumentException("Lint profile is empty: " + source);
        }

        List<String> problems = profile.validate();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid lint profile " + source + ": " + String.join("; ", problems));
        }
        logger.debug(
                "Loaded lint profile from {}: table {}, centering {}, caption macro {}, token {}",
                source,
                profile.tableDelimiters(),
                profile.centerDelimiters(),
                profile.caption_macro,
                profile.positioning_token);
        return profile;
    }

    /**
     * Checks that every marker is set.
     *
     * @return List of problems (empty if the profile is usable)
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        checkPair("table_delimiters", table_delimiters, problems);
        checkPair("center_delimiters", center_delimiters, problems);
        if (caption_macro == null || caption_macro.isBlank()) {
            problems.add("caption_macro must not be blank");
        }
        if (positioning_token == null || positioning_token.isBlank()) {
            problems.add("positioning_token must not be blank");
        }
        return problems;
    }

    private static void checkPair(String field, List<String> pair, List<String> problems) {
        if (pair == null || pair.size() != 2) {
            problems.add(field + " must have exactly two entries");
        } else if (pair.contains(null)) {
            problems.add(field + " must not contain null entries");
        }
    }
}
