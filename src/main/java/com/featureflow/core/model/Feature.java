package com.featureflow.core.model;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A numbered, named unit of work tracked by a directory under the specs root
 * and, when version control is present, a branch of the same name.
 *
 * @param number        zero-padded number of at least three digits, e.g. "001" or "1000"
 * @param slug          kebab-case short name, e.g. "add-oauth2-login"
 * @param branchName    "&lt;number&gt;-&lt;slug&gt;"
 * @param directoryPath absolute path of the feature directory
 */
public record Feature(
    String number,
    String slug,
    String branchName,
    Path directoryPath
) {

    /**
     * Matches identifiers such as {@code 007-foo} or {@code 1000-bar}; group 1 is the number,
     * group 2 the slug. Numbers past 999 keep all their digits.
     */
    public static final Pattern ID_PATTERN = Pattern.compile("^(\\d{3,9})-(.+)$");

    public static Feature of(int number, String slug, Path specsDir) {
        String padded = formatNumber(number);
        String branch = padded + "-" + slug;
        return new Feature(padded, slug, branch, specsDir.resolve(branch));
    }

    /**
     * Builds a feature from an identifier like {@code 003-bar} located in the given directory.
     *
     * @throws IllegalArgumentException if the identifier is not of the numbered form
     */
    public static Feature fromId(String id, Path directoryPath) {
        Matcher m = ID_PATTERN.matcher(id);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a feature identifier: " + id);
        }
        return new Feature(m.group(1), m.group(2), id, directoryPath);
    }

    public static boolean isFeatureId(String candidate) {
        return candidate != null && ID_PATTERN.matcher(candidate).matches();
    }

    public static String formatNumber(int number) {
        return String.format("%03d", number);
    }

    public int numericValue() {
        return Integer.parseInt(number);
    }

    public String id() {
        return branchName;
    }
}
