package com.cdnpurge.invalidation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalizes and validates the paths handed over by the publish pipeline.
 *
 * <p>Rules, applied to every entry after stripping surrounding whitespace:
 *
 * <ul>
 *   <li>the list must not be null or empty
 *   <li>an entry must not be null or blank
 *   <li>an entry must start with {@code /}
 *   <li>an entry must not contain control characters, unpaired surrogates or other code points
 *       XML 1.0 cannot carry
 * </ul>
 *
 * <p>Duplicates are collapsed silently, keeping the first occurrence. All errors are collected and
 * returned together. No I/O.
 */
public final class PathValidator {

    private PathValidator() {
        // utility class
    }

    /**
     * Validates and normalizes the given paths.
     *
     * @param rawPaths paths as supplied by the caller, may be null
     * @return an ok result holding the normalized paths, or a failed result listing every error
     */
    public static PathValidationResult validate(List<String> rawPaths) {
        if (rawPaths == null || rawPaths.isEmpty()) {
            return PathValidationResult.fail(List.of("paths must not be empty"));
        }

        var errors = new ArrayList<String>();
        Set<String> normalized = new LinkedHashSet<>();

        for (int i = 0; i < rawPaths.size(); i++) {
            String raw = rawPaths.get(i);
            if (raw == null || raw.isBlank()) {
                errors.add("paths[" + i + "] must not be null or blank");
                continue;
            }
            String path = raw.strip();
            if (!path.startsWith("/")) {
                errors.add("paths[" + i + "] must start with '/': " + path);
                continue;
            }
            int bad = firstIllegalCodePoint(path);
            if (bad >= 0) {
                errors.add("paths[" + i + "] contains illegal character U+"
                        + String.format("%04X", bad) + ": " + printable(path));
                continue;
            }
            normalized.add(path);
        }

        return errors.isEmpty()
                ? PathValidationResult.ok(List.copyOf(normalized))
                : PathValidationResult.fail(errors);
    }

    /** Returns the first code point not allowed in XML 1.0 character data, or -1. */
    private static int firstIllegalCodePoint(String path) {
        return path.codePoints()
                .filter(cp -> !isXmlChar(cp))
                .findFirst()
                .orElse(-1);
    }

    private static boolean isXmlChar(int cp) {
        // Tab, LF and CR are legal XML but never legal in a URL path.
        return (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    private static String printable(String path) {
        var sb = new StringBuilder(path.length());
        path.codePoints().forEach(cp -> {
            if (isXmlChar(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('?');
            }
        });
        return sb.toString();
    }
}
