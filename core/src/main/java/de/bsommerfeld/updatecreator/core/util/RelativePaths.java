package de.bsommerfeld.updatecreator.core.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the {@code /}-separated relative paths used inside the distribution tree,
 * the update inventory and the change manifest. Paths never start or end with a separator
 * and the empty string denotes the root.
 */
public final class RelativePaths {

    public static final char SEPARATOR = '/';

    private RelativePaths() {
    }

    /**
     * Joins two relative paths, treating an empty side as the root.
     */
    public static String join(String parent, String child) {
        if (parent.isEmpty()) return child;
        if (child.isEmpty()) return parent;
        return parent + SEPARATOR + child;
    }

    /**
     * Removes leading and trailing {@code /} and {@code \} characters from user input.
     */
    public static String strip(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && isSeparator(path.charAt(start))) start++;
        while (end > start && isSeparator(path.charAt(end - 1))) end--;
        return path.substring(start, end);
    }

    /**
     * Splits a relative path into its non-empty segments.
     */
    public static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Whether {@code path} names a location below the root: no {@code .} or {@code ..}
     * segment and no drive prefix. Both separators are considered.
     */
    public static boolean isConfined(String path) {
        for (String segment : path.split("[/\\\\]")) {
            if (segment.equals(".") || segment.equals("..") || segment.indexOf(':') >= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders {@code path} relative to {@code root} with forward slashes on every platform.
     */
    public static String of(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', SEPARATOR);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }
}
