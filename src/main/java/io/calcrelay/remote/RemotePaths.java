package io.calcrelay.remote;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * POSIX path helpers for remote locations, which are plain strings on this side.
 */
public final class RemotePaths {
    private RemotePaths() {
    }

    public static String join(String base, String relative) {
        String rel = normalize(relative);
        if (rel.isEmpty()) {
            return base;
        }
        return base.endsWith("/") ? base + rel : base + "/" + rel;
    }

    /**
     * Checks a path meant to live below a calcjob folder: non-empty, relative
     * and without {@code ..} parts. Returns it without a leading {@code ./}.
     */
    public static String requireRelative(String relative) {
        String rel = normalize(relative);
        boolean onlyDots = true;
        for (String part : rel.split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                onlyDots = false;
                break;
            }
        }
        if (onlyDots) {
            throw new IllegalArgumentException("Empty path: '" + relative + "'");
        }
        return rel;
    }

    /**
     * Checks a name used as one folder level, such as a calcjob uuid.
     */
    public static String requireSegment(String name) {
        if (name == null || name.isBlank() || name.equals(".") || name.equals("..")
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Not a single path segment: '" + name + "'");
        }
        return name;
    }

    private static String normalize(String relative) {
        String rel = relative == null ? "" : relative.replace('\\', '/');
        while (rel.startsWith("./")) {
            rel = rel.substring(2);
        }
        if (rel.startsWith("/")) {
            throw new IllegalArgumentException("Relative path expected: " + relative);
        }
        for (String part : rel.split("/")) {
            if (part.equals("..")) {
                throw new IllegalArgumentException("Path escapes its folder: " + relative);
            }
        }
        return rel;
    }

    public static String parent(String path) {
        int slash = path.lastIndexOf('/');
        if (slash <= 0) {
            return "/";
        }
        return path.substring(0, slash);
    }

    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    public static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> out = new ArrayList<>();
        if (globs == null) {
            return out;
        }
        for (String glob : globs) {
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return out;
    }

    /**
     * True when no matchers were given or any of them matches the relative path.
     */
    public static boolean matchesAny(List<PathMatcher> matchers, String relativePath) {
        if (matchers.isEmpty()) {
            return true;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(Paths.get(relativePath))) {
                return true;
            }
        }
        return false;
    }
}
