package org.pubkit.util;

import lombok.experimental.UtilityClass;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Resolution of relative hrefs found in package, NCX and navigation documents against the path of the
 * document that declares them. Results are container-relative paths without a leading slash.
 */
@UtilityClass
public class HrefUtils {

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    public static String resolve(String basePath, String href) {
        if (href == null || href.isEmpty()) {
            return href;
        }
        if (isAbsoluteUrl(href)) {
            return href;
        }

        String fragment = "";
        String path = href;
        int hashIdx = href.indexOf('#');
        if (hashIdx >= 0) {
            fragment = href.substring(hashIdx);
            path = href.substring(0, hashIdx);
        }
        if (path.isEmpty()) {
            return stripFragment(basePath) + fragment;
        }

        String combined = path.startsWith("/") ? path.substring(1) : directoryOf(basePath) + path;
        return normalize(decode(combined)) + fragment;
    }

    public static String directoryOf(String path) {
        if (path == null) {
            return "";
        }
        int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(0, lastSlash + 1) : "";
    }

    public static String stripFragment(String href) {
        if (href == null) {
            return null;
        }
        int cut = href.length();
        int hashIdx = href.indexOf('#');
        if (hashIdx >= 0) {
            cut = hashIdx;
        }
        int queryIdx = href.indexOf('?');
        if (queryIdx >= 0 && queryIdx < cut) {
            cut = queryIdx;
        }
        String path = href.substring(0, cut);
        return path.startsWith("/") ? path.substring(1) : path;
    }

    public static boolean isAbsoluteUrl(String href) {
        return SCHEME_PATTERN.matcher(href).find();
    }

    private static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        String joined = String.join("/", segments);
        return path.endsWith("/") && !joined.isEmpty() ? joined + "/" : joined;
    }

    private static String decode(String path) {
        if (path.indexOf('%') < 0) {
            return path;
        }
        try {
            // '+' is a literal in paths, not an encoded space
            return URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return path;
        }
    }
}
