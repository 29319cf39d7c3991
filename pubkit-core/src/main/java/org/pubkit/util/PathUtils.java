package org.pubkit.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Set;

@UtilityClass
public class PathUtils {

    private static final Set<String> SYSTEM_FILES = Set.of(".ds_store", "thumbs.db", "desktop.ini");
    private static final String MACOS_RESOURCE_FORK_DIR = "__macosx";

    /**
     * Whether an archive entry is OS clutter rather than publication content: dot-files, anything inside a
     * dot-folder or {@code __MACOSX}, and well-known system files.
     */
    public static boolean isHiddenOrSystemFile(String path) {
        if (path == null || path.isEmpty()) {
            return true;
        }
        for (String segment : path.split("/")) {
            String lower = segment.toLowerCase(Locale.ROOT);
            if (lower.startsWith(".") || MACOS_RESOURCE_FORK_DIR.equals(lower) || SYSTEM_FILES.contains(lower)) {
                return true;
            }
        }
        return false;
    }

    public static String extension(String path) {
        if (path == null) {
            return "";
        }
        return FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
    }

    public static String firstComponent(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        int slash = trimmed.indexOf('/');
        return slash >= 0 ? trimmed.substring(0, slash) : trimmed;
    }

    public static String toArchivePath(String entryName) {
        String normalized = entryName.replace('\\', '/');
        return normalized.startsWith("/") ? normalized.substring(1) : normalized;
    }
}
