package org.pubkit.parser.image;

import org.apache.commons.lang3.StringUtils;
import org.pubkit.model.Link;
import org.pubkit.util.PathUtils;

import java.util.List;
import java.util.Optional;

/**
 * Uses the name of the single top-level folder holding every content file, as produced by zipping a folder
 * named after the book.
 */
public class FileStructureTitleGuesser implements TitleGuesser {

    @Override
    public Optional<String> guess(List<Link> links) {
        String folder = null;
        boolean any = false;
        for (Link link : links) {
            String href = link.getHref();
            if (PathUtils.isHiddenOrSystemFile(href)) {
                continue;
            }
            String first = PathUtils.firstComponent(href);
            if (first.equals(StringUtils.removeStart(href, "/"))) {
                // file at the archive root
                return Optional.empty();
            }
            if (folder == null) {
                folder = first;
            } else if (!folder.equals(first)) {
                return Optional.empty();
            }
            any = true;
        }
        return any && StringUtils.isNotBlank(folder) ? Optional.of(folder) : Optional.empty();
    }
}
