package org.pubkit.parser.image;

import org.pubkit.model.Link;

import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface TitleGuesser {

    Optional<String> guess(List<Link> links);
}
