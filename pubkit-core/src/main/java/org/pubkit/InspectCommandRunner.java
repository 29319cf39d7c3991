package org.pubkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pubkit.exception.PublicationParseException;
import org.pubkit.parser.PublicationOpener;
import org.pubkit.publication.Publication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Prints the manifest of every publication file given on the command line as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InspectCommandRunner implements CommandLineRunner {

    private final PublicationOpener publicationOpener;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) {
        List<String> files = Stream.of(args)
                .filter(arg -> !arg.startsWith("--"))
                .toList();
        if (files.isEmpty()) {
            log.info("Usage: java -jar pubkit-core.jar <publication file>...");
            return;
        }
        for (String file : files) {
            inspect(Path.of(file), System.out);
        }
    }

    void inspect(Path file, PrintStream out) {
        try (Publication publication = publicationOpener.open(file)) {
            out.println(objectMapper.writeValueAsString(publication.getManifest()));
            log.info("{}: {} reading order items, {} positions", file.getFileName(),
                    publication.getManifest().getReadingOrder().size(), publication.positions().size());
        } catch (PublicationParseException e) {
            log.error("Cannot open {}: {}", file, e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize the manifest of {}", file, e);
        } catch (IOException e) {
            log.warn("Error closing {}: {}", file, e.getMessage());
        }
    }
}
