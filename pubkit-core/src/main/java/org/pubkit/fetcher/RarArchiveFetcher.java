package org.pubkit.fetcher;

import com.github.junrar.Archive;
import com.github.junrar.exception.RarException;
import com.github.junrar.rarfile.FileHeader;
import lombok.extern.slf4j.Slf4j;
import org.pubkit.model.Link;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.util.HrefUtils;
import org.pubkit.util.PathUtils;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to RAR (CBR) archives. junrar extracts sequentially, so reads are serialized on the archive.
 */
@Slf4j
public class RarArchiveFetcher implements Fetcher {

    private final Archive archive;
    private final Map<String, FileHeader> headersByHref = new LinkedHashMap<>();

    private RarArchiveFetcher(Archive archive) {
        this.archive = archive;
        for (FileHeader header : archive.getFileHeaders()) {
            if (!header.isDirectory()) {
                headersByHref.put(PathUtils.toArchivePath(header.getFileName()), header);
            }
        }
    }

    public static RarArchiveFetcher open(Path archivePath) throws IOException {
        try {
            return new RarArchiveFetcher(new Archive(archivePath.toFile()));
        } catch (RarException e) {
            throw new IOException("Failed to read RAR archive: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Link> links() {
        List<Link> links = new ArrayList<>(headersByHref.size());
        for (String href : headersByHref.keySet()) {
            links.add(Link.builder()
                    .href(href)
                    .type(KnownMediaType.fromFileName(href).map(KnownMediaType::getMimeType).orElse(null))
                    .build());
        }
        return links;
    }

    @Override
    public Resource get(Link link) {
        FileHeader header = headersByHref.get(HrefUtils.stripFragment(link.getHref()));
        if (header == null) {
            return new FailureResource(link, new FileNotFoundException("Entry not found in RAR archive: " + link.getHref()));
        }
        return new Resource() {
            @Override
            public Link getLink() {
                return link;
            }

            @Override
            public long length() {
                return header.getFullUnpackSize();
            }

            @Override
            public byte[] read() throws IOException {
                return extract(header);
            }
        };
    }

    private byte[] extract(FileHeader header) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        synchronized (archive) {
            try {
                archive.extractFile(header, out);
            } catch (RarException e) {
                throw new IOException("Failed to extract " + header.getFileName() + ": " + e.getMessage(), e);
            }
        }
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
