package org.pubkit.fetcher;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.UnicodePathExtraField;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.pubkit.model.Link;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.util.HrefUtils;
import org.pubkit.util.PathUtils;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ZipArchiveFetcher implements Fetcher {

    // The last encoding is accepted as is; CP437 maps every byte
    private static final Charset[] ENCODINGS_TO_TRY = {
            StandardCharsets.UTF_8,
            Charset.forName("CP437")
    };

    private final ZipFile zipFile;
    private final Map<String, ZipArchiveEntry> entriesByHref = new LinkedHashMap<>();

    private ZipArchiveFetcher(ZipFile zipFile) {
        this.zipFile = zipFile;
        for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
            if (!entry.isDirectory()) {
                entriesByHref.putIfAbsent(PathUtils.toArchivePath(entry.getName()), entry);
            }
        }
    }

    public static ZipArchiveFetcher open(Path archivePath) throws IOException {
        for (int i = 0; i < ENCODINGS_TO_TRY.length; i++) {
            Charset encoding = ENCODINGS_TO_TRY[i];
            ZipFile zipFile = ZipFile.builder()
                    .setPath(archivePath)
                    .setCharset(encoding)
                    .setUseUnicodeExtraFields(true)
                    .get();
            if (i == ENCODINGS_TO_TRY.length - 1 || namesDecodeAs(zipFile, encoding)) {
                return new ZipArchiveFetcher(zipFile);
            }
            log.debug("Entry names of {} are not valid {}, trying next encoding", archivePath.getFileName(), encoding);
            zipFile.close();
        }
        throw new IllegalStateException("No ZIP encodings configured");
    }

    private static boolean namesDecodeAs(ZipFile zipFile, Charset encoding) {
        CharsetDecoder decoder = encoding.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
            if (entry.getGeneralPurposeBit().usesUTF8ForNames()
                    || entry.getExtraField(UnicodePathExtraField.UPATH_ID) != null) {
                continue;
            }
            try {
                decoder.reset().decode(ByteBuffer.wrap(entry.getRawName()));
            } catch (CharacterCodingException e) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Link> links() {
        List<Link> links = new ArrayList<>(entriesByHref.size());
        for (String href : entriesByHref.keySet()) {
            links.add(Link.builder()
                    .href(href)
                    .type(KnownMediaType.fromFileName(href).map(KnownMediaType::getMimeType).orElse(null))
                    .build());
        }
        return links;
    }

    @Override
    public Resource get(Link link) {
        String href = HrefUtils.stripFragment(link.getHref());
        ZipArchiveEntry entry = href == null ? null : entriesByHref.get(href);
        if (entry == null) {
            return new FailureResource(link, new FileNotFoundException("Entry not found: " + link.getHref()));
        }
        return new EntryResource(link, entry);
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }

    private class EntryResource implements Resource {

        private final Link link;
        private final ZipArchiveEntry entry;

        EntryResource(Link link, ZipArchiveEntry entry) {
            this.link = link;
            this.entry = entry;
        }

        @Override
        public Link getLink() {
            return link;
        }

        @Override
        public long length() throws IOException {
            long size = entry.getSize();
            return size >= 0 ? size : read().length;
        }

        @Override
        public byte[] read() throws IOException {
            try (InputStream in = zipFile.getInputStream(entry)) {
                return IOUtils.toByteArray(in);
            }
        }
    }
}
