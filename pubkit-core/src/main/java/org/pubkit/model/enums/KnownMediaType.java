package org.pubkit.model.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Getter
public enum KnownMediaType {
    EPUB("application/epub+zip", false, "epub"),
    CBZ("application/vnd.comicbook+zip", false, "cbz"),
    CBR("application/vnd.comicbook-rar", false, "cbr"),
    ZIP("application/zip", false, "zip"),
    OPF("application/oebps-package+xml", false, "opf"),
    NCX("application/x-dtbncx+xml", false, "ncx"),
    XHTML("application/xhtml+xml", false, "xhtml", "xht"),
    HTML("text/html", false, "html", "htm"),
    CSS("text/css", false, "css"),
    JAVASCRIPT("text/javascript", false, "js"),
    SMIL("application/smil+xml", false, "smil"),
    ACBF("application/vnd.comicbook-acbf+xml", false, "acbf"),
    XML("application/xml", false, "xml"),
    JSON("application/json", false, "json"),
    TEXT("text/plain", false, "txt"),
    SVG("image/svg+xml", false, "svg"),
    AVIF("image/avif", true, "avif"),
    BMP("image/bmp", true, "bmp", "dib"),
    GIF("image/gif", true, "gif"),
    JPEG("image/jpeg", true, "jpg", "jpeg", "jpe", "jif", "jfif", "jfi"),
    JXL("image/jxl", true, "jxl"),
    PNG("image/png", true, "png"),
    TIFF("image/tiff", true, "tif", "tiff"),
    WEBP("image/webp", true, "webp"),
    OTF("font/otf", false, "otf"),
    TTF("font/ttf", false, "ttf"),
    WOFF("font/woff", false, "woff"),
    WOFF2("font/woff2", false, "woff2"),
    MP3("audio/mpeg", false, "mp3"),
    MP4_AUDIO("audio/mp4", false, "m4a"),
    PDF("application/pdf", false, "pdf");

    private final String mimeType;
    private final boolean bitmap;
    private final List<String> extensions;

    KnownMediaType(String mimeType, boolean bitmap, String... extensions) {
        this.mimeType = mimeType;
        this.bitmap = bitmap;
        this.extensions = List.of(extensions);
    }

    public static Optional<KnownMediaType> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.extensions.stream().anyMatch(ext -> lower.endsWith("." + ext)))
                .findFirst();
    }

    public static Optional<KnownMediaType> fromMimeType(String mimeType) {
        String normalized = normalize(mimeType);
        if (normalized == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.mimeType.equals(normalized))
                .findFirst();
    }

    /**
     * True when the given media type string denotes a raster image, ignoring case and parameters.
     */
    public static boolean isBitmap(String mimeType) {
        return fromMimeType(mimeType).map(KnownMediaType::isBitmap).orElse(false);
    }

    public boolean isBitmap() {
        return bitmap;
    }

    public boolean matches(String mimeType) {
        return this.mimeType.equals(normalize(mimeType));
    }

    private static String normalize(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return null;
        }
        int paramStart = mimeType.indexOf(';');
        String essence = paramStart >= 0 ? mimeType.substring(0, paramStart) : mimeType;
        return essence.trim().toLowerCase(Locale.ROOT);
    }
}
