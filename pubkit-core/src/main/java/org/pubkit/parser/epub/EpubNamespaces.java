package org.pubkit.parser.epub;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Namespace URIs of the EPUB vocabularies and the prefix bindings each document is queried with.
 */
@UtilityClass
public class EpubNamespaces {

    public static final String CONTAINER = "urn:oasis:names:tc:opendocument:xmlns:container";
    public static final String OPF = "http://www.idpf.org/2007/opf";
    public static final String DC = "http://purl.org/dc/elements/1.1/";
    public static final String DCTERMS = "http://purl.org/dc/terms/";
    public static final String RENDITION = "http://www.idpf.org/2013/rendition";
    public static final String NCX = "http://www.daisy.org/z3986/2005/ncx/";
    public static final String XHTML = "http://www.w3.org/1999/xhtml";
    public static final String OPS = "http://www.idpf.org/2007/ops";
    public static final String ENC = "http://www.w3.org/2001/04/xmlenc#";
    public static final String SIG = "http://www.w3.org/2000/09/xmldsig#";
    public static final String COMP = "http://www.idpf.org/2016/encryption#compression";

    public static final Map<String, String> CONTAINER_BINDINGS = Map.of("cn", CONTAINER);

    public static final Map<String, String> PACKAGE_BINDINGS = Map.of(
            "opf", OPF,
            "dc", DC,
            "dcterms", DCTERMS,
            "rendition", RENDITION);

    public static final Map<String, String> NCX_BINDINGS = Map.of("ncx", NCX);

    public static final Map<String, String> NAVIGATION_BINDINGS = Map.of(
            "html", XHTML,
            "epub", OPS);

    public static final Map<String, String> ENCRYPTION_BINDINGS = Map.of(
            "enc", ENC,
            "ds", SIG,
            "comp", COMP);
}
