package org.pubkit.parser.epub;

final class EpubFixtures {

    static final String OPF_EPUB2 = """
            <?xml version="1.0" encoding="UTF-8"?>
            <package xmlns="http://www.idpf.org/2007/opf" version="2.0" unique-identifier="bookid">
              <metadata xmlns:dc="http://purl.org/dc/elements/1.1/" xmlns:opf="http://www.idpf.org/2007/opf">
                <dc:title>The Legacy Book</dc:title>
                <dc:creator opf:role="aut">Jane Doe</dc:creator>
                <dc:language>en</dc:language>
                <dc:identifier id="isbn">urn:isbn:9780000000001</dc:identifier>
                <dc:identifier id="bookid">urn:uuid:0f2c8a4e-3b1d-4c5e-9a7f-112233445566</dc:identifier>
                <meta name="cover" content="cover-img"/>
              </metadata>
              <manifest>
                <item id="ncx" href="toc.ncx" media-type="application/x-dtbncx+xml"/>
                <item id="cover-img" href="Images/cover.jpg" media-type="image/jpeg"/>
                <item id="ch1" href="Text/chapter1.xhtml" media-type="application/xhtml+xml"/>
                <item id="ch2" href="Text/chapter2.xhtml" media-type="application/xhtml+xml"/>
                <item id="notes" href="Text/notes.xhtml" media-type="application/xhtml+xml"/>
                <item id="font" href="Fonts/serif.otf" media-type="font/otf"/>
              </manifest>
              <spine toc="ncx">
                <itemref idref="ch1"/>
                <itemref idref="notes" linear="no"/>
                <itemref idref="ch2"/>
              </spine>
            </package>
            """;

    static final String NCX = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE ncx PUBLIC "-//NISO//DTD ncx 2005-1//EN" "http://www.daisy.org/z3986/2005/ncx-2005-1.dtd">
            <ncx xmlns="http://www.daisy.org/z3986/2005/ncx/" version="2005-1">
              <navMap>
                <navPoint id="p1" playOrder="1">
                  <navLabel><text>Chapter 1</text></navLabel>
                  <content src="Text/chapter1.xhtml"/>
                  <navPoint id="p1-1" playOrder="2">
                    <navLabel><text>Section 1.1</text></navLabel>
                    <content src="Text/chapter1.xhtml#s1"/>
                  </navPoint>
                </navPoint>
                <navPoint id="p2" playOrder="3">
                  <navLabel><text>Chapter 2</text></navLabel>
                  <content src="Text/chapter2.xhtml"/>
                </navPoint>
              </navMap>
              <pageList>
                <pageTarget id="pg1" type="normal" value="1">
                  <navLabel><text>1</text></navLabel>
                  <content src="Text/chapter1.xhtml#page1"/>
                </pageTarget>
              </pageList>
            </ncx>
            """;

    static final String OPF_EPUB3 = """
            <?xml version="1.0" encoding="UTF-8"?>
            <package xmlns="http://www.idpf.org/2007/opf" version="3.0" unique-identifier="uid" prefix="rendition: http://www.idpf.org/vocab/rendition/#">
              <metadata xmlns:dc="http://purl.org/dc/elements/1.1/">
                <dc:identifier id="uid">urn:uuid:12345678-1234-1234-1234-123456789abc</dc:identifier>
                <dc:title id="t1">The Modern Book</dc:title>
                <dc:title id="t2">A Subtitle</dc:title>
                <meta refines="#t2" property="title-type">subtitle</meta>
                <dc:creator>John Roe</dc:creator>
                <dc:language>fr</dc:language>
                <dc:publisher>Acme</dc:publisher>
                <meta property="dcterms:modified">2020-01-01T00:00:00Z</meta>
                <meta property="rendition:layout">pre-paginated</meta>
                <meta property="rendition:spread">landscape</meta>
              </metadata>
              <manifest>
                <item id="nav" href="nav.xhtml" media-type="application/xhtml+xml" properties="nav"/>
                <item id="ncx" href="toc.ncx" media-type="application/x-dtbncx+xml"/>
                <item id="cover" href="images/cover.png" media-type="image/png" properties="cover-image"/>
                <item id="p1" href="page1.xhtml" media-type="application/xhtml+xml" properties="svg scripted" media-overlay="p1-smil"/>
                <item id="p2" href="page2.xhtml" media-type="application/xhtml+xml"/>
                <item id="p1-smil" href="page1.smil" media-type="application/smil+xml"/>
                <item id="font" href="fonts/sans.otf" media-type="font/otf"/>
              </manifest>
              <spine page-progression-direction="rtl">
                <itemref idref="p1" properties="page-spread-right"/>
                <itemref idref="p2" properties="rendition:page-spread-left rendition:layout-reflowable"/>
              </spine>
            </package>
            """;

    static final String NAV = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE html>
            <html xmlns="http://www.w3.org/1999/xhtml" xmlns:epub="http://www.idpf.org/2007/ops">
              <body>
                <nav epub:type="toc">
                  <ol>
                    <li><a href="page1.xhtml">Page One</a>
                      <ol>
                        <li><a href="page1.xhtml#panel2">Panel 2</a></li>
                      </ol>
                    </li>
                    <li><span>Part II</span>
                      <ol>
                        <li><a href="page2.xhtml">Page Two</a></li>
                      </ol>
                    </li>
                  </ol>
                </nav>
                <nav epub:type="landmarks">
                  <ol>
                    <li><a epub:type="bodymatter" href="page1.xhtml">Start</a></li>
                  </ol>
                </nav>
                <nav epub:type="toc">
                  <ol><li><a href="ignored.xhtml">Second toc</a></li></ol>
                </nav>
              </body>
            </html>
            """;

    private EpubFixtures() {
    }
}
