package org.pubkit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.pubkit.parser.PublicationOpener;
import org.pubkit.parser.epub.EpubParser;
import org.pubkit.parser.image.ImageParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class PublicationParserConfig {

    @Bean
    public EpubParser epubParser(ParserProperties parserProperties) {
        return new EpubParser(parserProperties);
    }

    @Bean
    public ImageParser imageParser() {
        return new ImageParser();
    }

    /**
     * EPUB first: an EPUB is also a ZIP and would otherwise be claimed by the image parser.
     */
    @Bean
    public PublicationOpener publicationOpener(EpubParser epubParser, ImageParser imageParser) {
        return new PublicationOpener(List.of(epubParser, imageParser));
    }

    @Bean
    public ObjectMapper manifestObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }
}
