package org.pubkit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pubkit")
@Getter
@Setter
public class ParserProperties {
    private Positions positions = new Positions();
    private Content content = new Content();

    @Getter
    @Setter
    public static class Positions {
        /**
         * Bytes of a reflowable resource counted as one position.
         */
        private int pageLength = 1024;
    }

    @Getter
    @Setter
    public static class Content {
        /**
         * Extract text from HTML reading order resources.
         */
        private boolean htmlEnabled = true;
    }
}
