package org.pubkit.publication.services;

import lombok.Value;

@Value
public class ContentElement {
    String href;
    String role;
    String text;
}
