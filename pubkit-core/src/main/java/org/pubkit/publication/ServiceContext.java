package org.pubkit.publication;

import lombok.Value;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.model.Manifest;

@Value
public class ServiceContext {
    Manifest manifest;
    Fetcher fetcher;
}
