package com.tubearchive.archiver.engine;

import java.util.Optional;

/**
 * The unreliable extraction layer. An empty result means the layer finished
 * without returning anything usable.
 */
public interface MediaExtractor {

    Optional<ExtractorOutput> extract(String url, ExtractionRequest request) throws ExtractionException;
}
