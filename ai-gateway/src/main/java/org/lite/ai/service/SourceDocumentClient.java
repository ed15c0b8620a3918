package org.lite.ai.service;

import org.lite.ai.dto.SourceDocument;
import reactor.core.publisher.Mono;

/**
 * Read-only access to the text of domain entities owned by the surrounding application.
 */
public interface SourceDocumentClient {

    /**
     * @return the entity's text and last update time; errors with IllegalArgumentException when the
     * entity does not exist
     */
    Mono<SourceDocument> fetch(String entityType, String entityId);
}
