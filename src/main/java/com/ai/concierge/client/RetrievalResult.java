package com.ai.concierge.client;

import com.ai.concierge.dto.RetrievedDocument;

import java.util.List;

/**
 * Outcome of a retrieval call. An empty successful result means nothing matched;
 * a failure means the service could not be asked.
 */
public record RetrievalResult(boolean success, List<RetrievedDocument> documents, RetrievalFailure failure, String message) {

    public RetrievalResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    public static RetrievalResult of(List<RetrievedDocument> documents) {
        return new RetrievalResult(true, documents, null, null);
    }

    public static RetrievalResult failure(RetrievalFailure failure, String message) {
        return new RetrievalResult(false, List.of(), failure, message);
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
