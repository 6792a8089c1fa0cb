package com.ai.concierge.client;

import java.util.Map;

/**
 * Vector-similarity search over the FAQ corpus.
 */
public interface RetrievalClient {

    /**
     * @param filter metadata constraints such as {@code intent} and {@code cottage_id}; may be empty
     */
    RetrievalResult search(String query, int k, Map<String, String> filter);
}
