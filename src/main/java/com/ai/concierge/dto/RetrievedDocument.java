package com.ai.concierge.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A passage returned by the retrieval service, or synthesized locally
 * (pricing and capacity analyses) and placed ahead of retrieved passages.
 */
public record RetrievedDocument(String content, Map<String, Object> metadata, double score) {

    public RetrievedDocument {
        content = content == null ? "" : content;
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public static RetrievedDocument of(String content, Map<String, Object> metadata) {
        return new RetrievedDocument(content, metadata, 1.0);
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    public String source() {
        String source = metadataString("source");
        return source != null ? source : "unknown";
    }
}
