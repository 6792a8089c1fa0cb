package com.ai.concierge.client;

public enum RetrievalFailure {
    TRANSPORT,
    BAD_RESPONSE
}
