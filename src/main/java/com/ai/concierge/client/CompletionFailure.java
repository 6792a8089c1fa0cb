package com.ai.concierge.client;

/**
 * Why a completion call produced no usable text.
 */
public enum CompletionFailure {
    NOT_CONFIGURED,
    TRANSPORT,
    BAD_RESPONSE,
    EMPTY
}
