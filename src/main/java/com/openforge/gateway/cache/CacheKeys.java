package com.openforge.gateway.cache;

import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;

/**
 * Builds response-cache keys from the shape of a request.
 *
 * Layout: agentId | model | role | text | role | text ...
 * Every field is written as {@code length:value}, so separators inside a
 * message cannot make two different requests share a key.  A null field is
 * written as {@code -}.  Message text is cut to {@link #MAX_CONTENT_CHARS}
 * characters to bound key size.
 */
public final class CacheKeys {

    public static final int MAX_CONTENT_CHARS = 500;

    private CacheKeys() {}

    /** {@code request} must already carry its resolved model. */
    public static String of(CompletionRequest request) {
        StringBuilder key = new StringBuilder();
        field(key, request.agentId());
        field(key.append('|'), request.model());
        for (Message message : request.messages()) {
            String content = message.content();
            if (content != null && content.length() > MAX_CONTENT_CHARS) {
                content = content.substring(0, MAX_CONTENT_CHARS);
            }
            field(key.append('|'), message.role());
            field(key.append('|'), content);
        }
        return key.toString();
    }

    private static void field(StringBuilder key, String value) {
        if (value == null) {
            key.append('-');
            return;
        }
        key.append(value.length()).append(':').append(value);
    }
}
