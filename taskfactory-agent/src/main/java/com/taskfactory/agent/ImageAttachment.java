package com.taskfactory.agent;

/**
 * Inline image passed along with a message, base64 encoded.
 */
public record ImageAttachment(
    String mimeType,
    String data
) {
}
