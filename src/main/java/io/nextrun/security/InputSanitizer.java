package io.nextrun.security;

import org.springframework.stereotype.Component;

/**
 * Cleans instructions received from callers before they reach the reasoning engine.
 */
@Component
public class InputSanitizer {

    static final int MAX_INPUT_LENGTH = 10_000;

    /**
     * Removes control characters (keeping newlines and tabs) and truncates overly long input.
     *
     * @param content the raw input
     * @return sanitized input, empty for null
     */
    public String sanitize(String content) {
        if (content == null) return "";

        String cleaned = content.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        if (cleaned.length() > MAX_INPUT_LENGTH) {
            cleaned = cleaned.substring(0, MAX_INPUT_LENGTH) + "... [truncated]";
        }
        return cleaned;
    }
}
