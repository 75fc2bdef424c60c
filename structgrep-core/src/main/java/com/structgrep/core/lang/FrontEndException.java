package com.structgrep.core.lang;

/**
 * Raised when a front end cannot parse a target file or a pattern.
 */
public class FrontEndException extends RuntimeException {

    private final String language;

    public FrontEndException(String language, String message) {
        super(message);
        this.language = language;
    }

    public FrontEndException(String language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
