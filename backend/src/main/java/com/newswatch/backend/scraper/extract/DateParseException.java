package com.newswatch.backend.scraper.extract;

/**
 * Thrown when a publish date text matches none of the recognised patterns.
 */
public class DateParseException extends Exception {

    private final String text;

    public DateParseException(String text) {
        super("Unrecognised date text: '" + text + "'");
        this.text = text;
    }

    public DateParseException(String text, Throwable cause) {
        super("Invalid date text: '" + text + "'", cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
