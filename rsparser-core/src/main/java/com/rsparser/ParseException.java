package com.rsparser;

import com.rsparser.token.Span;

/**
 * A syntax error: a message and the position it applies to.
 */
public class ParseException extends RuntimeException {

    public static final String SYNTAX_ERROR = "SyntaxError";
    public static final String LEX_ERROR = "LexError";
    public static final String UNSUPPORTED = "Unsupported";

    private final String errorType;
    private final Span span;
    private final String rawMessage;

    public ParseException(String errorType, Span span, String message) {
        super(formatMessage(errorType, span, message));
        this.errorType = errorType;
        this.span = span;
        this.rawMessage = message;
    }

    private static String formatMessage(String errorType, Span span, String message) {
        if (span == null || span == Span.CALL_SITE) {
            return errorType + ": " + message;
        }
        return errorType + " at line " + span.line() + ", column " + span.column() + ": " + message;
    }

    public String getErrorType() {
        return errorType;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * The message without type and position.
     */
    public String getRawMessage() {
        return rawMessage;
    }
}
