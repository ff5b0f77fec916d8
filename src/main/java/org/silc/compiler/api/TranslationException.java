package org.silc.compiler.api;

/**
 * An exception that is thrown when translation fails.
 * <p>
 * It is part of the public API. Every failure is terminal for the call that raised it: no partial
 * instruction sequence or text is returned alongside it.
 */
public class TranslationException extends Exception {

    private final TranslationErrorCode errorCode;
    private final String subject;

    /**
     * Constructs a new translation exception.
     * @param errorCode The category of the failure.
     * @param subject The offending node kind, operator or label.
     * @param message The detail message.
     */
    public TranslationException(TranslationErrorCode errorCode, String subject, String message) {
        this(errorCode, subject, message, null);
    }

    /**
     * Constructs a new translation exception with a cause.
     * @param errorCode The category of the failure.
     * @param subject The offending node kind, operator or label.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranslationException(TranslationErrorCode errorCode, String subject, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.subject = subject;
    }

    /**
     * @return The category of the failure.
     */
    public TranslationErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The offending node kind, operator or label.
     */
    public String getSubject() {
        return subject;
    }

    public static TranslationException unsupportedConstruct(String kind) {
        return new TranslationException(TranslationErrorCode.UNSUPPORTED_CONSTRUCT, kind,
                "Unsupported construct: " + kind);
    }

    public static TranslationException unsupportedOperator(String operator, String kind) {
        return new TranslationException(TranslationErrorCode.UNSUPPORTED_OPERATOR, operator,
                "Unsupported operator '" + operator + "' in " + kind);
    }

    public static TranslationException invalidAssignmentTarget(String kind) {
        return new TranslationException(TranslationErrorCode.INVALID_ASSIGNMENT_TARGET, kind,
                "Invalid assignment target: " + kind);
    }

    public static TranslationException malformedControlFlow(String label, String detail) {
        return new TranslationException(TranslationErrorCode.MALFORMED_CONTROL_FLOW, label,
                "Malformed control flow at " + label + ": " + detail);
    }
}
