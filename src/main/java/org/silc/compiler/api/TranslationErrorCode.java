package org.silc.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during translation.
 * This decouples the test logic and the HTTP layer from the message texts.
 */
public enum TranslationErrorCode {
    // region Parser Errors
    /** The source text could not be parsed at all. */
    SYNTAX_ERROR,
    // endregion

    // region Lowering Errors
    /** A syntax-tree node kind outside the supported grammar was found. */
    UNSUPPORTED_CONSTRUCT,
    /** An operator outside the supported set for its expression kind was found. */
    UNSUPPORTED_OPERATOR,
    /** The left side of an assignment is not a plain variable. */
    INVALID_ASSIGNMENT_TARGET,
    // endregion

    // region Emission Errors
    /** A branch without its test, or a jump/label pair that is not properly nested. */
    MALFORMED_CONTROL_FLOW
    // endregion
}
