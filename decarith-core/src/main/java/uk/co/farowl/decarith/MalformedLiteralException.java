// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

/**
 * Thrown when text cannot be parsed as a decimal value. It is a
 * {@code NumberFormatException}, so callers that already guard
 * {@code new BigDecimal(String)} need not change.
 */
public class MalformedLiteralException extends NumberFormatException {
    private static final long serialVersionUID = 1L;

    /** The text that could not be parsed (may be {@code null}). */
    private final String literal;

    /**
     * Constructor specifying the offending text.
     *
     * @param literal that could not be parsed
     */
    public MalformedLiteralException(String literal) {
        super(String.format(MALFORMED, literal));
        this.literal = literal;
    }

    /**
     * Constructor specifying the offending text and the exception
     * raised while parsing it.
     *
     * @param literal that could not be parsed
     * @param cause reported by the parser
     */
    public MalformedLiteralException(String literal, Throwable cause) {
        this(literal);
        initCause(cause);
    }

    /**
     * @return the text that could not be parsed
     */
    public String getLiteral() { return literal; }

    private static final String MALFORMED =
            "invalid literal for decimal: '%.100s'";
}
