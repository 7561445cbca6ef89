package org.dxworks.scoreframe.convert;

/**
 * A structural invariant was broken during import or export, e.g. a span referencing an identity
 * that was never emitted. Always fatal for the conversion.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
