package com.dbus.deviation.parser.exception;

import com.dbus.deviation.diagnostics.ErrorCode;

/**
 * Base for every grammar violation found while parsing an introspection document.
 * Each subclass corresponds to exactly one {@link ErrorCode}.
 */
public abstract class InterfaceParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected InterfaceParseException(String message) {
        super(message);
    }

    protected InterfaceParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getErrorCode();
}
