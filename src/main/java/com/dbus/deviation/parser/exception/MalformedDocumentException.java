package com.dbus.deviation.parser.exception;

import com.dbus.deviation.diagnostics.ErrorCode;

/**
 * The input is not well-formed XML, so no grammar check could run.
 */
public class MalformedDocumentException extends InterfaceParseException {

    private static final long serialVersionUID = 1L;

    public MalformedDocumentException(String detail, Throwable cause) {
        super("Malformed document: " + detail, cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.MALFORMED_DOCUMENT;
    }
}
