package com.dbus.deviation.parser.exception;

import com.dbus.deviation.diagnostics.ErrorCode;

/**
 * A name collided with a sibling of the same kind.
 */
public class DuplicateNodeException extends InterfaceParseException {

    private static final long serialVersionUID = 1L;

    public DuplicateNodeException(String kindLabel, String qualifiedName) {
        super("Duplicate " + kindLabel + " definition '" + qualifiedName + "'.");
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.DUPLICATE_NODE;
    }
}
