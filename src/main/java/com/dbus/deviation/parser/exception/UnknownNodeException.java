package com.dbus.deviation.parser.exception;

import com.dbus.deviation.diagnostics.ErrorCode;

/**
 * An element appeared where the grammar does not allow it.
 */
public class UnknownNodeException extends InterfaceParseException {

    private static final long serialVersionUID = 1L;

    private UnknownNodeException(String message) {
        super(message);
    }

    public static UnknownNodeException inContext(String tag, String context) {
        return new UnknownNodeException("Unknown node '" + tag + "' in " + context + ".");
    }

    public static UnknownNodeException atRoot(String tag) {
        return new UnknownNodeException("Unknown root node '" + tag + "'.");
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.UNKNOWN_NODE;
    }
}
