package com.dbus.deviation.parser.exception;

import com.dbus.deviation.diagnostics.ErrorCode;

import lombok.Getter;

@Getter
public class MissingAttributeException extends InterfaceParseException {

    private static final long serialVersionUID = 1L;

    private final String attribute;
    private final String elementTag;

    public MissingAttributeException(String attribute, String elementTag) {
        super("Missing required attribute '" + attribute + "' in " + elementTag + ".");
        this.attribute = attribute;
        this.elementTag = elementTag;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.MISSING_ATTRIBUTE;
    }
}
