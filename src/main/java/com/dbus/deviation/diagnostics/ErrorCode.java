package com.dbus.deviation.diagnostics;

import lombok.Getter;

/**
 * Stable identifiers for every error condition the parser can report.
 * Tooling matches on {@link #getCode()}, never on message text.
 */
@Getter
public enum ErrorCode {
    UNKNOWN_NODE("unknown-node"),
    MISSING_ATTRIBUTE("missing-attribute"),
    DUPLICATE_NODE("duplicate-node"),
    MALFORMED_DOCUMENT("malformed-document");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }
}
