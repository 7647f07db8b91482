package com.dbus.deviation.diagnostics;

import lombok.Value;

/**
 * One logged problem: where it came from, which stage found it, and what it was.
 */
@Value
public class LedgerEntry {
    String sourceId;
    String stage;
    String code;
    String message;
}
