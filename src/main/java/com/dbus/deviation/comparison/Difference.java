package com.dbus.deviation.comparison;

import lombok.Value;

@Value
public class Difference {
    Severity severity;
    String message;
}
