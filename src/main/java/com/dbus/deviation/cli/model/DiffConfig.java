package com.dbus.deviation.cli.model;

import java.nio.file.Path;
import java.util.Set;

import com.dbus.deviation.comparison.Severity;

import lombok.Builder;
import lombok.Value;

/**
 * Validated, normalised settings for one diff run.
 */
@Value
@Builder
public class DiffConfig {
    Path oldFile;
    Path newFile;
    Set<Severity> enabledSeverities;
    boolean recover;
    boolean fatalForwards;
}
