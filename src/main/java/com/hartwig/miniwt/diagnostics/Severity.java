package com.hartwig.miniwt.diagnostics;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
