package com.switchboard.realtime;

public enum ErrorSeverity {
    WARNING,
    ERROR,
    CRITICAL
}
