package org.tessera.junit.extensions.logging;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
