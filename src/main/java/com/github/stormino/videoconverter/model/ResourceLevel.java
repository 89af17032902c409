package com.github.stormino.videoconverter.model;

public enum ResourceLevel {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
