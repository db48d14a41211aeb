package com.vtb.backup.models;

public enum SecurityLevel {
    ENHANCED,
    STANDARD
}
