package com.vtb.backup.rpo;

import lombok.Value;

import java.time.Instant;

@Value
public class RecoveryPoint {
    Instant timestamp;
    RecoveryPointKind kind;
}
