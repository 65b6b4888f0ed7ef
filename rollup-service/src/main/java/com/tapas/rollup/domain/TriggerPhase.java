package com.tapas.rollup.domain;

public enum TriggerPhase {
    BEFORE,
    AFTER
}
