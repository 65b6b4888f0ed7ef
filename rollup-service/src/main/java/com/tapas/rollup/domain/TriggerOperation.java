package com.tapas.rollup.domain;

public enum TriggerOperation {
    INSERT,
    UPDATE,
    DELETE,
    UNDELETE
}
