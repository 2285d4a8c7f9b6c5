package com.geodash.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FinishStatus {
    NONE,
    PROVISIONAL,
    FINAL;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
