package com.geodash.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantStatus {
    ACTIVE,
    COMPLETED,
    WITHDRAWN;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
