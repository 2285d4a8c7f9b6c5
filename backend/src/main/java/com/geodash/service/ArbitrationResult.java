package com.geodash.service;

public record ArbitrationResult(FinishResolutionState state, boolean changed) {
}
