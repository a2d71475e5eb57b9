package io.kneo.messenger.service.read;

public enum ReadOutcome {
    ADVANCED,
    UNCHANGED;
}
