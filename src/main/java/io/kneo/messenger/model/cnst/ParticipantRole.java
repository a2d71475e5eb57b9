package io.kneo.messenger.model.cnst;

public enum ParticipantRole {
    OWNER,
    MEMBER;
}
