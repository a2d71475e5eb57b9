package io.kneo.messenger.model;

public record UserIdentity(long userId, String login) {
}
