package io.kneo.messenger.service.auth;

import io.kneo.messenger.model.UserIdentity;

public record Admission(UserIdentity user, long chatId) {

    public long userId() {
        return user.userId();
    }
}
