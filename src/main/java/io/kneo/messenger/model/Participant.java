package io.kneo.messenger.model;

import io.kneo.messenger.model.cnst.ParticipantRole;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
public class Participant {
    private long chatId;
    private long userId;
    private ParticipantRole role;
    private LocalDateTime joinedAt;
    private LocalDateTime leftAt;

    public boolean isActive() {
        return leftAt == null;
    }
}
