package io.kneo.messenger.dto.cnst;

import java.util.Arrays;
import java.util.Optional;

public enum FrameType {
    MESSAGE("message"),
    READ("read"),
    ERROR("error");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<FrameType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
