package io.kneo.messenger.repository.table;

public class MessengerNameResolver {
    public static final String CHAT_MESSAGE = "chat message";
    public static final String PARTICIPANT = "participant";
    public static final String READ_WATERMARK = "read watermark";

    private static final String CHAT_MESSAGE_TABLE_NAME = "messenger__messages";
    private static final String PARTICIPANT_TABLE_NAME = "messenger__chat_participants";
    private static final String READ_WATERMARK_TABLE_NAME = "messenger__read_watermarks";

    public EntityData getEntityNames(String type) {
        return switch (type) {
            case CHAT_MESSAGE -> new EntityData(CHAT_MESSAGE_TABLE_NAME);
            case PARTICIPANT -> new EntityData(PARTICIPANT_TABLE_NAME);
            case READ_WATERMARK -> new EntityData(READ_WATERMARK_TABLE_NAME);
            default -> throw new IllegalArgumentException("Unknown entity type: " + type);
        };
    }

    public static MessengerNameResolver create() {
        return new MessengerNameResolver();
    }

    public record EntityData(String tableName) {
        public String getTableName() {
            return tableName;
        }
    }
}
