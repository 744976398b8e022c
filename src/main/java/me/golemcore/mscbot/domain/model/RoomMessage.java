package me.golemcore.mscbot.domain.model;

/**
 * Text event received in a chat room.
 *
 * @param msgtype
 *            transport message type, e.g. {@code m.text}
 */
public record RoomMessage(String roomId, String senderId, String msgtype, String body) {

    public static final String MSGTYPE_TEXT = "m.text";

    public boolean isText() {
        return MSGTYPE_TEXT.equals(msgtype);
    }
}
