package tech.yump.rotation.notify;

/**
 * Best-effort delivery of rotation outcomes. Implementations must never throw and must not block
 * the rotation that triggered them.
 */
public interface NotificationSink {

    void send(RotationNotification notification);
}
