package tech.yump.rotation.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no webhook is configured: notifications only go to the application log.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(RotationNotification notification) {
        switch (notification.level()) {
            case CRITICAL -> log.error("ROTATION_NOTIFICATION [{}] job={} class={} outcome={}: {}", notification.level(),
                    notification.jobId(), notification.classId(), notification.outcome(), notification.message());
            case WARNING -> log.warn("ROTATION_NOTIFICATION [{}] job={} class={} outcome={}: {}", notification.level(),
                    notification.jobId(), notification.classId(), notification.outcome(), notification.message());
            default -> log.info("ROTATION_NOTIFICATION [{}] job={} class={} outcome={}: {}", notification.level(),
                    notification.jobId(), notification.classId(), notification.outcome(), notification.message());
        }
    }
}
