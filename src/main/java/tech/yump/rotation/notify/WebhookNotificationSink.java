package tech.yump.rotation.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts notifications as JSON to {@code rotation.notification.webhook-url} on a background
 * executor. Delivery failures are logged and dropped.
 */
@Slf4j
public class WebhookNotificationSink implements NotificationSink {

    private final RestClient restClient;
    private final String webhookUrl;
    private final TaskExecutor executor;

    public WebhookNotificationSink(RestClient restClient, String webhookUrl, TaskExecutor executor) {
        this.restClient = restClient;
        this.webhookUrl = webhookUrl;
        this.executor = executor;
        log.info("Webhook notifications enabled, target: {}", webhookUrl);
    }

    @Override
    public void send(RotationNotification notification) {
        try {
            executor.execute(() -> deliver(notification));
        } catch (TaskRejectedException e) {
            log.warn("Notification for job {} dropped, executor saturated: {}", notification.jobId(), e.getMessage());
        }
    }

    void deliver(RotationNotification notification) {
        try {
            restClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(notification)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Notification delivered for job {} ({})", notification.jobId(), notification.outcome());
        } catch (RestClientException e) {
            log.warn("Failed to deliver notification for job {} ({}) to webhook: {}",
                    notification.jobId(), notification.outcome(), e.getMessage());
        }
    }
}
