package tech.yump.rotation.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookNotificationSinkTest {

    private static final String WEBHOOK = "http://hooks.internal/rotation";

    private MockRestServiceServer server;
    private RestClient restClient;
    private final RotationNotification notification = new RotationNotification("job-1", "database", "FAILED",
            RotationNotification.Level.CRITICAL, "CONFLICT: active version changed", Instant.parse("2026-01-15T10:00:00Z"));

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    @DisplayName("Notifications are posted as JSON to the webhook")
    void postsNotification() {
        server.expect(requestTo(WEBHOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.class_id").value("database"))
                .andExpect(jsonPath("$.outcome").value("FAILED"))
                .andExpect(jsonPath("$.level").value("critical"))
                .andRespond(withSuccess());

        new WebhookNotificationSink(restClient, WEBHOOK, new SyncTaskExecutor()).send(notification);

        server.verify();
    }

    @Test
    @DisplayName("Delivery failures are logged, not thrown")
    void deliveryFailureIsSwallowedIntoLog() {
        server.expect(requestTo(WEBHOOK)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        WebhookNotificationSink sink = new WebhookNotificationSink(restClient, WEBHOOK, new SyncTaskExecutor());

        assertThatCode(() -> sink.deliver(notification)).doesNotThrowAnyException();
        server.verify();
    }

    @Test
    @DisplayName("A saturated executor drops the notification without failing the caller")
    void saturatedExecutor() {
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("full");
        };
        WebhookNotificationSink sink = new WebhookNotificationSink(restClient, WEBHOOK, rejecting);

        assertThatCode(() -> sink.send(notification)).doesNotThrowAnyException();
    }
}
