package tech.yump.rotation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import tech.yump.rotation.health.DependentClient;
import tech.yump.rotation.health.HttpDependentClient;
import tech.yump.rotation.notify.LoggingNotificationSink;
import tech.yump.rotation.notify.NotificationSink;
import tech.yump.rotation.notify.WebhookNotificationSink;

/**
 * Outbound HTTP clients: dependents and the notification webhook.
 */
@Configuration
@Slf4j
public class ClientConfiguration {

    @Bean
    public DependentClient dependentClient(RotationProperties properties, RestClient.Builder restClientBuilder) {
        RestClient restClient = restClientBuilder.clone()
                .requestFactory(StoreConfiguration.requestFactory(properties.health().postCheckTimeout()))
                .build();
        return new HttpDependentClient(restClient, properties.dependents());
    }

    @Bean
    public NotificationSink notificationSink(RotationProperties properties,
                                             RestClient.Builder restClientBuilder,
                                             @Qualifier("notificationExecutor") TaskExecutor notificationExecutor) {
        String webhookUrl = properties.notification().webhookUrl();
        if (!StringUtils.hasText(webhookUrl)) {
            log.info("No notification webhook configured (rotation.notification.webhook-url); notifications are logged only.");
            return new LoggingNotificationSink();
        }
        RestClient restClient = restClientBuilder.clone()
                .requestFactory(StoreConfiguration.requestFactory(properties.health().postCheckTimeout()))
                .build();
        return new WebhookNotificationSink(restClient, webhookUrl, notificationExecutor);
    }
}
