package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.notification.AlertSummary;
import com.wangbin.alerting.core.notification.DeliveryResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Instant;
import java.util.List;

import static com.wangbin.alerting.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EmailNotificationTransportTest {

    private final AlertingProperties properties = new AlertingProperties();
    private final NotificationChannel channel = NotificationChannel.builder()
            .type(ChannelType.EMAIL)
            .enabled(true)
            .recipients(List.of("ops@example.com", "oncall@example.com"))
            .build();
    private final AlertSummary summary;

    EmailNotificationTransportTest() {
        Alert alert = alert(AlertType.BUSINESS, "conversion_rate", AlertSeverity.HIGH,
                Instant.parse("2024-05-01T10:00:00Z"));
        alert.setTitle("Low conversion rate");
        summary = AlertSummary.from(alert);
    }

    @Test
    void sendsPlainTextMailToAllRecipients() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("mailSender", mailSender);
        EmailNotificationTransport transport =
                new EmailNotificationTransport(beanFactory.getBeanProvider(JavaMailSender.class), properties);

        DeliveryResult result = transport.send(summary, channel);

        assertTrue(result.isSuccess());
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage mail = captor.getValue();
        assertArrayEquals(new String[]{"ops@example.com", "oncall@example.com"}, mail.getTo());
        assertEquals("[HIGH] Low conversion rate", mail.getSubject());
        assertEquals("alerts@localhost", mail.getFrom());
    }

    @Test
    void missingMailSenderIsAFailedDelivery() {
        EmailNotificationTransport transport = new EmailNotificationTransport(
                new StaticListableBeanFactory().getBeanProvider(JavaMailSender.class), properties);

        DeliveryResult result = transport.send(summary, channel);

        assertFalse(result.isSuccess());
        assertEquals(ChannelType.EMAIL, result.getChannel());
    }
}
