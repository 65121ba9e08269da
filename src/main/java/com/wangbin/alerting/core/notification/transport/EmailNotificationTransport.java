package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.exception.AlertingException;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.notification.AlertSummary;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * 邮件通知
 *
 * 未配置 spring.mail.host 时容器中没有 JavaMailSender，发送直接失败。
 */
@Component
public class EmailNotificationTransport extends AbstractNotificationTransport {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final AlertingProperties properties;

    public EmailNotificationTransport(ObjectProvider<JavaMailSender> mailSenderProvider,
                                      AlertingProperties properties) {
        super(ChannelType.EMAIL);
        this.mailSenderProvider = mailSenderProvider;
        this.properties = properties;
    }

    @Override
    protected void doSend(AlertSummary summary, NotificationChannel channel) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw AlertingException.notificationFailure(channelType.getCode(), "未配置邮件发送器");
        }
        if (channel.getRecipients().isEmpty()) {
            throw AlertingException.notificationFailure(channelType.getCode(), "邮件收件人为空");
        }

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(properties.getChannels().getEmail().getFrom());
        mail.setTo(channel.getRecipients().toArray(new String[0]));
        mail.setSubject(summary.headline());
        mail.setText(summary.toText());
        mailSender.send(mail);
    }
}
