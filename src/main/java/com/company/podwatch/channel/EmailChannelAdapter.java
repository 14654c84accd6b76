package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.exception.ChannelDeliveryException;
import com.company.podwatch.settings.DestinationSettings;
import com.company.podwatch.settings.EmailTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Properties;

/**
 * SMTP delivery. The sender is built from the runtime settings on every attempt, so transport
 * changes apply without a restart.
 */
@Component
@Slf4j
public class EmailChannelAdapter implements ChannelAdapter {

    private final Duration timeout;

    public EmailChannelAdapter(@Value("${podwatch.channels.smtp-timeout:10s}") Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public ChannelType getChannelType() {
        return ChannelType.EMAIL;
    }

    @Override
    public boolean isConfigured(DestinationSettings settings) {
        return settings.getEmail() != null && settings.getEmail().isConfigured();
    }

    @Override
    public void send(AlertDestination destination, AlertMessage message, DestinationSettings settings) {
        EmailTransport transport = settings.getEmail();

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(transport.getFrom());
        mail.setTo(destination.getAddress());
        mail.setSubject("[PodWatch][" + message.getLevel().name() + "] " + message.getSubject());
        mail.setText(message.getBody());

        try {
            createSender(transport).send(mail);
            log.debug("Alert {} mailed to {}", message.getAlertId(), destination.getAddress());
        } catch (MailAuthenticationException | MailParseException e) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, "SMTP rejected message: " + e.getMessage(), false, e);
        } catch (MailException e) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, "SMTP delivery failed: " + e.getMessage(), true, e);
        }
    }

    JavaMailSender createSender(EmailTransport transport) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(transport.getSmtpHost());
        sender.setPort(transport.getSmtpPort() != null ? transport.getSmtpPort() : 25);

        boolean auth = transport.getUsername() != null && !transport.getUsername().isBlank();
        if (auth) {
            sender.setUsername(transport.getUsername());
            sender.setPassword(transport.getPassword());
        }

        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.auth", String.valueOf(auth));
        props.put("mail.smtp.starttls.enable", String.valueOf(Boolean.TRUE.equals(transport.getStartTls())));
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        return sender;
    }
}
