package dev.marketbloom.service;

import dev.marketbloom.config.LeadCaptureProperties;
import dev.marketbloom.config.ResilienceConfig;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmailService")
class EmailServiceTest {

    @Mock
    private JavaMailSender mailSender;

    private EmailService emailService;

    @BeforeEach
    void setUp() {
        LeadCaptureProperties properties = new LeadCaptureProperties(
                new LeadCaptureProperties.Security("k", "s"),
                new LeadCaptureProperties.Notification(null, "MarketBloom Studio", "Asia/Kolkata", "en-IN"),
                new LeadCaptureProperties.Frontend("classpath:/static/", "index.html", "classpath:/admin/admin.html"),
                new LeadCaptureProperties.Cors(List.of("*")));
        emailService = new EmailService(mailSender, new ResilienceConfig(5, 5), properties, "leads@example.com");
        lenient().when(mailSender.createMimeMessage())
                .thenAnswer(inv -> new MimeMessage(Session.getInstance(new Properties())));
    }

    @Test
    @DisplayName("should send an HTML message from the SMTP account")
    void shouldSendHtmlMessage() throws Exception {
        StepVerifier.create(emailService.sendHtmlEmail("sales@example.com", "New Lead: Acme - MarketBloom Studio", "<p>hi</p>"))
                .verifyComplete();

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("New Lead: Acme - MarketBloom Studio");
        assertThat(((InternetAddress) sent.getFrom()[0]).getAddress()).isEqualTo("leads@example.com");
        assertThat(((InternetAddress) sent.getFrom()[0]).getPersonal()).isEqualTo("MarketBloom Studio");
        assertThat(sent.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("sales@example.com");
    }

    @Test
    @DisplayName("should signal an error when the SMTP server rejects the message")
    void shouldSignalError_WhenSendFails() {
        doThrow(new MailSendException("auth failed")).when(mailSender).send(any(MimeMessage.class));

        StepVerifier.create(emailService.sendHtmlEmail("sales@example.com", "subject", "<p>hi</p>"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(IllegalStateException.class);
                    assertThat(e.getCause()).isInstanceOf(MailSendException.class);
                })
                .verify();
    }
}
