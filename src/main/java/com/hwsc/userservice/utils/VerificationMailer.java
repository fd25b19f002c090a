package com.hwsc.userservice.utils;

import com.hwsc.userservice.exception.ServiceExceptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationMailer {

    static final String SUBJECT = "Verify account for Humpback Whale Social Call";

    private final JavaMailSender mailSender;

    @Value("${user-service.mail.from:no-reply@hwsc.org}")
    private String from;

    @Value("${user-service.mail.verify-url:http://localhost:8080/users/verify-email?token=}")
    private String verifyUrl;

    public void sendVerification(String to, String firstName, String token) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);
        message.setSubject(SUBJECT);
        message.setText("Hi " + firstName + ",\n\n"
                + "Please confirm your email address by opening the link below:\n"
                + verifyUrl + token + "\n\n"
                + "If you did not request this, you can ignore this message.");
        try {
            mailSender.send(message);
        } catch (MailException e) {
            throw new ServiceExceptions.Internal("failed to send verification email", e);
        }
        log.info("Verification email sent to {}", to);
    }
}
