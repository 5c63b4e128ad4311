package com.sporehub.backend.delivery.controller;

import com.sporehub.backend.auth.security.AuthContext;
import com.sporehub.backend.common.web.ApiResponse;
import com.sporehub.backend.delivery.dto.ChatSendRequest;
import com.sporehub.backend.delivery.dto.MailSendRequest;
import com.sporehub.backend.delivery.mail.MailDelivery;
import com.sporehub.backend.delivery.whatsapp.ChatMessenger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for sending arbitrary messages. Restricted to admins through {@code app.security.role-rules}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DeliveryController {

    private final MailDelivery mail;
    private final ChatMessenger chat;
    private final AuthContext auth;

    @PostMapping("/mailer/send")
    public ApiResponse<Void> sendMail(@Valid @RequestBody MailSendRequest req) {
        String text = (req.text() == null || req.text().isBlank()) ? req.subject() : req.text();
        mail.deliver(req.to(), req.subject(), req.html(), text);
        log.info("admin mail sent by={} to={}", auth.requireSubjectId(), req.to());
        return ApiResponse.ok("Email sent successfully");
    }

    @PostMapping("/whatsapp/send")
    public ApiResponse<Void> sendWhatsApp(@Valid @RequestBody ChatSendRequest req) {
        chat.sendMessage(req.to(), req.message());
        log.info("admin whatsapp sent by={} to={}", auth.requireSubjectId(), req.to());
        return ApiResponse.ok("WhatsApp message sent successfully");
    }
}
