package com.taskhub.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Bare JWTs (three base64url segments): "[JWT]"</li>
 * <li>password / secret values: "[REDACTED]"</li>
 * <li>Email addresses: first character + "***@domain"</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.taskhub.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // header.payload.signature, each segment base64url
    private static final Pattern JWT_PATTERN = Pattern
            .compile("\\beyJ[A-Za-z0-9_\\-]+\\.[A-Za-z0-9_\\-]+\\.[A-Za-z0-9_\\-]+");

    // password=<value>, "password":"<value>", secret=<value>
    private static final Pattern SECRET_PATTERN = Pattern
            .compile("((?:password|secret)[\"=:]+\\s*[\"']?)[^\"&\\s,]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("([A-Za-z0-9])[A-Za-z0-9._%+\\-]*(@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = JWT_PATTERN.matcher(masked).replaceAll("[JWT]");
        masked = SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = EMAIL_PATTERN.matcher(masked).replaceAll("$1***$2");

        return masked;
    }
}
