package com.taskhub.modules.upload.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ContentScannerTest {

    private final ContentScanner scanner = new ContentScanner();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Plain meeting notes → safe")
    void plainTextIsSafe() {
        ScanResult result = scanner.scan(bytes("Meeting notes for the quarterly planning session.\n"
                + "Owner: design team. Next review on Friday."));

        assertTrue(result.safe());
        assertNull(result.kind());
    }

    @Test
    @DisplayName("Script tag in mixed case → rejected as content pattern")
    void scriptTagRejectedCaseInsensitively() {
        ScanResult result = scanner.scan(bytes("<html><SCRIPT>alert(1)</script></html>"));

        assertFalse(result.safe());
        assertEquals(ValidationErrorKind.CONTENT_PATTERN, result.kind());
        assertEquals("Suspicious content detected: <script", result.reason());
    }

    @Test
    @DisplayName("SQL drop statement → rejected")
    void sqlDropRejected() {
        ScanResult result = scanner.scan(bytes("select 1; DROP TABLE tasks; -- cleanup"));

        assertFalse(result.safe());
        assertEquals(ValidationErrorKind.CONTENT_PATTERN, result.kind());
    }

    @Test
    @DisplayName("Relative parent path → rejected")
    void pathTraversalRejected() {
        assertFalse(scanner.scan(bytes("see ../../config for details")).safe());
    }

    @Test
    @DisplayName("Random bytes → entropy above 7.5, rejected")
    void randomBytesRejectedForEntropy() {
        byte[] random = new byte[16 * 1024];
        new SecureRandom().nextBytes(random);
        // keep the sample free of accidental pattern hits
        for (int i = 0; i < random.length; i++) {
            if (random[i] == '.' || random[i] == '<' || random[i] == '$') {
                random[i] = (byte) 0xF0;
            }
        }

        ScanResult result = scanner.scan(random);

        assertFalse(result.safe());
        assertEquals(ValidationErrorKind.ENTROPY, result.kind());
    }

    @Test
    @DisplayName("Payload under 10 bytes → rejected as too small")
    void tinyPayloadRejected() {
        ScanResult result = scanner.scan(bytes("tiny"));

        assertFalse(result.safe());
        assertEquals(ValidationErrorKind.PAYLOAD_TOO_SMALL, result.kind());
        assertEquals("File too small (4 bytes, potential payload)", result.reason());
    }

    @Test
    @DisplayName("Exactly 10 bytes → safe")
    void tenBytesIsSafe() {
        assertTrue(scanner.scan(bytes("abcdefghij")).safe());
    }

    @Test
    @DisplayName("Unreadable path → fails open")
    void unreadablePathFailsOpen() {
        assertTrue(scanner.scan(tempDir.resolve("missing.txt")).safe());
    }

    @Test
    void entropyOfConstantDataIsZero() {
        byte[] constant = new byte[4096];
        Arrays.fill(constant, (byte) 'a');

        assertEquals(0.0, ContentScanner.entropy(constant), 1e-9);
        assertEquals(0.0, ContentScanner.entropy(new byte[0]), 1e-9);
        assertTrue(scanner.scan(constant).safe());
    }

    @Test
    void entropyOfAllByteValuesIsEight() {
        byte[] uniform = new byte[256 * 4];
        for (int i = 0; i < uniform.length; i++) {
            uniform[i] = (byte) i;
        }

        assertEquals(8.0, ContentScanner.entropy(uniform), 1e-9);
    }

    @Test
    void patternsAreLowerCase() {
        for (String pattern : ContentScanner.SUSPICIOUS_PATTERNS) {
            assertEquals(pattern.toLowerCase(Locale.ROOT), pattern);
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
