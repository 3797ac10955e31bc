package com.taskhub.modules.upload.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic content scan used by the strict profile: suspicious tokens, Shannon
 * entropy, and tiny payloads.
 * <p>
 * I/O errors while reading fail open. Only a positive finding rejects a file.
 * </p>
 */
@Slf4j
@Component
public class ContentScanner {

    public static final double MAX_ENTROPY = 7.5;
    public static final int MIN_CONTENT_BYTES = 10;

    /** Matched case-insensitively; all entries are lower case. */
    static final List<String> SUSPICIOUS_PATTERNS = List.of(
            // interpreter markers
            "#!/bin/bash", "#!/bin/sh", "#!/usr/bin/python", "#!/usr/bin/env",
            "#!/usr/bin/perl", "#!/usr/bin/php", "<?php",
            // code execution
            "eval(", "exec(", "system(", "shell_exec(", "passthru(", "popen(",
            "proc_open(", "file_get_contents(", "file_put_contents(", "fopen(",
            "fwrite(", "include(", "require(", "require_once(", "include_once(",
            // command execution
            "cmd.exe", "powershell", "/bin/sh", "/bin/bash", "wget ", "curl ",
            "netcat", "telnet ", "xp_cmdshell",
            // web script injection
            "<script", "<iframe", "<object", "<embed", "<applet", "javascript:",
            "vbscript:", "onload=", "onerror=", "onclick=", "onmouseover=",
            "document.cookie", "document.write", "window.location",
            "xmlhttprequest", "fetch(", "$.ajax", "$.post", "$.get",
            // sql manipulation
            "union select", "drop table", "delete from", "insert into",
            "update set", "alter table", "create table", "execute(",
            "sp_executesql", "truncate table",
            // path traversal
            "../", "..\\", "/etc/passwd", "/etc/shadow", "c:\\windows\\system32",
            "/proc/self",
            // encoding and obfuscation
            "base64_decode", "base64_encode", "str_rot13", "gzinflate",
            "gzuncompress", "gzdecode", "gzencode", "gzcompress", "gzdeflate",
            "gzfile", "readgzfile", "gzopen", "gzread", "gzwrite", "gzpassthru",
            "fromcharcode", "atob(", "unescape(");

    public ScanResult scan(byte[] content) {
        String lowered = asciiLowerCase(content);
        for (String pattern : SUSPICIOUS_PATTERNS) {
            if (lowered.contains(pattern)) {
                return ScanResult.rejected(ValidationErrorKind.CONTENT_PATTERN,
                        "Suspicious content detected: " + pattern);
            }
        }

        double entropy = entropy(content);
        if (entropy > MAX_ENTROPY) {
            return ScanResult.rejected(ValidationErrorKind.ENTROPY,
                    String.format(Locale.ROOT, "High entropy content detected (%.2f bits/byte, potential obfuscation)", entropy));
        }

        if (content.length < MIN_CONTENT_BYTES) {
            return ScanResult.rejected(ValidationErrorKind.PAYLOAD_TOO_SMALL,
                    "File too small (" + content.length + " bytes, potential payload)");
        }

        return ScanResult.safeResult();
    }

    /**
     * Scan a stored file. A file that cannot be read is reported safe.
     */
    public ScanResult scan(Path path) {
        try {
            return scan(Files.readAllBytes(path));
        } catch (IOException | RuntimeException e) {
            log.error("Content scan failed for {}, allowing file: {}", path, e.getMessage());
            return ScanResult.safeResult();
        }
    }

    /**
     * Shannon entropy in bits per byte, 0 (constant) to 8 (uniform).
     */
    public static double entropy(byte[] data) {
        if (data == null || data.length == 0) {
            return 0.0;
        }
        long[] counts = new long[256];
        for (byte b : data) {
            counts[b & 0xFF]++;
        }
        double entropy = 0.0;
        double length = data.length;
        for (long count : counts) {
            if (count > 0) {
                double p = count / length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    private static String asciiLowerCase(byte[] content) {
        byte[] lowered = new byte[content.length];
        for (int i = 0; i < content.length; i++) {
            byte b = content[i];
            lowered[i] = (b >= 'A' && b <= 'Z') ? (byte) (b + 32) : b;
        }
        return new String(lowered, StandardCharsets.ISO_8859_1);
    }
}
