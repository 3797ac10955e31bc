package com.taskhub.modules.upload.validation;

import java.util.Optional;

/**
 * What the classifier concluded about a file's leading bytes.
 *
 * @param detectedMime  content type sniffed from the bytes; {@code null} when
 *                      no sniffer inspects content
 * @param executable    matched executable header, or {@code null}
 * @param mimeMismatch  declared and detected types differ
 * @param mimeAllowed   the effective type (detected, else declared) is on the
 *                      allow-list
 */
public record ClassificationResult(String detectedMime,
        ExecutableSignature executable,
        boolean mimeMismatch,
        boolean mimeAllowed) {

    public boolean dangerous() {
        return executable != null;
    }

    public Optional<String> detected() {
        return Optional.ofNullable(detectedMime);
    }
}
