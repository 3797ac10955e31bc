package com.taskhub.modules.upload.validation;

import java.util.Optional;

/**
 * Content-type detection capability. The implementation is picked once when
 * the application context starts (see {@code UploadConfig}).
 */
public interface MimeSniffer {

    /**
     * Detect the media type of a file from its leading bytes.
     *
     * @param header       first bytes of the file (at most 1 KiB)
     * @param filenameHint original filename, may be {@code null}
     * @return detected base type without parameters (e.g. "image/png"), or
     *         empty when this sniffer does not look at content
     */
    Optional<String> detect(byte[] header, String filenameHint);

    /** {@code false} for the declared-type-only fallback. */
    boolean inspectsContent();
}
