package com.taskhub.modules.upload.validation;

import java.util.Optional;

/**
 * Reduced-assurance fallback used when no content sniffer is available: the
 * caller's declared type is the only type information there is.
 */
public class DeclaredTypeMimeSniffer implements MimeSniffer {

    @Override
    public Optional<String> detect(byte[] header, String filenameHint) {
        return Optional.empty();
    }

    @Override
    public boolean inspectsContent() {
        return false;
    }
}
