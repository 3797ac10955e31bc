package com.taskhub.modules.upload.validation;

import com.taskhub.config.UploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides a file's true kind from its leading bytes.
 * <p>
 * The executable-header check always runs. MIME detection depends on the
 * {@link MimeSniffer} the context was built with; without a content sniffer
 * only the declared type is checked against the allow-list.
 * </p>
 */
@Slf4j
@Component
public class FileClassifier {

    public static final int HEADER_BYTES = 1024;

    private final MimeSniffer mimeSniffer;
    private final UploadProperties properties;

    public FileClassifier(MimeSniffer mimeSniffer, UploadProperties properties) {
        this.mimeSniffer = mimeSniffer;
        this.properties = properties;
        if (!mimeSniffer.inspectsContent()) {
            log.warn("No content sniffer available; MIME validation falls back to declared types only");
        }
    }

    public ClassificationResult classify(byte[] content, String declaredMime, String filenameHint) {
        byte[] header = content.length > HEADER_BYTES ? Arrays.copyOf(content, HEADER_BYTES) : content;
        ExecutableSignature executable = detectExecutable(header).orElse(null);

        String declared = normalizeMime(declaredMime);
        Optional<String> detected = mimeSniffer.detect(header, filenameHint).map(FileClassifier::normalizeMime);

        boolean mismatch = false;
        boolean allowed;
        if (detected.isPresent()) {
            String actual = detected.get();
            allowed = properties.getAllowedMimeTypes().contains(actual);
            mismatch = declared != null && !declared.equals(actual);
        } else {
            allowed = declared == null || properties.getAllowedMimeTypes().contains(declared);
        }

        log.debug("Classified {}: declared={}, detected={}, executable={}",
                filenameHint, declared, detected.orElse("n/a"), executable);
        return new ClassificationResult(detected.orElse(null), executable, mismatch, allowed);
    }

    public Optional<ExecutableSignature> detectExecutable(byte[] header) {
        for (ExecutableSignature signature : ExecutableSignature.values()) {
            if (signature.matches(header)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    /**
     * Read at most {@link #HEADER_BYTES} from the start of a file.
     */
    public static byte[] readHeader(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return in.readNBytes(HEADER_BYTES);
        }
    }

    /**
     * Lower-cased type without parameters, or {@code null} for blank input.
     * {@code "Text/Plain; charset=UTF-8"} becomes {@code "text/plain"}.
     */
    public static String normalizeMime(String mime) {
        if (mime == null || mime.isBlank()) {
            return null;
        }
        int semicolon = mime.indexOf(';');
        String base = semicolon >= 0 ? mime.substring(0, semicolon) : mime;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
