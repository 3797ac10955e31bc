package com.taskhub.modules.upload.validation;

import com.taskhub.config.UploadProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validation pipeline for uploaded files.
 * <ol>
 * <li>A: filename and extension rules (all profiles)</li>
 * <li>B: executable signatures (all profiles, cannot be disabled)</li>
 * <li>C: MIME allow-list and declared/detected mismatch (strict)</li>
 * <li>D: content scanner (strict, unless {@code scan-content=false})</li>
 * <li>E: size ceiling per category (all profiles)</li>
 * </ol>
 * Every stage that runs contributes its failures; nothing short-circuits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileValidator {

    private static final List<String> FORBIDDEN_NAME_SEQUENCES = List.of(
            "..", "/", "\\", "<", ">", ":", "\"", "|", "?", "*");

    private final FileClassifier classifier;
    private final ContentScanner scanner;
    private final UploadProperties properties;

    public ValidationOutcome validate(Path path, String originalFilename, String declaredMime,
            ValidationProfile profile) {
        List<ValidationFailure> failures = new ArrayList<>(checkFilename(originalFilename).failures());

        String effectiveMime = FileClassifier.normalizeMime(declaredMime);
        byte[] header;
        try {
            header = FileClassifier.readHeader(path);
        } catch (IOException e) {
            log.error("Unable to read header of {}: {}", path, e.getMessage());
            failures.add(new ValidationFailure(ValidationErrorKind.UNREADABLE, "Unable to read file content"));
            return ValidationOutcome.of(failures);
        }

        ClassificationResult classification = classifier.classify(header, declaredMime, originalFilename);
        if (classification.dangerous()) {
            failures.add(executableFailure(classification.executable()));
        }

        if (profile.runsMimeCheck()) {
            failures.addAll(mimeFailures(classification, declaredMime));
        }

        if (profile.runsContentScan() && properties.isScanContent()) {
            ScanResult scan = scanner.scan(path);
            if (!scan.safe()) {
                failures.add(new ValidationFailure(scan.kind(), scan.reason()));
            }
        }

        if (effectiveMime == null) {
            effectiveMime = classification.detectedMime();
        }
        try {
            failures.addAll(checkSize(Files.size(path), effectiveMime).failures());
        } catch (IOException e) {
            log.error("Unable to determine size of {}: {}", path, e.getMessage());
            failures.add(new ValidationFailure(ValidationErrorKind.UNREADABLE, "Unable to determine file size"));
        }

        ValidationOutcome outcome = ValidationOutcome.of(failures);
        if (!outcome.accepted()) {
            log.warn("Validation ({}) rejected {}: {}", profile, originalFilename, outcome.reasons());
        }
        return outcome;
    }

    /**
     * Stage A: the original filename, checked before anything touches disk.
     */
    public ValidationOutcome checkFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return ValidationOutcome.of(List.of(
                    new ValidationFailure(ValidationErrorKind.MISSING_FILENAME, "File must have a filename")));
        }

        List<ValidationFailure> failures = new ArrayList<>();
        String extension = extensionOf(originalFilename);
        if (extension.isEmpty()) {
            failures.add(new ValidationFailure(ValidationErrorKind.EXTENSION, "File has no extension"));
        } else if (properties.getBlockedExtensions().contains(extension)) {
            failures.add(new ValidationFailure(ValidationErrorKind.EXTENSION,
                    "File type '" + extension + "' is blocked"));
        } else if (!properties.getAllowedExtensions().contains(extension)) {
            failures.add(new ValidationFailure(ValidationErrorKind.EXTENSION,
                    "File type '" + extension + "' is not allowed"));
        }

        if (hasForbiddenCharacters(originalFilename)) {
            failures.add(new ValidationFailure(ValidationErrorKind.FILENAME, "Filename contains invalid characters"));
        }
        return ValidationOutcome.of(failures);
    }

    /**
     * Stage B on a header peeked from the upload stream.
     */
    public ValidationOutcome checkHeader(byte[] header) {
        return classifier.detectExecutable(header)
                .map(signature -> ValidationOutcome.of(List.of(executableFailure(signature))))
                .orElseGet(ValidationOutcome::accept);
    }

    /**
     * Stage E: ceiling for the file's category.
     */
    public ValidationOutcome checkSize(long size, String mimeType) {
        FileCategory category = FileCategory.of(mimeType);
        long ceiling = category.ceiling(properties.getSizeLimits());
        if (size > ceiling) {
            return ValidationOutcome.of(List.of(new ValidationFailure(ValidationErrorKind.SIZE_CATEGORY,
                    String.format(Locale.ROOT,
                            "File size (%.1fMB) exceeds maximum allowed size (%.1fMB) for this file type",
                            toMegabytes(size), toMegabytes(ceiling)))));
        }
        return ValidationOutcome.accept();
    }

    /**
     * Lower-cased extension including the dot, or "" when there is none.
     * {@code "Report.Final.PDF"} gives {@code ".pdf"}; {@code ".env"} gives "".
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    static double toMegabytes(long bytes) {
        return bytes / (double) UploadProperties.MIB;
    }

    private List<ValidationFailure> mimeFailures(ClassificationResult classification, String declaredMime) {
        List<ValidationFailure> failures = new ArrayList<>();
        String declared = FileClassifier.normalizeMime(declaredMime);
        String effective = classification.detected().orElse(declared);
        if (!classification.mimeAllowed()) {
            failures.add(new ValidationFailure(ValidationErrorKind.MIME_NOT_ALLOWED,
                    "File type '" + effective + "' is not allowed"));
        }
        if (classification.mimeMismatch()) {
            failures.add(new ValidationFailure(ValidationErrorKind.MIME_MISMATCH,
                    "MIME type mismatch: declared '" + declared + "' but actual '"
                            + classification.detectedMime() + "'"));
        }
        return failures;
    }

    private static ValidationFailure executableFailure(ExecutableSignature signature) {
        return new ValidationFailure(ValidationErrorKind.DANGEROUS_SIGNATURE,
                "Executable file detected: " + signature.getDescription());
    }

    private static boolean hasForbiddenCharacters(String filename) {
        if (FORBIDDEN_NAME_SEQUENCES.stream().anyMatch(filename::contains)) {
            return true;
        }
        return filename.chars().anyMatch(c -> c < 0x20 || c == 0x7F);
    }
}
