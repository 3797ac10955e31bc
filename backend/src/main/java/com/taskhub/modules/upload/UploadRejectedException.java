package com.taskhub.modules.upload;

import com.taskhub.modules.upload.ratelimit.RateLimitDecision;
import com.taskhub.modules.upload.ratelimit.RateLimitWindow;
import com.taskhub.modules.upload.validation.ValidationFailure;
import com.taskhub.modules.upload.validation.ValidationOutcome;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when an upload is not accepted. Carries every violated rule, not
 * only the first one.
 */
@Getter
public class UploadRejectedException extends RuntimeException {

    private final UploadErrorKind kind;
    private final List<String> reasons;
    private final List<ValidationFailure> failures;
    private final RateLimitWindow window;

    private UploadRejectedException(UploadErrorKind kind, List<String> reasons,
            List<ValidationFailure> failures, RateLimitWindow window, Throwable cause) {
        super(String.join("; ", reasons), cause);
        this.kind = kind;
        this.reasons = List.copyOf(reasons);
        this.failures = List.copyOf(failures);
        this.window = window;
    }

    public static UploadRejectedException validation(ValidationOutcome outcome) {
        return new UploadRejectedException(UploadErrorKind.VALIDATION, outcome.reasons(),
                outcome.failures(), null, null);
    }

    public static UploadRejectedException rateLimited(RateLimitDecision decision) {
        return new UploadRejectedException(UploadErrorKind.RATE_LIMIT, List.of(decision.reason()),
                List.of(), decision.window(), null);
    }

    public static UploadRejectedException storage(String reason, Throwable cause) {
        return new UploadRejectedException(UploadErrorKind.STORAGE, List.of(reason), List.of(), null, cause);
    }
}
