package com.taskhub.modules.upload.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated result of a validation run. {@code failures} is empty iff the
 * file was accepted, and keeps the order in which stages reported.
 */
public record ValidationOutcome(boolean accepted, List<ValidationFailure> failures) {

    public ValidationOutcome {
        failures = List.copyOf(failures);
    }

    public static ValidationOutcome accept() {
        return new ValidationOutcome(true, List.of());
    }

    public static ValidationOutcome of(List<ValidationFailure> failures) {
        return new ValidationOutcome(failures.isEmpty(), failures);
    }

    public List<String> reasons() {
        return failures.stream().map(ValidationFailure::message).toList();
    }

    public boolean hasFailure(ValidationErrorKind kind) {
        return failures.stream().anyMatch(f -> f.kind() == kind);
    }

    public ValidationOutcome merge(ValidationOutcome other) {
        List<ValidationFailure> merged = new ArrayList<>(failures);
        merged.addAll(other.failures());
        return of(merged);
    }
}
