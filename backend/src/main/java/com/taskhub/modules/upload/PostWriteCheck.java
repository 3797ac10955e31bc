package com.taskhub.modules.upload;

import com.taskhub.modules.upload.validation.ValidationOutcome;

import java.nio.file.Path;

/**
 * Verification run against the written file before an upload is committed.
 */
@FunctionalInterface
public interface PostWriteCheck {

    PostWriteCheck NONE = path -> ValidationOutcome.accept();

    ValidationOutcome verify(Path storedFile);
}
