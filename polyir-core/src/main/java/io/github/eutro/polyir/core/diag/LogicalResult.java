package io.github.eutro.polyir.core.diag;

import org.jetbrains.annotations.Nullable;

/**
 * The outcome of an operation that may fail in a user-facing way,
 * such as verification.
 * <p>
 * A failure usually carries the diagnostic that explains it; that diagnostic
 * has already been reported to the {@link DiagnosticEngine} when the failure was created
 * through one of the {@code emit*} helpers.
 */
public final class LogicalResult {
    private static final LogicalResult SUCCESS = new LogicalResult(false, null);
    private static final LogicalResult SILENT_FAILURE = new LogicalResult(true, null);

    private final boolean failed;
    private final @Nullable Diagnostic diagnostic;

    private LogicalResult(boolean failed, @Nullable Diagnostic diagnostic) {
        this.failed = failed;
        this.diagnostic = diagnostic;
    }

    public static LogicalResult success() {
        return SUCCESS;
    }

    public static LogicalResult failure() {
        return SILENT_FAILURE;
    }

    public static LogicalResult failure(Diagnostic diagnostic) {
        return new LogicalResult(true, diagnostic);
    }

    public static LogicalResult success(boolean isSuccess) {
        return isSuccess ? SUCCESS : SILENT_FAILURE;
    }

    public boolean succeeded() {
        return !failed;
    }

    public boolean failed() {
        return failed;
    }

    /**
     * Get the diagnostic explaining this failure.
     *
     * @return The diagnostic, or null if this is a success or a silent failure.
     */
    public @Nullable Diagnostic getDiagnostic() {
        return diagnostic;
    }

    @Override
    public String toString() {
        if (!failed) return "success";
        return diagnostic == null ? "failure" : "failure(" + diagnostic + ")";
    }
}
