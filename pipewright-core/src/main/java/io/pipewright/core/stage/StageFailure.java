package io.pipewright.core.stage;

import java.io.Serial;
import java.util.Objects;

/// Declared failure of a stage's {@link Stage#run} method.
///
/// Carries a {@link FailureKind} so the engine can decide whether to abort the
/// whole run or only the branch depending on the failed stage.
///
/// ### Usage
/// {@snippet :
/// try {
///     return client.fetchThings();
/// } catch (IOException e) {
///     throw StageFailure.transientFailure("endpoint unreachable", e);
/// }
/// }
public class StageFailure extends Exception {

    @Serial private static final long serialVersionUID = 3385290917408471722L;

    private final FailureKind kind;

    /// Creates a failure of the given kind.
    ///
    /// @param kind failure severity, not null
    /// @param message human-readable description, not null
    /// @param cause underlying exception, may be null
    public StageFailure(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Creates a failure of the given kind without a cause.
    ///
    /// @param kind failure severity, not null
    /// @param message human-readable description, not null
    public StageFailure(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public static StageFailure transientFailure(String message, Throwable cause) {
        return new StageFailure(FailureKind.TRANSIENT, message, cause);
    }

    public static StageFailure transientFailure(String message) {
        return new StageFailure(FailureKind.TRANSIENT, message);
    }

    public static StageFailure permanentFailure(String message, Throwable cause) {
        return new StageFailure(FailureKind.PERMANENT, message, cause);
    }

    public static StageFailure permanentFailure(String message) {
        return new StageFailure(FailureKind.PERMANENT, message);
    }

    /// Returns the failure severity.
    ///
    /// @return failure kind, never null
    public FailureKind getKind() {
        return kind;
    }

    /// Returns whether the failure aborts the whole run.
    ///
    /// @return true for {@link FailureKind#PERMANENT}
    public boolean isPermanent() {
        return kind == FailureKind.PERMANENT;
    }
}
