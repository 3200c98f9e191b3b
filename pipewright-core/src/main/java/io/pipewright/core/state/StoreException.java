package io.pipewright.core.state;

import java.io.Serial;

/// Unchecked exception for read or write failures against a {@link StateStore}.
///
/// The engine records it as a permanent failure of the affected stage, since
/// incremental correctness cannot be guaranteed when state cannot be persisted.
public class StoreException extends RuntimeException {

    @Serial private static final long serialVersionUID = 6141229384523197201L;

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
