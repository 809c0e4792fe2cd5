package ai.yarrow.model.exceptions;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * Failure reported by the runtime engine. The status is passed through as received.
 */
public class RuntimeEngineException extends YarrowException {
    private final Status status;

    public RuntimeEngineException(String method, StatusRuntimeException cause) {
        super(method + " failed: " + cause.getStatus().getCode() + " " + cause.getStatus().getDescription(),
            cause);
        this.status = cause.getStatus();
    }

    public RuntimeEngineException(String message, Throwable cause) {
        super(message, cause);
        this.status = Status.INTERNAL.withDescription(message).withCause(cause);
    }

    public Status status() {
        return status;
    }
}
