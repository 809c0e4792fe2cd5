package ai.yarrow.model.exceptions;

/**
 * Base of the errors raised while building or encoding an analysis. All of them are raised at the point
 * of misuse and propagate to the caller.
 */
public abstract class YarrowException extends RuntimeException {

    protected YarrowException(String message) {
        super(message);
    }

    protected YarrowException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getMessage() {
        return "[%s] %s".formatted(getClass().getSimpleName(), super.getMessage());
    }
}
