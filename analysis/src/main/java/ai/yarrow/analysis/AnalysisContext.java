package ai.yarrow.analysis;

import ai.yarrow.model.exceptions.NoActiveContextException;
import jakarta.annotation.Nullable;

import java.util.Optional;

/**
 * Per-thread slot holding the analysis new components register into.
 */
public final class AnalysisContext {
    private static final ThreadLocal<Analysis> ACTIVE = new ThreadLocal<>();

    private AnalysisContext() {
    }

    public static Optional<Analysis> current() {
        return Optional.ofNullable(ACTIVE.get());
    }

    static Analysis require() {
        var analysis = ACTIVE.get();
        if (analysis == null) {
            throw new NoActiveContextException();
        }
        return analysis;
    }

    /**
     * Makes {@code next} the active analysis of this thread and returns the one it replaces.
     */
    @Nullable
    static Analysis swap(@Nullable Analysis next) {
        var previous = ACTIVE.get();
        if (next == null) {
            ACTIVE.remove();
        } else {
            ACTIVE.set(next);
        }
        return previous;
    }
}
