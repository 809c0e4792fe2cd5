package ai.yarrow.analysis;

/**
 * Open scope of an analysis. Closing restores the analysis that was active before it was entered.
 */
public final class AnalysisScope implements AutoCloseable {
    private final Analysis analysis;
    private boolean closed = false;

    AnalysisScope(Analysis analysis) {
        this.analysis = analysis;
    }

    public Analysis analysis() {
        return analysis;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        analysis.exit();
        closed = true;
    }
}
