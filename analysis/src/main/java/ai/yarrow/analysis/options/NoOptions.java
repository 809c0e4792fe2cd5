package ai.yarrow.analysis.options;

public enum NoOptions implements ComponentOptions {
    INSTANCE
}
