package ai.yarrow.model.exceptions;

public class NoActiveContextException extends YarrowException {

    public NoActiveContextException() {
        super("all components must be created within the scope of an analysis");
    }
}
