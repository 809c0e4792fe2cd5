package ai.yarrow.model.exceptions;

public class AlreadyOwnedException extends YarrowException {
    private final int componentId;

    public AlreadyOwnedException(int componentId) {
        super("component " + componentId + " is already a part of another analysis");
        this.componentId = componentId;
    }

    public int getComponentId() {
        return componentId;
    }
}
