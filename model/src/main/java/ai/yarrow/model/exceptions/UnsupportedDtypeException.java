package ai.yarrow.model.exceptions;

public class UnsupportedDtypeException extends YarrowException {

    public UnsupportedDtypeException(String message) {
        super(message);
    }
}
