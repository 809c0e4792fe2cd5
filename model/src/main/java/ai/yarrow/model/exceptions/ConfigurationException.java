package ai.yarrow.model.exceptions;

public class ConfigurationException extends YarrowException {

    public ConfigurationException(String message) {
        super(message);
    }
}
