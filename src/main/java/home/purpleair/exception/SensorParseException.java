package home.purpleair.exception;

public class SensorParseException extends Exception {
    public SensorParseException(String message) {
        super(message);
    }

    public SensorParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
