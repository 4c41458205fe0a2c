package plainconfig;

public class PlainConfigException extends RuntimeException {

    public PlainConfigException(String message) {
        super(message);
    }

    public PlainConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
