package plainconfig;

public class UnsafeValueException extends PlainConfigException {

    public UnsafeValueException(String message) {
        super(message);
    }

    public UnsafeValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
