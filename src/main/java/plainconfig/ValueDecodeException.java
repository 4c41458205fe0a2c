package plainconfig;

public abstract class ValueDecodeException extends PlainConfigException {

    protected ValueDecodeException(String message) {
        super(message);
    }

    protected ValueDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
