package plainconfig;

public class InvalidKeyException extends PlainConfigException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
