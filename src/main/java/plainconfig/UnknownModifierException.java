package plainconfig;

public class UnknownModifierException extends ValueDecodeException {

    public UnknownModifierException(String remainder) {
        super("Unknown modifier operation at '" + remainder + "'");
    }
}
