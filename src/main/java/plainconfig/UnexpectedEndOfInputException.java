package plainconfig;

public class UnexpectedEndOfInputException extends PlainConfigException {

    public UnexpectedEndOfInputException(String key, int lineNumber) {
        super("Input ended inside the continued value of '" + key + "' started at line " + lineNumber);
    }
}
