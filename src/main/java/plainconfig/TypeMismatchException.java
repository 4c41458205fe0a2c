package plainconfig;

public class TypeMismatchException extends ValueDecodeException {

    public TypeMismatchException(String operation, Object value) {
        super("Operation '" + operation + "' cannot be applied to " + Literals.typeName(value));
    }
}
