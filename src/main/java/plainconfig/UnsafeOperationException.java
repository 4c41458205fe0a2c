package plainconfig;

public class UnsafeOperationException extends ValueDecodeException {

    public UnsafeOperationException() {
        super("Cannot deserialize an opaque value, safe mode is on");
    }
}
