package plainconfig;

public interface OpaqueSerializer {

    byte[] serialize(Object value);

    Object deserialize(byte[] data);
}
