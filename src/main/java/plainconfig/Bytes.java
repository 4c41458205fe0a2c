package plainconfig;

import lombok.EqualsAndHashCode;

import java.util.Arrays;

@EqualsAndHashCode
public final class Bytes {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] data;

    private Bytes(byte[] data) {
        this.data = data;
    }

    public static Bytes of(byte... data) {
        return new Bytes(data == null ? new byte[0] : data.clone());
    }

    public static Bytes of(int... octets) {
        byte[] data = new byte[octets.length];
        for (int i = 0; i < octets.length; i++) {
            data[i] = (byte) octets[i];
        }
        return new Bytes(data);
    }

    static Bytes wrap(byte[] data) {
        return new Bytes(data);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public int get(int index) {
        return data[index] & 0xff;
    }

    byte[] unsafeArray() {
        return data;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(data.length * 2 + 8);
        sb.append("Bytes[");
        for (byte b : data) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.append(']').toString();
    }

    static Bytes concat(Bytes a, Bytes b) {
        byte[] out = Arrays.copyOf(a.data, a.data.length + b.data.length);
        System.arraycopy(b.data, 0, out, a.data.length, b.data.length);
        return new Bytes(out);
    }
}
