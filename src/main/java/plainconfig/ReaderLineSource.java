package plainconfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

final class ReaderLineSource implements LineSource {

    private final Reader reader;
    private boolean hasPending;
    private int pending;

    ReaderLineSource(Reader reader) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
    }

    @Override
    public String nextLine() throws IOException {
        StringBuilder line = new StringBuilder();
        while (true) {
            int c = read();
            if (c < 0) {
                return line.length() == 0 ? null : line.toString();
            }
            line.append((char) c);
            if (c == '\n') {
                return line.toString();
            }
            if (c == '\r') {
                int next = read();
                if (next == '\n') {
                    line.append('\n');
                } else {
                    hasPending = true;
                    pending = next;
                }
                return line.toString();
            }
        }
    }

    private int read() throws IOException {
        if (hasPending) {
            hasPending = false;
            return pending;
        }
        return reader.read();
    }
}
