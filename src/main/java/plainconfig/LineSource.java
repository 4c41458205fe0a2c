package plainconfig;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;

@FunctionalInterface
public interface LineSource {

    String nextLine() throws IOException;

    static LineSource fromReader(Reader reader) {
        return new ReaderLineSource(reader);
    }

    static LineSource fromString(String text) {
        return fromReader(new StringReader(text == null ? "" : text));
    }

    static LineSource fromLines(Iterable<String> lines) {
        Iterator<String> it = lines.iterator();
        return () -> it.hasNext() ? it.next() : null;
    }
}
