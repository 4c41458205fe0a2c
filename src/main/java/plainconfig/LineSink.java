package plainconfig;

import java.io.IOException;

@FunctionalInterface
public interface LineSink {

    void write(String text) throws IOException;

    static LineSink of(Appendable out) {
        return out::append;
    }
}
