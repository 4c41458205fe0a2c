package plainconfig;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StructureEntry {

    public enum Kind {
        KEY,
        COMMENT,
        INVALID
    }

    Kind kind;
    String key;
    String modifier;
    String rawLine;

    static StructureEntry key(String key, String modifier, String rawLine) {
        return new StructureEntry(Kind.KEY, key, modifier, rawLine);
    }

    static StructureEntry comment(String rawLine) {
        return new StructureEntry(Kind.COMMENT, null, null, rawLine);
    }

    static StructureEntry invalid(String rawLine) {
        return new StructureEntry(Kind.INVALID, null, null, rawLine);
    }

    public boolean isKey() {
        return kind == Kind.KEY;
    }
}
