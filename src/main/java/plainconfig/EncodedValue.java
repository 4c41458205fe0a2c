package plainconfig;

import lombok.Value;

@Value
public class EncodedValue {
    String modifier;
    String payload;
}
