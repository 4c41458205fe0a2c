package plainconfig;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YamlOpaqueSerializerTest {

    private final YamlOpaqueSerializer serializer = new YamlOpaqueSerializer();

    @Test
    void storesBeansWithClassTag() {
        var yaml = new String(serializer.serialize(new Endpoint("db", 5432)), StandardCharsets.UTF_8);

        assertTrue(yaml.startsWith("!!plainconfig.Endpoint"), yaml);
        assertEquals(new Endpoint("db", 5432), serializer.deserialize(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void failsOnBrokenDocument() {
        var broken = "!!plainconfig.Endpoint {host: [".getBytes(StandardCharsets.UTF_8);

        assertThrows(FormatException.class, () -> serializer.deserialize(broken));
    }
}
