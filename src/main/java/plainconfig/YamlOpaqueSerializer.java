package plainconfig;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.nio.charset.StandardCharsets;

/**
 * Stores opaque values as SnakeYAML documents carrying global class tags, e.g.
 * {@code !!com.example.Endpoint {host: db, port: 5432}}.
 * <p>
 * Loading allows every global tag, so a document can make the loader instantiate any
 * class on the classpath. Only use it on files you wrote yourself.
 */
public class YamlOpaqueSerializer implements OpaqueSerializer {

    @Override
    public byte[] serialize(Object value) {
        try {
            return newYaml().dump(value).getBytes(StandardCharsets.UTF_8);
        } catch (YAMLException ex) {
            throw new UnsafeValueException("Cannot serialize a value of type " + Literals.typeName(value), ex);
        }
    }

    @Override
    public Object deserialize(byte[] data) {
        try {
            return newYaml().load(new String(data, StandardCharsets.UTF_8));
        } catch (YAMLException ex) {
            throw new FormatException("Cannot deserialize opaque value: " + ex.getMessage(), ex);
        }
    }

    private static Yaml newYaml() {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.FLOW);
        dumperOptions.setWidth(Integer.MAX_VALUE);

        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setTagInspector(tag -> true);

        return new Yaml(new Constructor(loaderOptions), new Representer(dumperOptions), dumperOptions, loaderOptions);
    }
}
