package plainconfig;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Value
public class ConfigSnapshot {
    Map<String, Object> data;
    List<StructureEntry> structure;

    ConfigSnapshot(Map<String, Object> data, List<StructureEntry> structure) {
        this.data = data;
        this.structure = Collections.unmodifiableList(structure);
    }
}
