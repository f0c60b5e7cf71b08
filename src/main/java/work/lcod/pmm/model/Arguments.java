package work.lcod.pmm.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Positional and named construction arguments for a {@link PmmRecord}.
 */
public final class Arguments {
    private final List<Object> positional;
    private final Map<String, Object> named;

    private Arguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    public static Arguments of(Object... positional) {
        return new Arguments(new ArrayList<>(Arrays.asList(positional)), new LinkedHashMap<>());
    }

    public static Arguments named(Map<?, ?> named) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : named.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new PmmException(PmmErrorCode.TYPE_MISMATCH, "Attribute names must be strings, got " + entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return new Arguments(new ArrayList<>(), copy);
    }

    public Arguments with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);
        return new Arguments(new ArrayList<>(positional), copy);
    }

    Arguments withPositional(List<Object> values) {
        return new Arguments(new ArrayList<>(values), new LinkedHashMap<>(named));
    }

    public List<Object> positional() {
        return Collections.unmodifiableList(positional);
    }

    public Map<String, Object> named() {
        return Collections.unmodifiableMap(named);
    }
}
