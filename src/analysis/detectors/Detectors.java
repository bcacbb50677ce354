package analysis.detectors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in detectors by name
 */
public class Detectors {

    /**
     * Methods of this class are static
     */
    private Detectors() {
    }

    /**
     * Create one instance of every built-in detector
     *
     * @return new detectors keyed by name, in a fixed order
     */
    public static Map<String, Detector> createAll() {
        Map<String, Detector> all = new LinkedHashMap<>();
        for (Detector d : Arrays.asList(new TimestampDependence(), new SendInLoop(), new StateMutationInGetter())) {
            all.put(d.getId(), d);
        }
        return all;
    }

    /**
     * @return names of the built-in detectors
     */
    public static List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(createAll().keySet()));
    }

    /**
     * Create the detectors with the given names
     *
     * @param names
     *            detector names, all built-in detectors if empty
     * @return new detectors in the order of <code>names</code>
     * @throws IllegalArgumentException
     *             if a name does not denote a built-in detector
     */
    public static List<Detector> create(List<String> names) {
        Map<String, Detector> all = createAll();
        if (names.isEmpty()) {
            return new ArrayList<>(all.values());
        }
        List<Detector> result = new ArrayList<>();
        for (String name : names) {
            Detector d = all.get(name);
            if (d == null) {
                throw new IllegalArgumentException("Unknown detector: " + name + ". Available: " + all.keySet());
            }
            result.add(d);
        }
        return result;
    }
}
