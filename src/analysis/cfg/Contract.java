package analysis.cfg;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ast.ItemOrigin;
import ast.SrcLoc;

/**
 * Contract together with the control-flow graphs of its methods, receivers and initializer
 */
public class Contract {

    private final int idx;
    private final String name;
    private final ItemOrigin origin;
    /**
     * Control-flow graphs by index
     */
    private final Map<Integer, Cfg> methods;
    private final SrcLoc loc;

    public Contract(int idx, String name, ItemOrigin origin, Map<Integer, Cfg> methods, SrcLoc loc) {
        this.idx = idx;
        this.name = name;
        this.origin = origin;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
        this.loc = loc == null ? SrcLoc.NONE : loc;
    }

    public int getIdx() {
        return idx;
    }

    public String getName() {
        return name;
    }

    public ItemOrigin getOrigin() {
        return origin;
    }

    public Map<Integer, Cfg> getMethods() {
        return methods;
    }

    /**
     * @return control-flow graph of the method with the given name or null if there is none
     */
    public Cfg getMethodByName(String methodName) {
        for (Cfg cfg : methods.values()) {
            if (cfg.getName().equals(methodName)) {
                return cfg;
            }
        }
        return null;
    }

    public SrcLoc getLoc() {
        return loc;
    }
}
