package util.print;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Objects with a JSON form, used for machine-readable driver output
 */
public interface JSONSerializable {

    /**
     * @return a fresh JSON object describing <code>this</code>
     */
    public JSONObject toJSON();

    /**
     * Write the JSON form of this object.
     *
     * @param out
     *            destination
     * @param indent
     *            spaces per nesting level, 0 writes a single line
     * @throws JSONException
     *             if the writer fails
     */
    public void writeJSON(Writer out, int indent) throws JSONException;
}
