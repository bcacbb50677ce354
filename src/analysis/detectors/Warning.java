package analysis.detectors;

import java.io.Writer;

import util.print.JSONSerializable;
import ast.SrcLoc;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Problem reported by a detector
 */
public class Warning implements JSONSerializable {

    /**
     * Name of the detector that reported the problem
     */
    private final String detectorId;
    private final String description;
    private final SrcLoc loc;
    private final Severity severity;
    /**
     * How to fix the problem, may be null
     */
    private final String suggestion;

    public Warning(String detectorId, String description, SrcLoc loc, Severity severity, String suggestion) {
        this.detectorId = detectorId;
        this.description = description;
        this.loc = loc;
        this.severity = severity;
        this.suggestion = suggestion;
    }

    public String getDetectorId() {
        return detectorId;
    }

    public String getDescription() {
        return description;
    }

    public SrcLoc getLoc() {
        return loc;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("detector", detectorId);
        json.put("severity", severity.name());
        json.put("description", description);
        JSONObject position = new JSONObject();
        position.put("file", loc.getFile() == null ? JSONObject.NULL : loc.getFile());
        position.put("line", loc.getLine());
        position.put("column", loc.getColumn());
        json.put("loc", position);
        if (suggestion != null) {
            json.put("suggestion", suggestion);
        }
        return json;
    }

    @Override
    public void writeJSON(Writer out, int indent) throws JSONException {
        toJSON().write(out, indent, 0);
    }

    @Override
    public String toString() {
        String s = loc + ": [" + severity + "] " + detectorId + ": " + description;
        if (suggestion != null) {
            s += "\nHelp: " + suggestion;
        }
        return s;
    }
}
