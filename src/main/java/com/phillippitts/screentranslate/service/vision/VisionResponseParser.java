package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.domain.BoundingBox;
import com.phillippitts.screentranslate.domain.TextSegment;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a vision model reply into {@link TextSegment}s.
 *
 * <p>Replies are expected to hold {@code {"segments":[...]}}, possibly wrapped in a Markdown
 * fence or surrounded by prose. Each segment carries its text, a box, and an optional
 * confidence. Two box shapes are accepted:
 * <ul>
 *   <li>{@code "bbox": [x1, y1, x2, y2]}</li>
 *   <li>{@code "boundingBox": {"x", "y", "width", "height"}}</li>
 * </ul>
 * Coordinates are clamped into {@code [0, 1]}. Segments with blank text or a zero-area box
 * are dropped. When the reply was cut short, every complete segment object before the cut
 * is still recovered.
 */
public final class VisionResponseParser {

    private static final Logger LOG = LogManager.getLogger(VisionResponseParser.class);

    private VisionResponseParser() {}

    /**
     * @param reply raw model reply
     * @param providerId vision provider id, used in error messages
     * @return segments in model order; empty if the reply lists none
     * @throws AnalysisException if the reply contains no JSON object at all
     */
    public static List<TextSegment> parse(String reply, String providerId) {
        String json = extractJson(reply);
        if (json.isEmpty()) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, providerId,
                    "Reply contains no JSON: " + LogSanitizer.preview(reply, 80));
        }

        JSONArray raw;
        try {
            raw = json.startsWith("[") ? new JSONArray(json) : segmentsOf(new JSONObject(json));
        } catch (JSONException e) {
            List<JSONObject> recovered = recoverSegments(json);
            LOG.warn("Vision reply from {} is not valid JSON; recovered {} segment(s)",
                    providerId, recovered.size());
            raw = new JSONArray(recovered);
        }

        List<TextSegment> segments = new ArrayList<>(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            JSONObject obj = raw.optJSONObject(i);
            if (obj == null) {
                continue;
            }
            TextSegment segment = toSegment(obj);
            if (segment != null) {
                segments.add(segment);
            }
        }
        LOG.debug("Parsed {} of {} segment(s) from {}", segments.size(), raw.length(), providerId);
        return segments;
    }

    /**
     * Strips a Markdown fence and anything outside the outermost JSON value.
     */
    static String extractJson(String reply) {
        if (reply == null) {
            return "";
        }
        String text = reply.trim();
        if (text.startsWith("```")) {
            int newline = text.indexOf('\n');
            text = newline >= 0 ? text.substring(newline + 1) : text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        text = text.trim();

        int objStart = text.indexOf('{');
        int arrStart = text.indexOf('[');
        if (objStart < 0) {
            return "";
        }
        if (arrStart >= 0 && arrStart < objStart) {
            int arrEnd = text.lastIndexOf(']');
            if (arrEnd > arrStart && !text.substring(0, arrStart).contains("\"")) {
                return text.substring(arrStart, arrEnd + 1);
            }
        }
        int end = text.lastIndexOf('}');
        return end > objStart ? text.substring(objStart, end + 1) : text.substring(objStart);
    }

    private static JSONArray segmentsOf(JSONObject root) {
        JSONArray segments = root.optJSONArray("segments");
        return segments != null ? segments : new JSONArray();
    }

    /**
     * Scans a damaged reply for complete objects inside the {@code segments} array.
     */
    static List<JSONObject> recoverSegments(String json) {
        List<JSONObject> found = new ArrayList<>();
        int key = json.indexOf("\"segments\"");
        int arrayStart = json.indexOf('[', key < 0 ? 0 : key);
        if (arrayStart < 0) {
            return found;
        }

        int depth = 0;
        int objectStart = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = arrayStart + 1; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) {
                    objectStart = i;
                }
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0 && objectStart >= 0) {
                    try {
                        found.add(new JSONObject(json.substring(objectStart, i + 1)));
                    } catch (JSONException e) {
                        LOG.debug("Skipping unparseable segment object: {}", e.getMessage());
                    }
                    objectStart = -1;
                }
            } else if (c == ']' && depth == 0) {
                break;
            }
        }
        return found;
    }

    private static TextSegment toSegment(JSONObject obj) {
        String text = obj.optString("text", "").trim();
        if (text.isEmpty()) {
            return null;
        }
        BoundingBox box = toBox(obj);
        if (box == null || box.isDegenerate()) {
            LOG.debug("Dropping segment without a usable box: {}", LogSanitizer.preview(text, 20));
            return null;
        }
        double confidence = obj.optDouble("confidence", 1.0);
        if (Double.isNaN(confidence)) {
            confidence = 1.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        return TextSegment.of(text, box, confidence);
    }

    private static BoundingBox toBox(JSONObject obj) {
        JSONArray bbox = obj.optJSONArray("bbox");
        if (bbox != null) {
            if (bbox.length() != 4) {
                return null;
            }
            return BoundingBox.clamped(bbox.optDouble(0), bbox.optDouble(1),
                    bbox.optDouble(2), bbox.optDouble(3));
        }
        JSONObject rect = obj.optJSONObject("boundingBox");
        if (rect != null) {
            return BoundingBox.fromOriginAndSize(rect.optDouble("x"), rect.optDouble("y"),
                    rect.optDouble("width"), rect.optDouble("height"));
        }
        return null;
    }
}
