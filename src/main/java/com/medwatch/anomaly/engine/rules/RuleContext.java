package com.medwatch.anomaly.engine.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.EnrichedDataPoint;

/**
 * What a rule sees while being evaluated: the enriched data point and the helper functions.
 *
 * Declarative conditions address fields by dotted path. Data point fields live at the root
 * (an optional {@code data.} prefix is accepted) and feature groups under
 * {@code derived}, {@code temporal}, {@code normalized} and {@code contextual}.
 * Arrays support numeric index segments and a {@code length} segment.
 */
public class RuleContext {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EnrichedDataPoint data;
    private final RuleHelpers helpers;
    private ObjectNode fieldView;

    public RuleContext(EnrichedDataPoint data, RuleHelpers helpers) {
        this.data = data;
        this.helpers = helpers;
    }

    public EnrichedDataPoint getData() {
        return data;
    }

    public DataPoint getDataPoint() {
        return data.getDataPoint();
    }

    public RuleHelpers getHelpers() {
        return helpers;
    }

    /**
     * Resolve a dotted field path. Returns a missing node when any segment is absent.
     */
    public JsonNode resolve(String path) {
        if (path == null || path.isBlank()) return MissingNode.getInstance();
        String normalized = path.startsWith("data.") ? path.substring(5) : path;

        JsonNode node = fieldView();
        for (String segment : normalized.split("\\.")) {
            if (node == null || node.isMissingNode() || node.isNull()) {
                return MissingNode.getInstance();
            }
            if (node.isArray()) {
                if ("length".equals(segment)) {
                    node = IntNode.valueOf(node.size());
                } else if (segment.chars().allMatch(Character::isDigit)) {
                    node = node.path(Integer.parseInt(segment));
                } else {
                    return MissingNode.getInstance();
                }
            } else {
                node = node.path(segment);
            }
        }
        return node;
    }

    private synchronized ObjectNode fieldView() {
        if (fieldView == null) {
            ObjectNode root = MAPPER.valueToTree(data.getDataPoint());
            root.set("derived", MAPPER.valueToTree(data.getDerived()));
            root.set("temporal", MAPPER.valueToTree(data.getTemporal()));
            root.set("normalized", MAPPER.valueToTree(data.getNormalized()));
            root.set("contextual", MAPPER.valueToTree(data.getContextual()));
            fieldView = root;
        }
        return fieldView;
    }
}
