package com.medwatch.anomaly.engine.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.medwatch.anomaly.model.AnomalyDetails;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Action for rules defined at run time. Fills {@code {field.path}} placeholders in the
 * message from the rule context and reports the referenced fields as details.
 */
public class TemplateAction implements RuleAction {

    private final String type;
    private final Severity severity;
    private final String messageTemplate;
    private final String description;

    public TemplateAction(String type, Severity severity, String messageTemplate, String description) {
        this.type = type;
        this.severity = severity;
        this.messageTemplate = messageTemplate;
        this.description = description;
    }

    @Override
    public AnomalyDetails apply(RuleContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        DataPoint dp = context.getDataPoint();
        details.put("medicineName", dp.getMedicineName());
        details.put("location", dp.getLocation());
        details.put("currentStock", dp.getCurrentStock());

        String message = render(messageTemplate, context, details);
        List<String> causes = new ArrayList<>();
        causes.add(type);

        return AnomalyDetails.builder()
                .type(type)
                .severity(severity)
                .message(message)
                .description(description)
                .details(details)
                .causes(causes)
                .build();
    }

    private static String render(String template, RuleContext context, Map<String, Object> details) {
        if (template == null) return null;
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            int open = template.indexOf('{', i);
            int close = open < 0 ? -1 : template.indexOf('}', open);
            if (open < 0 || close < 0) {
                out.append(template, i, template.length());
                break;
            }
            out.append(template, i, open);
            String path = template.substring(open + 1, close).trim();
            JsonNode node = context.resolve(path);
            String value = node.isMissingNode() || node.isNull() ? "N/A" : node.asText();
            details.putIfAbsent(path, value);
            out.append(value);
            i = close + 1;
        }
        return out.toString();
    }
}
