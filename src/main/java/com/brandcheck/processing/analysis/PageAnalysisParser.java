package com.brandcheck.processing.analysis;

import com.brandcheck.processing.model.PageAnalysis;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw text of a vision model answer into a {@link PageAnalysis}.
 * <p>
 * Accepts answers wrapped in markdown code fences or surrounded by prose, and tolerates the usual
 * LLM JSON slips (trailing commas, comments, single quotes). An answer without a numeric
 * {@code overallScore} in 0..10 is rejected.
 */
@Component
public class PageAnalysisParser {

    private static final Logger logger = LoggerFactory.getLogger(PageAnalysisParser.class);
    private static final double MIN_SCORE = 0.0;
    private static final double MAX_SCORE = 10.0;

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    /**
     * @throws AnalysisParseException if no valid analysis can be read from the text
     */
    public PageAnalysis parse(String responseText) throws AnalysisParseException {
        if (responseText == null || responseText.isBlank()) {
            throw new AnalysisParseException("Empty analysis response");
        }

        JsonNode root = readJson(extractJson(responseText));
        if (!root.isObject()) {
            throw new AnalysisParseException("Analysis response is not a JSON object");
        }

        JsonNode scoreNode = root.get("overallScore");
        if (scoreNode == null || !scoreNode.isNumber()) {
            throw new AnalysisParseException("Analysis response has no numeric overallScore");
        }
        double overallScore = scoreNode.asDouble();
        if (overallScore < MIN_SCORE || overallScore > MAX_SCORE) {
            throw new AnalysisParseException("overallScore out of range: " + overallScore);
        }

        PageAnalysis analysis = new PageAnalysis();
        analysis.setOverallScore(overallScore);
        // Brand score falls back to the overall score when the model omits it
        analysis.setBrandComplianceScore(root.path("brandCompliance").path("score").asDouble(overallScore));
        analysis.setCriticalViolations(textList(root.get("criticalViolations")));
        analysis.setViolations(collectIssues(root));
        analysis.setRecommendations(textList(root.get("recommendations")));
        JsonNode summary = root.get("summary");
        analysis.setSummary(summary != null && summary.isTextual() ? summary.asText() : null);
        return analysis;
    }

    /**
     * Strips code fences and any prose around the outermost JSON object.
     */
    String extractJson(String responseText) {
        String cleaned = responseText.trim();

        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start > 0 || (end >= 0 && end < cleaned.length() - 1)) {
            if (start >= 0 && end > start) {
                cleaned = cleaned.substring(start, end + 1);
            }
        }
        return cleaned;
    }

    private JsonNode readJson(String json) throws AnalysisParseException {
        try {
            return LENIENT_MAPPER.readTree(json);
        } catch (Exception e) {
            logger.warn("Failed to parse analysis response: {}", json.substring(0, Math.min(200, json.length())));
            throw new AnalysisParseException("Failed to parse analysis response: " + e.getMessage(), e);
        }
    }

    /**
     * Gathers every {@code issues} array found one or two levels under the section objects
     * (brandCompliance.colors.issues, designQuality.whitespace.issues, ...), prefixed by their category.
     */
    private List<String> collectIssues(JsonNode root) {
        List<String> issues = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> sections = root.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            if (!section.getValue().isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> categories = section.getValue().fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> category = categories.next();
                for (String issue : textList(category.getValue().get("issues"))) {
                    issues.add(category.getKey() + ": " + issue);
                }
            }
        }
        return issues;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
