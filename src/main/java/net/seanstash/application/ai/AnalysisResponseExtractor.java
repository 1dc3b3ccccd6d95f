package net.seanstash.application.ai;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;

/**
 * Pulls the JSON document out of a conversational model reply.
 *
 * <p>A fenced {@code json} block wins when it parses. Otherwise every brace-delimited
 * span is tried and the parsed object with the longest serialized form is returned.</p>
 */
class AnalysisResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResponseExtractor.class);
    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    AnalysisResponseExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @throws AnalysisExtractionException when no parseable JSON object is present
     */
    JsonNode extract(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new AnalysisExtractionException("No valid JSON found in empty response");
        }

        Optional<JsonNode> fenced = parseFencedBlock(responseText);
        if (fenced.isPresent()) {
            return fenced.get();
        }

        JsonNode best = null;
        int bestLength = -1;
        for (String span : braceSpans(responseText)) {
            Optional<JsonNode> parsed = tryParse(span);
            if (parsed.isEmpty() || !parsed.get().isObject()) {
                continue;
            }
            int length = objectMapper.writeValueAsString(parsed.get()).length();
            if (length > bestLength) {
                best = parsed.get();
                bestLength = length;
            }
        }
        if (best == null) {
            throw new AnalysisExtractionException("No valid JSON found in response");
        }
        return best;
    }

    private Optional<JsonNode> parseFencedBlock(String responseText) {
        Matcher matcher = FENCED_JSON.matcher(responseText);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Optional<JsonNode> parsed = tryParse(matcher.group(1));
        if (parsed.isEmpty()) {
            log.warn("Fenced JSON block did not parse; falling back to brace extraction");
        }
        return parsed;
    }

    private Optional<JsonNode> tryParse(String candidate) {
        try {
            JsonNode node = strictReader.readValue(candidate);
            return Optional.ofNullable(node);
        } catch (JacksonException exception) {
            return Optional.empty();
        }
    }

    /**
     * Balanced spans from every opening brace, nested ones included, plus the greedy first-to-last span.
     */
    static List<String> braceSpans(String text) {
        Set<String> spans = new LinkedHashSet<>();
        int index = 0;
        while (index < text.length()) {
            int open = text.indexOf('{', index);
            if (open < 0) {
                break;
            }
            int close = findBalancedClose(text, open);
            if (close < 0) {
                index = open + 1;
                continue;
            }
            spans.add(text.substring(open, close + 1));
            index = open + 1;
        }

        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        if (first >= 0 && last > first) {
            spans.add(text.substring(first, last + 1));
        }
        return new ArrayList<>(spans);
    }

    private static int findBalancedClose(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char current = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (current == '\\') {
                    escaped = true;
                } else if (current == '"') {
                    inString = false;
                }
                continue;
            }
            if (current == '"') {
                inString = true;
            } else if (current == '{') {
                depth++;
            } else if (current == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
