package net.seanstash.application.ai;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.ai.CandidateFragment;
import net.seanstash.domain.ai.CandidateValidationError;
import net.seanstash.domain.snippet.RawCommandRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Checks extracted snippet proposals against the snippet schema and normalizes the survivors.
 *
 * <p>Over-long titles and category lists are repaired before validation. Invalid candidates
 * are reported with their index and dropped; their valid siblings are kept.</p>
 */
final class AnalysisCandidateValidator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisCandidateValidator.class);

    static final int MAX_TITLE_LENGTH = 60;
    static final int MAX_CATEGORY_COUNT = 3;
    private static final String TRUNCATION_SUFFIX = "...";

    private AnalysisCandidateValidator() {
    }

    /**
     * Result of validating one reply document.
     */
    record Outcome(List<AnalysisCandidate> validCandidates, List<CandidateValidationError> errors) {
    }

    /**
     * Validates every candidate in the document.
     *
     * @param document parsed reply JSON
     * @param maxCandidates cap on returned valid candidates
     * @throws AnalysisExtractionException when the document holds no candidate array
     */
    static Outcome validate(JsonNode document, int maxCandidates) {
        List<JsonNode> rawCandidates = resolveCandidates(document);
        List<AnalysisCandidate> valid = new ArrayList<>();
        List<CandidateValidationError> errors = new ArrayList<>();

        for (int index = 0; index < rawCandidates.size(); index++) {
            List<String> problems = new ArrayList<>();
            AnalysisCandidate candidate = validateCandidate(rawCandidates.get(index), problems);
            if (candidate == null) {
                errors.add(new CandidateValidationError(index, problems));
            } else {
                valid.add(candidate);
            }
        }

        if (valid.size() > maxCandidates) {
            log.warn("Model returned {} valid snippets; keeping the first {}", valid.size(), maxCandidates);
            valid = new ArrayList<>(valid.subList(0, maxCandidates));
        }
        return new Outcome(List.copyOf(valid), List.copyOf(errors));
    }

    private static List<JsonNode> resolveCandidates(JsonNode document) {
        if (document == null || document.isNull()) {
            throw new AnalysisExtractionException("Response JSON was empty");
        }
        if (document.isArray()) {
            return elements(document);
        }
        if (document.isObject()) {
            Optional<JsonNode> array = resolveJsonNode(document, "snippets", "candidates");
            if (array.isPresent() && array.get().isArray()) {
                return elements(array.get());
            }
            if (resolveJsonNode(document, "title", "name").isPresent()) {
                return List.of(document);
            }
        }
        throw new AnalysisExtractionException("Response JSON did not contain a snippet array");
    }

    private static AnalysisCandidate validateCandidate(JsonNode node, List<String> problems) {
        if (node == null || !node.isObject()) {
            problems.add("candidate must be an object");
            return null;
        }

        Optional<String> title = text(node, "title", "name")
            .map(AnalysisCandidateValidator::stripRawTitlePrefix)
            .filter(StringUtils::hasText)
            .map(AnalysisCandidateValidator::fitTitle);
        if (title.isEmpty()) {
            problems.add("title is required");
        }
        Optional<String> description = text(node, "description", "summary");
        if (description.isEmpty()) {
            problems.add("description is required");
        }
        List<String> categories = categories(node, problems);
        List<CandidateFragment> fragments = fragments(node, problems);

        if (!problems.isEmpty()) {
            return null;
        }
        return new AnalysisCandidate(title.get(), description.get(), categories, fragments, false, false);
    }

    /**
     * Raw command records own the {@code Terminal:} title prefix; enhanced titles never carry it.
     */
    static String stripRawTitlePrefix(String title) {
        String stripped = title;
        while (stripped.startsWith(RawCommandRecord.TITLE_PREFIX)) {
            stripped = stripped.substring(RawCommandRecord.TITLE_PREFIX.length()).trim();
        }
        if (!stripped.equals(title)) {
            log.warn("Removed raw command prefix from candidate title '{}'", title);
        }
        return stripped;
    }

    static String fitTitle(String title) {
        if (title.length() <= MAX_TITLE_LENGTH) {
            return title;
        }
        return title.substring(0, MAX_TITLE_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
    }

    private static List<String> categories(JsonNode node, List<String> problems) {
        Optional<JsonNode> categoriesNode = resolveJsonNode(node, "categories", "tags");
        if (categoriesNode.isEmpty() || !categoriesNode.get().isArray()) {
            problems.add("categories must be an array");
            return List.of();
        }
        List<JsonNode> raw = elements(categoriesNode.get());
        if (raw.size() > MAX_CATEGORY_COUNT) {
            raw = raw.subList(0, MAX_CATEGORY_COUNT);
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            JsonNode category = raw.get(i);
            if (category == null || !category.isString()) {
                problems.add("categories[" + i + "] must be a string");
                continue;
            }
            String value = category.asString().trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return List.copyOf(normalized);
    }

    private static List<CandidateFragment> fragments(JsonNode node, List<String> problems) {
        Optional<JsonNode> fragmentsNode = resolveJsonNode(node, "fragments", "files");
        if (fragmentsNode.isEmpty() || !fragmentsNode.get().isArray() || fragmentsNode.get().isEmpty()) {
            problems.add("fragments must be a non-empty array");
            return List.of();
        }
        List<JsonNode> raw = elements(fragmentsNode.get());
        List<CandidateFragment> fragments = new ArrayList<>();
        for (int position = 0; position < raw.size(); position++) {
            JsonNode fragment = raw.get(position);
            String prefix = "fragments[" + position + "]";
            if (fragment == null || !fragment.isObject()) {
                problems.add(prefix + " must be an object");
                continue;
            }
            Optional<String> fileName = text(fragment, "file_name", "fileName", "filename");
            Optional<String> code = text(fragment, "code", "content");
            Optional<String> language = text(fragment, "language", "lang");
            if (fileName.isEmpty()) {
                problems.add(prefix + ".file_name is required");
            }
            if (code.isEmpty()) {
                problems.add(prefix + ".code is required");
            }
            if (language.isEmpty()) {
                problems.add(prefix + ".language is required");
            }
            if (fileName.isPresent() && code.isPresent() && language.isPresent()) {
                fragments.add(new CandidateFragment(
                    fileName.get(), code.get(), language.get().toLowerCase(Locale.ROOT), position));
            }
        }
        return fragments;
    }

    private static Optional<String> text(JsonNode payload, String field, String... aliases) {
        return resolveJsonNode(payload, field, aliases)
            .filter(JsonNode::isString)
            .map(JsonNode::asString)
            .filter(StringUtils::hasText)
            .map(String::trim);
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> values = new ArrayList<>();
        for (JsonNode element : array) {
            values.add(element);
        }
        return values;
    }

    private static Optional<JsonNode> resolveJsonNode(JsonNode payload, String field, String... aliases) {
        JsonNode node = payload.get(field);
        if (node != null && !node.isNull()) {
            return Optional.of(node);
        }
        for (String alias : aliases) {
            JsonNode aliasNode = payload.get(alias);
            if (aliasNode != null && !aliasNode.isNull()) {
                return Optional.of(aliasNode);
            }
        }
        return Optional.empty();
    }
}
