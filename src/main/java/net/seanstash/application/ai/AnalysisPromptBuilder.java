package net.seanstash.application.ai;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the single-turn analysis prompt for a command batch.
 */
final class AnalysisPromptBuilder {

    private static final String TEMPLATE = """
        You are a terminal instructor who turns raw shell history into short, teachable snippets.

        COMMANDS:
        %s

        RULES:
        - title: a compact form of the command itself, at most 60 characters (e.g. "docker build -t image").
        - description: open with a plain-language analogy for what the command does, then say when it is useful.
        - fragments: one or more files; each has file_name, code and language. The code shows the basic
          invocation, explains each flag in comments, and adds advanced variations.
        - categories: at most 3 lower-case labels (tool, action, purpose).
        - Return at most %d snippets.
        - %s

        Respond with ONLY valid JSON of this shape, no other text:
        {
          "snippets": [
            {
              "title": "docker ps",
              "description": "docker ps is like a task manager for containers...",
              "categories": ["docker", "monitoring"],
              "fragments": [
                {"file_name": "docker-ps.sh", "code": "# list running containers\\ndocker ps", "language": "bash", "position": 0}
              ]
            }
          ]
        }
        """;

    private static final String GROUP_HINT = "Group closely related commands into one snippet.";
    private static final String SEPARATE_HINT = "Write one snippet per distinct command.";

    private AnalysisPromptBuilder() {
    }

    static String build(List<String> commands, AnalysisOptions options) {
        String numbered = IntStream.range(0, commands.size())
            .mapToObj(index -> (index + 1) + ". " + commands.get(index))
            .collect(Collectors.joining("\n"));
        return TEMPLATE.formatted(
            numbered,
            options.maxCandidates(),
            options.groupSimilar() ? GROUP_HINT : SEPARATE_HINT
        );
    }
}
