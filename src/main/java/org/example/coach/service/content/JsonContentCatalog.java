package org.example.coach.service.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.example.coach.config.CoachProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Content catalog backed by two JSON documents loaded once at startup.
 * <p>
 * Quizzes are keyed {@code language -> level -> [question]}, scenarios {@code language -> [scenario]}.
 * Malformed documents fail startup; individual broken entries are skipped with a warning.
 */
@Service
public class JsonContentCatalog implements ContentCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonContentCatalog.class);

    private final CoachProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private Map<String, Map<Integer, List<QuizQuestion>>> quizzes = Map.of();
    private Map<String, Map<String, Scenario>> scenarios = Map.of();

    public JsonContentCatalog(
            CoachProperties properties,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        CoachProperties.Content content = properties.getContent();
        quizzes = parseQuizzes(readDocument(content.getQuizLocation()));
        scenarios = parseScenarios(readDocument(content.getScenarioLocation()));
        log.info("Loaded content catalog: quiz languages={}, scenario languages={}",
                quizzes.keySet(), scenarios.keySet());
    }

    @Override
    public List<QuizQuestion> getQuestions(String language, int level) {
        Map<Integer, List<QuizQuestion>> byLevel = quizzes.get(resolveLanguage(language));
        if (byLevel == null) {
            return List.of();
        }
        return byLevel.getOrDefault(level, List.of());
    }

    @Override
    public Optional<Scenario> getScenario(String language, String scenarioId) {
        if (scenarioId == null) {
            return Optional.empty();
        }
        Map<String, Scenario> byId = scenarios.get(resolveLanguage(language));
        if (byId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(scenarioId));
    }

    @Override
    public List<Scenario> listScenarios(String language) {
        Map<String, Scenario> byId = scenarios.get(resolveLanguage(language));
        if (byId == null) {
            return List.of();
        }
        return List.copyOf(byId.values());
    }

    @Override
    public String resolveLanguage(String language) {
        String fallback = properties.getContent().getDefaultLanguage();
        if (language == null || language.isBlank()) {
            return fallback;
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        if (quizzes.containsKey(normalized) || scenarios.containsKey(normalized)) {
            return normalized;
        }
        return fallback;
    }

    private JsonNode readDocument(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ContentCatalogException("Content resource not found: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(input);
            if (root == null || !root.isObject()) {
                throw new ContentCatalogException("Content resource must be a JSON object: " + location);
            }
            return root;
        } catch (IOException e) {
            throw new ContentCatalogException("Failed to parse content resource " + location, e);
        }
    }

    private Map<String, Map<Integer, List<QuizQuestion>>> parseQuizzes(JsonNode root) {
        Map<String, Map<Integer, List<QuizQuestion>>> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> languages = root.fields();
        while (languages.hasNext()) {
            Map.Entry<String, JsonNode> language = languages.next();
            Map<Integer, List<QuizQuestion>> byLevel = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> levels = language.getValue().fields();
            while (levels.hasNext()) {
                Map.Entry<String, JsonNode> level = levels.next();
                Integer levelNumber = parseLevel(level.getKey());
                if (levelNumber == null) {
                    log.warn("Skipping quiz level '{}' for language {}: not a number", level.getKey(), language.getKey());
                    continue;
                }
                List<QuizQuestion> questions = new ArrayList<>();
                for (JsonNode questionNode : level.getValue()) {
                    QuizQuestion question = parseQuestion(questionNode);
                    if (question == null) {
                        log.warn("Skipping malformed quiz question in {} level {}", language.getKey(), levelNumber);
                        continue;
                    }
                    questions.add(question);
                }
                byLevel.put(levelNumber, List.copyOf(questions));
            }
            parsed.put(language.getKey().toLowerCase(Locale.ROOT), byLevel);
        }
        return parsed;
    }

    private QuizQuestion parseQuestion(JsonNode node) {
        String prompt = node.path("prompt").asText("");
        JsonNode optionsNode = node.path("options");
        if (prompt.isBlank() || !optionsNode.isArray() || optionsNode.isEmpty()) {
            return null;
        }
        List<String> options = new ArrayList<>();
        optionsNode.forEach(option -> options.add(option.asText()));
        int correct = node.path("correct").asInt(-1);
        if (correct < 0 || correct >= options.size()) {
            return null;
        }
        return new QuizQuestion(prompt, options, correct);
    }

    private Map<String, Map<String, Scenario>> parseScenarios(JsonNode root) {
        Map<String, Map<String, Scenario>> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> languages = root.fields();
        while (languages.hasNext()) {
            Map.Entry<String, JsonNode> language = languages.next();
            Map<String, Scenario> byId = new LinkedHashMap<>();
            for (JsonNode scenarioNode : language.getValue()) {
                Scenario scenario = parseScenario(scenarioNode);
                if (scenario == null) {
                    log.warn("Skipping scenario without id in language {}", language.getKey());
                    continue;
                }
                byId.put(scenario.id(), scenario);
            }
            parsed.put(language.getKey().toLowerCase(Locale.ROOT), byId);
        }
        return parsed;
    }

    private Scenario parseScenario(JsonNode node) {
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            return null;
        }
        Map<String, ScenarioNode> nodes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("nodes").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            nodes.put(field.getKey(), parseNode(field.getKey(), field.getValue()));
        }
        String start = node.path("start").asText("");
        if (!nodes.containsKey(start)) {
            log.warn("Scenario {} declares missing start node '{}'", id, start);
        }
        return new Scenario(
                id,
                node.path("title").asText(id),
                node.path("intro").asText(""),
                start,
                node.path("reward").asInt(0),
                textOrNull(node.path("badge")),
                nodes
        );
    }

    private ScenarioNode parseNode(String nodeId, JsonNode node) {
        String text = node.path("text").asText("");
        if ("ending".equals(node.path("type").asText())) {
            JsonNode reward = node.path("reward");
            return new ScenarioNode.TerminalNode(
                    nodeId,
                    text,
                    ScenarioOutcome.fromCode(node.path("outcome").asText(null)),
                    reward.isNumber() ? reward.asInt() : null,
                    textOrNull(node.path("badge"))
            );
        }
        List<ScenarioOption> options = new ArrayList<>();
        for (JsonNode option : node.path("options")) {
            options.add(new ScenarioOption(
                    option.path("label").asText(""),
                    option.path("feedback").asText(""),
                    ScenarioImpact.fromCode(option.path("impact").asText(null)),
                    textOrNull(option.path("next"))
            ));
        }
        return new ScenarioNode.DecisionNode(nodeId, text, node.path("progress").asDouble(0.0), options);
    }

    private static Integer parseLevel(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
