package com.startsmart.contextual;

import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.config.Config;
import com.startsmart.core.ContextualEvaluatorException;
import com.startsmart.model.ContextualAssessment;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks a chat model for per-category success probabilities in a fixed JSON shape.
 */
public final class LangChainContextualEvaluator implements ContextualEvaluator {
    private static final Logger LOG = LogManager.getLogger(LangChainContextualEvaluator.class);

    static final String SYSTEM_PROMPT = "You are an expert business location analyst. You assess how likely a new "
            + "business of a given category is to succeed at a location, using only the data provided. "
            + "Always answer with a single JSON object and nothing else.";

    private final ChatLanguageModel chatModel;
    private final List<String> categories;
    private final String modelName;

    public LangChainContextualEvaluator(Config config, List<String> categories) {
        ChatLanguageModel built;
        String model = config.getString("contextual.model", "llama3.1:latest");
        try {
            built = OllamaChatModel.builder()
                    .baseUrl(config.getString("contextual.base_url", "http://127.0.0.1:11434"))
                    .modelName(model)
                    .temperature(config.getDouble("contextual.temperature", 0.3))
                    .format("json")
                    .timeout(Duration.ofSeconds(Math.max(1, config.getInt("contextual.timeout_sec", 10))))
                    .build();
        } catch (RuntimeException e) {
            LOG.warn("failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            built = null;
        }
        this.chatModel = built;
        this.categories = List.copyOf(categories);
        this.modelName = model;
    }

    LangChainContextualEvaluator(ChatLanguageModel chatModel, List<String> categories) {
        this.chatModel = chatModel;
        this.categories = List.copyOf(categories);
        this.modelName = "injected";
    }

    @Override
    public String name() {
        return "langchain4j:" + modelName;
    }

    @Override
    public ContextualAssessment assess(BusinessEnvironmentVector bev) {
        if (chatModel == null) {
            throw new ContextualEvaluatorException("chat model is not available");
        }
        List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(buildPrompt(bev)));
        String raw;
        try {
            Response<AiMessage> response = chatModel.generate(messages);
            raw = response == null || response.content() == null ? "" : response.content().text();
        } catch (RuntimeException e) {
            throw new ContextualEvaluatorException("chat model call failed: " + e.getMessage(), e);
        }
        return parse(raw);
    }

    String buildPrompt(BusinessEnvironmentVector bev) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Analyze this location's business environment.\n\n");
        sb.append(bev.toPromptText());
        sb.append("\nRespond with JSON of exactly this shape:\n{\n");
        for (String category : categories) {
            sb.append("  \"").append(category).append("_probability\": <number between 0.0 and 1.0>,\n");
            sb.append("  \"").append(category).append("_reasoning\": \"<one or two sentences>\",\n");
        }
        sb.append("  \"key_factors\": [\"<factor>\", ...],\n");
        sb.append("  \"risks\": [\"<risk>\", ...],\n");
        sb.append("  \"recommendation\": \"<one sentence>\"\n}\n");
        sb.append("A probability of 0.7 or more means strong suitability, 0.4 to 0.7 moderate, below 0.4 poor.\n");
        return sb.toString();
    }

    ContextualAssessment parse(String raw) {
        String text = raw == null ? "" : raw.replace("```json", "").replace("```", "").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                return fromJson(new JSONObject(text.substring(start, end + 1)));
            } catch (JSONException e) {
                LOG.warn("contextual answer is not valid JSON, trying pattern extraction: {}", e.getMessage());
            }
        }
        return fromText(text);
    }

    private ContextualAssessment fromJson(JSONObject o) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        Map<String, String> reasoning = new LinkedHashMap<>();
        for (String category : categories) {
            double p = o.optDouble(category + "_probability", Double.NaN);
            if (!Double.isNaN(p)) {
                probabilities.put(category, clamp(p));
            }
            reasoning.put(category, o.optString(category + "_reasoning", ""));
        }
        if (probabilities.isEmpty()) {
            throw new ContextualEvaluatorException("contextual answer has no probabilities");
        }
        return ContextualAssessment.builder()
                .probabilities(probabilities)
                .reasoning(reasoning)
                .keyFactors(strings(o.optJSONArray("key_factors")))
                .risks(strings(o.optJSONArray("risks")))
                .recommendation(o.optString("recommendation", ""))
                .evaluator(name())
                .build();
    }

    private ContextualAssessment fromText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (String category : categories) {
            Pattern pattern = Pattern.compile(Pattern.quote(category.toLowerCase(Locale.ROOT)) + "[_\\s]?probability[\"\\s:]+([0-9.]+)");
            Matcher m = pattern.matcher(lower);
            if (m.find()) {
                try {
                    probabilities.put(category, clamp(Double.parseDouble(m.group(1))));
                } catch (NumberFormatException e) {
                    LOG.debug("unparseable probability for {}: {}", category, m.group(1));
                }
            }
        }
        if (probabilities.isEmpty()) {
            throw new ContextualEvaluatorException("could not extract probabilities from contextual answer");
        }
        return ContextualAssessment.builder()
                .probabilities(probabilities)
                .recommendation("")
                .evaluator(name())
                .build();
    }

    private static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            String value = array.optString(i, "").trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return List.copyOf(out);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
