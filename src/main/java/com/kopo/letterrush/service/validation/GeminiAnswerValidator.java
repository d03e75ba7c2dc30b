package com.kopo.letterrush.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks Gemini to judge the whole batch in a single generateContent call.
 * Any transport error, non-2xx reply or unparsable text ends in {@link JudgeUnavailableException}.
 */
public class GeminiAnswerValidator implements AnswerValidator {

    private static final Logger logger = LoggerFactory.getLogger(GeminiAnswerValidator.class);

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;

    public GeminiAnswerValidator(RestTemplate restTemplate, ObjectMapper objectMapper, String apiUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Map<String, AnswerVerdict> validate(ValidationBatch batch) {
        String prompt = createPrompt(batch);
        logger.debug("Gemini prompt for letter {}: {}", batch.letter(), prompt);
        String text = callGeminiAPI(prompt);
        Map<String, AnswerVerdict> verdicts = parseVerdicts(text);
        logger.info("Gemini judged {} of {} pairs for letter {}", verdicts.size(), batch.candidates().size(), batch.letter());
        return verdicts;
    }

    @Override
    public String name() {
        return "gemini";
    }

    String createPrompt(ValidationBatch batch) {
        String words;
        try {
            words = objectMapper.writeValueAsString(batch.keys());
        } catch (JsonProcessingException e) {
            throw new JudgeUnavailableException("Could not serialize words for the judge", e);
        }
        return String.format(
            "You are a strict judge for the game 'Państwa-Miasta' (Categories). " +
            "Letter is '%s'. " +
            "Check if each word is valid for its category and starts with the letter. " +
            "Allow minor typos. " +
            "Categories in this game: %s. " +
            "Respond ONLY with a JSON object where keys are 'category:word' (exactly as provided in input, lowercase) " +
            "and value is { \"isValid\": boolean, \"reason\": string }.\n\n" +
            "Words to validate: %s",
            batch.letter(),
            String.join(", ", batch.categories()),
            words
        );
    }

    private String callGeminiAPI(String prompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        Map<String, Object> contents = new HashMap<>();
        contents.put("parts", List.of(part));
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("contents", List.of(contents));

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);
        String url = apiUrl + "?key=" + apiKey;

        ResponseEntity<Map> response;
        try {
            response = restTemplate.postForEntity(url, request, Map.class);
        } catch (RestClientException e) {
            throw new JudgeUnavailableException("Gemini call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new JudgeUnavailableException("Gemini returned " + response.getStatusCode());
        }
        try {
            Map<String, Object> body = response.getBody();
            List<Map<String, Object>> candidates = (List<Map<String, Object>>) body.get("candidates");
            if (candidates != null && !candidates.isEmpty()) {
                Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
                List<Map<String, Object>> responseParts = content == null ? null : (List<Map<String, Object>>) content.get("parts");
                if (responseParts != null && !responseParts.isEmpty() && responseParts.get(0).get("text") != null) {
                    return (String) responseParts.get(0).get("text");
                }
            }
        } catch (ClassCastException e) {
            throw new JudgeUnavailableException("Unexpected Gemini response shape", e);
        }
        throw new JudgeUnavailableException("Gemini response had no text part");
    }

    Map<String, AnswerVerdict> parseVerdicts(String text) {
        Matcher matcher = JSON_OBJECT.matcher(text == null ? "" : text);
        if (!matcher.find()) {
            throw new JudgeUnavailableException("No JSON object in Gemini reply");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new JudgeUnavailableException("Gemini reply is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new JudgeUnavailableException("Gemini reply is not a JSON object");
        }

        Map<String, AnswerVerdict> verdicts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode verdict = field.getValue();
            if (!verdict.isObject() || !verdict.has("isValid")) {
                throw new JudgeUnavailableException("Malformed verdict for " + field.getKey());
            }
            String key = field.getKey().trim().toLowerCase(Locale.ROOT);
            verdicts.put(key, new AnswerVerdict(verdict.path("isValid").asBoolean(false), verdict.path("reason").asText("")));
        }
        return verdicts;
    }
}
