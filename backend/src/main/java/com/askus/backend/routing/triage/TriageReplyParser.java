package com.askus.backend.routing.triage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decodes the model's JSON replies. Markdown code fences are stripped; when
 * the reply still is not a JSON document, the first balanced object in it is
 * tried. Anything else is reported as malformed (empty result).
 */
public class TriageReplyParser {

    private static final Logger log = LoggerFactory.getLogger(TriageReplyParser.class);
    private static final int LOGGED_CHARS = 300;

    private final ObjectMapper mapper;

    public TriageReplyParser() {
        this(new ObjectMapper());
    }

    public TriageReplyParser(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClarificationReply(String question, List<OptionReply> options) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionReply(String label, String value, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArbitrationReply(@JsonProperty("chosen_agent") String chosenAgent,
                                   Double confidence,
                                   String reasoning) {}

    public Optional<ClarificationReply> parseClarification(String raw) {
        return decode(raw, ClarificationReply.class);
    }

    public Optional<ArbitrationReply> parseArbitration(String raw) {
        return decode(raw, ArbitrationReply.class);
    }

    private <T> Optional<T> decode(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) {
            log.info("empty {} from model", type.getSimpleName());
            return Optional.empty();
        }

        String body = stripFences(raw);
        try {
            return Optional.ofNullable(mapper.readValue(body, type));
        } catch (JsonProcessingException first) {
            String json = extractFirstJsonObject(body);
            if (json != null) {
                try {
                    return Optional.ofNullable(mapper.readValue(json, type));
                } catch (JsonProcessingException ignored) {
                    // reported below with the raw text
                }
            }
            log.warn("malformed {} from model: {} | raw={}", type.getSimpleName(),
                    first.getOriginalMessage(), truncate(raw));
            return Optional.empty();
        }
    }

    static String stripFences(String raw) {
        String s = raw.trim();
        if (!s.startsWith("```")) return s;

        int firstNewline = s.indexOf('\n');
        s = (firstNewline < 0) ? s.substring(3) : s.substring(firstNewline + 1);
        int close = s.lastIndexOf("```");
        if (close >= 0) s = s.substring(0, close);
        return s.trim();
    }

    static String extractFirstJsonObject(String raw) {
        if (raw == null) return null;

        int start = raw.indexOf('{');
        if (start < 0) return null;

        int depth = 0;
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return raw.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    private static String truncate(String s) {
        return s.length() <= LOGGED_CHARS ? s : s.substring(0, LOGGED_CHARS) + "...";
    }
}
