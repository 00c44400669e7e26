package com.example.toolgateway.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Irreversible partial redaction of sensitive values in audit payloads.
 *
 * <ul>
 *   <li>National ID {@code 900101-1234567} → {@code ******-*******}</li>
 *   <li>Card {@code 1234-5678-9012-3456} → {@code ****-****-****-3456}</li>
 *   <li>Email {@code kim@company.com} → {@code k**@company.com}</li>
 *   <li>Mobile {@code 010-1234-5678} → {@code 010-****-5678}</li>
 *   <li>Account {@code 110-123-456789} → {@code 110-***-***789}</li>
 * </ul>
 *
 * Rules run in that order, and the whole chain repeats until the text stops
 * changing. One pass can leave a match behind when two matches share characters
 * (chained addresses such as {@code ab@cd.io@ef.io}). Every change removes
 * characters the rules match on, so the loop ends, and masked text masks to itself.
 */
@Component
@RequiredArgsConstructor
public class DataMasker {

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b(\\d{6})-?(\\d{7})\\b"),
                    m -> "******-*******"),
            new Rule(Pattern.compile("\\b(\\d{4})-?(\\d{4})-?(\\d{4})-?(\\d{4})\\b"),
                    m -> "****-****-****-" + m.group(4)),
            new Rule(Pattern.compile("\\b([a-zA-Z0-9._%+-]+)@([a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})\\b"),
                    m -> m.group(1).charAt(0) + "*".repeat(m.group(1).length() - 1) + "@" + m.group(2)),
            new Rule(Pattern.compile("\\b(01[016789])-?(\\d{3,4})-?(\\d{4})\\b"),
                    m -> m.group(1) + "-****-" + m.group(3)),
            new Rule(Pattern.compile("\\b(\\d{3})-(\\d{2,6})-(\\d{2,6})\\b"),
                    m -> {
                        String last = m.group(3);
                        int keep = Math.min(3, last.length());
                        return m.group(1) + "-" + "*".repeat(m.group(2).length()) + "-"
                                + "*".repeat(last.length() - keep) + last.substring(last.length() - keep);
                    })
    );

    private final ObjectMapper objectMapper;

    public String maskString(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String previous;
        String result = text;
        do {
            previous = result;
            for (Rule rule : RULES) {
                result = rule.apply(result);
            }
        } while (!result.equals(previous));
        return result;
    }

    public Map<String, Object> maskMap(Map<?, ?> data) {
        if (data == null) {
            return null;
        }
        Map<String, Object> masked = new LinkedHashMap<>();
        data.forEach((key, value) -> masked.put(String.valueOf(key), maskValue(value)));
        return masked;
    }

    public List<Object> maskList(Collection<?> data) {
        if (data == null) {
            return null;
        }
        List<Object> masked = new ArrayList<>(data.size());
        for (Object item : data) {
            masked.add(maskValue(item));
        }
        return masked;
    }

    /**
     * Masks a tool parameter or response payload. A string holding a JSON object
     * or array is parsed and the parsed structure is masked and returned.
     */
    public Object mask(Object payload) {
        if (payload instanceof String text) {
            Object parsed = tryParseJson(text);
            return parsed != null ? maskValue(parsed) : maskString(text);
        }
        return maskValue(payload);
    }

    private Object maskValue(Object value) {
        if (value instanceof String s) {
            return maskString(s);
        }
        if (value instanceof Map<?, ?> map) {
            return maskMap(map);
        }
        if (value instanceof Collection<?> collection) {
            return maskList(collection);
        }
        if (value instanceof Object[] array) {
            return maskList(Arrays.asList(array));
        }
        return value;
    }

    private Object tryParseJson(String text) {
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return objectMapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private record Rule(Pattern pattern, Function<MatchResult, String> replacer) {

        String apply(String text) {
            Matcher matcher = pattern.matcher(text);
            return matcher.replaceAll(m -> Matcher.quoteReplacement(replacer.apply(m)));
        }
    }
}
