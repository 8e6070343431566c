package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.ExtractionResult;
import com.example.awardcertificates.util.AwardDateNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the free-form reply of the recognition model onto the certificate
 * field schema. Malformed replies degrade to a partial result with the
 * unparsed remainder kept as notes; this class never throws on content.
 */
@Component
public class ExtractionResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ExtractionResponseParser.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final int MAX_NOTE_LENGTH = 2000;

    private static final Map<CertificateField, Pattern> LABELLED_PATTERNS = labelledPatterns();

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractionResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return ExtractionResult.of(Map.of(), "Recognition service returned an empty reply");
        }
        String json = locateJson(reply);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.warn("Recognition reply is not JSON, falling back to labelled-line matching");
            return parseLabelled(reply);
        }
        if (root == null || !root.isObject()) {
            return ExtractionResult.of(Map.of(), "Reply JSON is not an object: " + abbreviate(json));
        }
        return parseObject(root);
    }

    private ExtractionResult parseObject(JsonNode root) {
        Map<CertificateField, String> fields = new EnumMap<>(CertificateField.class);
        Map<String, String> remainder = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            Optional<CertificateField> field = CertificateField.fromWireName(entry.getKey());
            if (field.isEmpty()) {
                remainder.put(entry.getKey(), value.toString());
                continue;
            }
            if (value.isNull() || value.isMissingNode()) {
                continue;
            }
            if (value.isValueNode()) {
                String text = value.asText();
                if (!text.isBlank() && !"null".equalsIgnoreCase(text.trim())) {
                    fields.put(field.get(), text.trim());
                }
            } else {
                notes.add("Field " + entry.getKey() + " has unexpected structure: " + abbreviate(value.toString()));
            }
        }
        normalizeAwardDate(fields, notes);
        if (!remainder.isEmpty()) {
            notes.add("Unrecognised keys: " + abbreviate(remainder.toString()));
        }
        return ExtractionResult.of(fields, notes.isEmpty() ? null : String.join("; ", notes));
    }

    private ExtractionResult parseLabelled(String reply) {
        Map<CertificateField, String> fields = new EnumMap<>(CertificateField.class);
        LABELLED_PATTERNS.forEach((field, pattern) -> {
            Matcher matcher = pattern.matcher(reply);
            if (matcher.find()) {
                fields.put(field, matcher.group(1).trim());
            }
        });
        List<String> notes = new ArrayList<>();
        notes.add("Reply was not JSON; fields recovered by pattern matching. Raw reply: " + abbreviate(reply));
        normalizeAwardDate(fields, notes);
        return ExtractionResult.of(fields, String.join("; ", notes));
    }

    private void normalizeAwardDate(Map<CertificateField, String> fields, List<String> notes) {
        String raw = fields.get(CertificateField.AWARD_DATE);
        if (raw == null) {
            return;
        }
        Optional<String> normalized = AwardDateNormalizer.normalize(raw);
        if (normalized.isPresent()) {
            fields.put(CertificateField.AWARD_DATE, normalized.get());
        } else {
            notes.add("Award date '" + raw + "' kept as printed");
        }
    }

    private static String locateJson(String reply) {
        Matcher fenced = FENCED_JSON.matcher(reply);
        if (fenced.find()) {
            return fenced.group(1);
        }
        String trimmed = reply.trim();
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start > 0 && end > start) {
            return trimmed.substring(start, end + 1);
        }
        return trimmed;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_NOTE_LENGTH ? text : text.substring(0, MAX_NOTE_LENGTH) + "...";
    }

    private static Map<CertificateField, Pattern> labelledPatterns() {
        Map<CertificateField, Pattern> patterns = new EnumMap<>(CertificateField.class);
        patterns.put(CertificateField.DEPARTMENT, Pattern.compile("学院[：:]\\s*([^\\n,，]+)"));
        patterns.put(CertificateField.COMPETITION_NAME, Pattern.compile("竞赛(?:项目)?(?:名称)?[：:]\\s*([^\\n,，]+)"));
        patterns.put(CertificateField.STUDENT_ID, Pattern.compile("学号[：:]\\s*(\\d{13})"));
        patterns.put(CertificateField.STUDENT_NAME, Pattern.compile("(?<!教师)姓名[：:]\\s*([^\\n,，]+)"));
        patterns.put(CertificateField.AWARD_CATEGORY, Pattern.compile("类别[：:]\\s*(国家级|省级)"));
        patterns.put(CertificateField.AWARD_LEVEL, Pattern.compile("等级[：:]\\s*([一二三]等奖|[金银铜]奖|优秀奖)"));
        patterns.put(CertificateField.COMPETITION_TYPE, Pattern.compile("类型[：:]\\s*([AB]类)"));
        patterns.put(CertificateField.ORGANIZER, Pattern.compile("主办(?:单位)?[：:]\\s*([^\\n,，]+)"));
        patterns.put(CertificateField.AWARD_DATE,
                Pattern.compile("时间[：:]\\s*(\\d{4}[年/.-]\\d{1,2}[月/.-]\\d{1,2}日?)"));
        patterns.put(CertificateField.ADVISOR, Pattern.compile("指导教师[：:]\\s*([^\\n,，]+)"));
        return patterns;
    }
}
