package com.brandinsight.research.service.quality;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 수집 데이터 배치의 신뢰도 점수(0-100) 계산.
 *
 * 중복 비율, 필수 필드 누락, 값 범위, 기대 개수 대비 부족분을 감점 요소로 사용합니다.
 * 필수 필드 누락은 이슈 하나로 보고하되 감점은 누락 레코드마다 부과합니다.
 * 부수효과가 없고 예외를 던지지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataQualityScorer {

    static final double DUPLICATE_RATIO_LIMIT = 0.3;
    static final long FOLLOWER_CEILING = 10_000_000L;
    static final double ISSUE_PENALTY = 15;
    /** Charged per incomplete record; at least ISSUE_PENALTY so breaking a duplicate never pays off */
    static final double MISSING_FIELD_PENALTY = ISSUE_PENALTY;
    static final double WARNING_PENALTY = 5;
    static final double DEFICIT_WEIGHT = 30;
    static final double SMALL_BATCH_PENALTY = 20;
    static final int SMALL_BATCH_SIZE = 3;
    static final double RELIABLE_SCORE = 70;

    private final ObjectMapper objectMapper;

    public QualityScoreReport score(String source, List<?> records, QualityDataType dataType) {
        return score(source, records, dataType, null);
    }

    public QualityScoreReport score(String source, List<?> records, QualityDataType dataType, Integer expectedCount) {
        List<?> batch = records == null ? List.of() : records;
        String label = dataType.getLabel();
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        Set<String> usable = new HashSet<>();
        int duplicates = 0;
        int missing = 0;

        for (Object record : batch) {
            JsonNode node = toNode(record);
            String key = node.toString();
            if (!seen.add(key)) {
                duplicates++;
            }

            if (hasRequiredFields(node, dataType)) {
                usable.add(key);
            } else {
                missing++;
            }

            JsonNode followers = node.has("followers") ? node.get("followers") : node.get("followerCount");
            if (followers != null && followers.isNumber() && followers.asLong() > FOLLOWER_CEILING) {
                issues.add(String.format("%s: Unrealistic follower count (%d) for handle %s",
                        label, followers.asLong(), node.path("handle").asText("?")));
            }
        }

        if (duplicates > batch.size() * DUPLICATE_RATIO_LIMIT) {
            issues.add(String.format("%s: High duplicate rate (%d/%d) - possible provider loop",
                    label, duplicates, batch.size()));
        }
        boolean missingIssue = missing > 0;
        if (missingIssue) {
            issues.add(String.format("%s: %d items missing critical fields", label, missing));
        }

        double score = 100;
        score -= (issues.size() - (missingIssue ? 1 : 0)) * ISSUE_PENALTY;
        score -= missing * MISSING_FIELD_PENALTY;
        score -= warnings.size() * WARNING_PENALTY;

        // shortfall is measured on distinct complete records so padding never helps
        int usableCount = usable.size();
        if (expectedCount != null && expectedCount > 0 && usableCount < expectedCount) {
            int deficit = expectedCount - usableCount;
            score -= ((double) deficit / expectedCount) * DEFICIT_WEIGHT;
            warnings.add(String.format("Expected %d items, got %d", expectedCount, usableCount));
        }
        if (expectedCount != null && expectedCount > SMALL_BATCH_SIZE && usableCount < SMALL_BATCH_SIZE) {
            score -= SMALL_BATCH_PENALTY;
            issues.add("Insufficient data: only " + usableCount + " items");
        }

        score = Math.max(0, Math.min(100, score));
        QualityScoreReport report = new QualityScoreReport(
                source, score, List.copyOf(issues), List.copyOf(warnings), score >= RELIABLE_SCORE);

        if (!report.reliable()) {
            log.warn("[DataQuality] {} scored {} ({} issues): {}", source, score, issues.size(), issues);
        } else {
            log.debug("[DataQuality] {} scored {}", source, score);
        }
        return report;
    }

    private JsonNode toNode(Object record) {
        if (record == null) {
            return objectMapper.getNodeFactory().nullNode();
        }
        try {
            return objectMapper.valueToTree(record);
        } catch (IllegalArgumentException e) {
            log.debug("[DataQuality] Unserialisable record {}: {}", record, e.getMessage());
            return objectMapper.getNodeFactory().textNode(String.valueOf(record));
        }
    }

    private static boolean hasRequiredFields(JsonNode node, QualityDataType dataType) {
        return switch (dataType) {
            case COMPETITOR -> present(node, "handle") && present(node, "platform");
            case POST -> present(node, "externalId") || present(node, "url");
            case PROFILE -> present(node, "handle");
            case INSIGHT -> present(node, "url");
            case GENERIC -> !node.isNull();
        };
    }

    private static boolean present(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.asText().isBlank();
    }
}
