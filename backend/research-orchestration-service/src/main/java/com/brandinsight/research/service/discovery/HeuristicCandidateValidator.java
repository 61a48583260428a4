package com.brandinsight.research.service.discovery;

import com.brandinsight.research.dto.CandidateCompetitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 후보 경쟁사 핸들 휴리스틱 검증.
 *
 * 네트워크 호출 없이 형식, 대상 자신 여부, 일반 단어 차단 목록, 노이즈 패턴, 니치 연관성으로
 * 신뢰도를 다시 계산합니다.
 */
@Component
@Slf4j
public class HeuristicCandidateValidator implements CandidateValidator {

    static final double NOISY_PENALTY = 0.3;
    static final double NICHE_BONUS = 0.05;
    static final double MEGA_ACCOUNT_CONFIDENCE = 0.2;

    private static final Pattern HANDLE_FORMAT = Pattern.compile("^[a-z0-9._]{2,30}$");

    private static final Set<String> GENERIC_WORDS = Set.of(
            "instagram", "tiktok", "youtube", "www", "competitors", "competitor", "similar", "like", "follow",
            "official", "business", "marketing", "brand", "brands", "company", "companies", "enterprise",
            "support", "blog", "shop", "store", "stores", "community", "creator", "creators", "content",
            "social", "media", "news", "viral", "quotes", "motivation"
    );

    private static final Set<String> MEGA_ACCOUNTS = Set.of(
            "leomessi", "cristiano", "therock", "kyliejenner", "selenagomez", "arianagrande", "beyonce",
            "kimkardashian", "justinbieber", "taylorswift", "neymarjr", "kendalljenner", "nickiminaj",
            "zendaya", "shakira", "natgeo", "nike"
    );

    @Override
    public List<CandidateValidationResult> validateBatch(List<CandidateCompetitor> candidates,
                                                         String niche, String targetHandle) {
        String target = CandidateCompetitor.normalizeHandle(targetHandle);
        List<String> nicheTokens = nicheTokens(niche);

        List<CandidateValidationResult> results = new ArrayList<>(candidates.size());
        for (CandidateCompetitor candidate : candidates) {
            results.add(validate(candidate, target, nicheTokens));
        }
        long accepted = results.stream().filter(CandidateValidationResult::valid).count();
        log.debug("[Validator] {} of {} candidates passed", accepted, candidates.size());
        return results;
    }

    CandidateValidationResult validate(CandidateCompetitor candidate, String target, List<String> nicheTokens) {
        String handle = CandidateCompetitor.normalizeHandle(candidate.handle());

        if (!HANDLE_FORMAT.matcher(handle).matches() || handle.contains(".com") || handle.contains(".net")
                || handle.contains(".org")) {
            return CandidateValidationResult.reject(candidate, "Invalid handle format");
        }
        if (handle.equals(target)) {
            return CandidateValidationResult.reject(candidate, "Target itself");
        }
        if (GENERIC_WORDS.contains(handle) || SocialHandleExtractor.ROUTE_WORDS.contains(handle)) {
            return CandidateValidationResult.reject(candidate, "Generic word");
        }
        if (MEGA_ACCOUNTS.contains(handle)) {
            return new CandidateValidationResult(candidate, true, MEGA_ACCOUNT_CONFIDENCE, "Mega account, not a peer");
        }

        double confidence = candidate.relevanceScore();
        String reason = "Format valid";
        if (looksNoisy(handle)) {
            confidence -= NOISY_PENALTY;
            reason = "Noisy handle";
        } else if (nicheTokens.stream().anyMatch(handle::contains)) {
            confidence += NICHE_BONUS;
            reason = "Niche keyword in handle";
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        return new CandidateValidationResult(candidate, true, confidence, reason);
    }

    static boolean looksNoisy(String handle) {
        if (handle.length() < 3) {
            return true;
        }
        if (handle.matches("^\\d{6,}$") || handle.matches("^[a-z]?\\d{7,}$") || handle.matches("^[a-z]{1,2}\\d+[a-z]?$")) {
            return true;
        }
        if (handle.chars().noneMatch(Character::isLetter)) {
            return true;
        }
        return handle.contains("__") || handle.contains("..");
    }

    private static List<String> nicheTokens(String niche) {
        if (niche == null || niche.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : niche.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= 4) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
