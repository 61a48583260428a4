package com.brandinsight.research.service.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 검색 결과 URL과 본문에서 소셜 핸들 추출.
 *
 * instagram.com/{handle}, tiktok.com/@{handle}, youtube.com/@{handle}, x.com/{handle} 형태와
 * 본문의 @mention 을 인식합니다. 라우트 경로(p, reel, explore 등)는 핸들로 취급하지 않습니다.
 */
@Component
@Slf4j
public class SocialHandleExtractor {

    static final Set<String> ROUTE_WORDS = Set.of(
            "stories", "story", "reel", "reels", "explore", "p", "accounts", "account", "about",
            "watch", "video", "videos", "post", "posts", "hashtag", "hashtags", "tag", "tags",
            "share", "search", "home", "discover", "channel", "channels", "shorts", "music",
            "live", "status", "groups", "events", "photos", "photo", "messages", "tv", "i",
            "intent", "login", "signup", "privacy", "legal", "help"
    );

    private static final Pattern MENTION = Pattern.compile("(?<![\\w.@])@([A-Za-z0-9_.]{2,30})");
    private static final Pattern HANDLE_CHARS = Pattern.compile("^[a-z0-9._]{2,30}$");

    public Optional<ExtractedHandle> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Skipping unparsable URL {}", url);
            return Optional.empty();
        }
        String host = uri.getHost();
        String path = uri.getPath();
        if (host == null || path == null) {
            return Optional.empty();
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        if (host.startsWith("m.")) {
            host = host.substring(2);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment.toLowerCase(Locale.ROOT));
            }
        }
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        String first = segments.get(0);

        if (host.endsWith("instagram.com")) {
            return normalize(first).map(h -> new ExtractedHandle("instagram", h));
        }
        if (host.endsWith("tiktok.com")) {
            return first.startsWith("@")
                    ? normalize(first.substring(1)).map(h -> new ExtractedHandle("tiktok", h))
                    : Optional.empty();
        }
        if (host.endsWith("youtube.com")) {
            if (first.startsWith("@")) {
                return normalize(first.substring(1)).map(h -> new ExtractedHandle("youtube", h));
            }
            if ((first.equals("c") || first.equals("user")) && segments.size() > 1) {
                return normalize(segments.get(1)).map(h -> new ExtractedHandle("youtube", h));
            }
            return Optional.empty();
        }
        if (host.equals("x.com") || host.endsWith("twitter.com")) {
            return normalize(first).map(h -> new ExtractedHandle("x", h));
        }
        return Optional.empty();
    }

    /**
     * @mentions in free text, attributed to the given platform
     */
    public List<ExtractedHandle> fromText(String text, String platform) {
        Set<ExtractedHandle> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Matcher matcher = MENTION.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(1);
            // trailing dots are sentence punctuation, not part of the handle
            while (raw.endsWith(".")) {
                raw = raw.substring(0, raw.length() - 1);
            }
            normalize(raw).ifPresent(h -> found.add(new ExtractedHandle(platform, h)));
        }
        return new ArrayList<>(found);
    }

    Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        while (value.startsWith("@")) {
            value = value.substring(1);
        }
        if (!HANDLE_CHARS.matcher(value).matches() || ROUTE_WORDS.contains(value)) {
            return Optional.empty();
        }
        if (value.chars().noneMatch(Character::isLetter)) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
