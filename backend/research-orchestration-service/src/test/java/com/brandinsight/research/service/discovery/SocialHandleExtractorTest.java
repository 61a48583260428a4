package com.brandinsight.research.service.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SocialHandleExtractor 단위 테스트
 */
class SocialHandleExtractorTest {

    private final SocialHandleExtractor extractor = new SocialHandleExtractor();

    @Test
    @DisplayName("플랫폼별 프로필 URL 에서 핸들을 추출한다")
    void extractsFromProfileUrls() {
        assertThat(extractor.fromUrl("https://www.instagram.com/Brew_Masters/"))
                .contains(new ExtractedHandle("instagram", "brew_masters"));
        assertThat(extractor.fromUrl("https://www.tiktok.com/@daily.grind?lang=en"))
                .contains(new ExtractedHandle("tiktok", "daily.grind"));
        assertThat(extractor.fromUrl("https://m.youtube.com/@roastrepublic/videos"))
                .contains(new ExtractedHandle("youtube", "roastrepublic"));
        assertThat(extractor.fromUrl("https://www.youtube.com/c/beanscene"))
                .contains(new ExtractedHandle("youtube", "beanscene"));
        assertThat(extractor.fromUrl("https://twitter.com/cupculture/status/123"))
                .contains(new ExtractedHandle("x", "cupculture"));
    }

    @Test
    @DisplayName("게시물, 릴스 등 라우트 경로는 핸들이 아니다")
    void ignoresRouteWords() {
        assertThat(extractor.fromUrl("https://www.instagram.com/p/CxYz123/")).isEmpty();
        assertThat(extractor.fromUrl("https://www.instagram.com/reel/abc/")).isEmpty();
        assertThat(extractor.fromUrl("https://www.instagram.com/explore/tags/coffee/")).isEmpty();
        assertThat(extractor.fromUrl("https://www.tiktok.com/discover/coffee")).isEmpty();
        assertThat(extractor.fromUrl("https://www.youtube.com/watch?v=abc")).isEmpty();
    }

    @Test
    @DisplayName("지원하지 않는 도메인과 잘못된 URL 은 무시한다")
    void ignoresUnsupportedUrls() {
        assertThat(extractor.fromUrl("https://example.com/brew_masters")).isEmpty();
        assertThat(extractor.fromUrl("not a url with spaces")).isEmpty();
        assertThat(extractor.fromUrl(null)).isEmpty();
        assertThat(extractor.fromUrl("https://www.instagram.com/")).isEmpty();
    }

    @Test
    @DisplayName("본문의 @mention 을 중복 없이 추출하고 문장 끝 마침표를 제거한다")
    void extractsMentions() {
        // when
        List<ExtractedHandle> handles = extractor.fromText(
                "Try @brew_masters and @Daily.Grind. Also @brew_masters again, mail me at info@acme.com", "instagram");

        // then
        assertThat(handles).containsExactly(
                new ExtractedHandle("instagram", "brew_masters"),
                new ExtractedHandle("instagram", "daily.grind"));
    }

    @Test
    @DisplayName("숫자만 있는 핸들은 거부한다")
    void rejectsDigitOnlyHandles() {
        Optional<String> normalized = extractor.normalize("@123456");

        assertThat(normalized).isEmpty();
        assertThat(extractor.normalize("@Roast_House")).contains("roast_house");
    }
}
