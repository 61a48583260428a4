package com.brandinsight.research.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DuckDuckGoSearchClient 파싱 테스트
 */
class DuckDuckGoSearchClientTest {

    private final DuckDuckGoSearchClient client = new DuckDuckGoSearchClient(WebClient.create());

    private static final String PAGE = """
            <html><body>
              <div class="result results_links">
                <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fwww.reddit.com%2Fr%2Fcoffee%2Fcomments%2Fabc&amp;rut=xyz">Acme Coffee review</a>
                <a class="result__snippet">Has anyone tried @acme_coffee beans?</a>
              </div>
              <div class="result">
                <a class="result__a" href="https://www.instagram.com/brew_masters/">Brew Masters</a>
              </div>
              <div class="result">
                <span>no link here</span>
              </div>
              <div class="result">
                <a class="result__a" href="https://example.com/third">Third</a>
                <div class="result__snippet">third body</div>
              </div>
            </body></html>
            """;

    @Test
    @DisplayName("결과 블록에서 제목, 본문, 실제 URL 을 추출한다")
    void parsesResultBlocks() {
        // when
        List<WebSearchResult> results = client.parseResults(PAGE, 10);

        // then
        assertThat(results).hasSize(3);
        assertThat(results.get(0).url()).isEqualTo("https://www.reddit.com/r/coffee/comments/abc");
        assertThat(results.get(0).title()).isEqualTo("Acme Coffee review");
        assertThat(results.get(0).body()).isEqualTo("Has anyone tried @acme_coffee beans?");
        assertThat(results.get(1).body()).isEmpty();
        assertThat(results.get(2).url()).isEqualTo("https://example.com/third");
    }

    @Test
    @DisplayName("최대 결과 수를 넘기지 않는다")
    void respectsMaxResults() {
        assertThat(client.parseResults(PAGE, 1)).hasSize(1);
        assertThat(client.parseResults("", 5)).isEmpty();
    }

    @Test
    @DisplayName("리다이렉트가 아닌 링크는 그대로 두고 프로토콜 상대 경로는 https 를 붙인다")
    void unwrapsRedirects() {
        assertThat(DuckDuckGoSearchClient.unwrapRedirect("https://example.com/a")).isEqualTo("https://example.com/a");
        assertThat(DuckDuckGoSearchClient.unwrapRedirect("//example.com/a")).isEqualTo("https://example.com/a");
        assertThat(DuckDuckGoSearchClient.unwrapRedirect("/l/?uddg=https%3A%2F%2Fquora.com%2Fq")).isEqualTo("https://quora.com/q");
        assertThat(DuckDuckGoSearchClient.unwrapRedirect(" ")).isNull();
    }

    @Test
    @DisplayName("사이트 범위는 site: 연산자로 렌더링된다")
    void rendersSiteScope() {
        assertThat(SearchOptions.limit(5).render("acme")).isEqualTo("acme");
        assertThat(SearchOptions.scoped(5, List.of("instagram.com")).render("acme"))
                .isEqualTo("acme site:instagram.com");
        assertThat(SearchOptions.scoped(5, List.of("instagram.com", "tiktok.com")).render("acme"))
                .isEqualTo("acme (site:instagram.com OR site:tiktok.com)");
    }
}
