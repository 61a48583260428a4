package com.brandinsight.research.client;

import com.brandinsight.research.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * General web search through the DuckDuckGo HTML endpoint.
 * Result pages are parsed with Jsoup; redirect links are unwrapped to the target URL.
 */
@Component("generalSearchClient")
@Slf4j
public class DuckDuckGoSearchClient implements WebSearchClient {

    private final WebClient webClient;

    @Value("${research.search.duckduckgo.base-url:https://html.duckduckgo.com/html/}")
    private String baseUrl;

    @Value("${research.search.duckduckgo.region:wt-wt}")
    private String region;

    @Value("${research.search.timeout-seconds:30}")
    private int timeoutSeconds;

    public DuckDuckGoSearchClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getConnectorName() {
        return "duckduckgo_search";
    }

    @Override
    public List<WebSearchResult> search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String rendered = options.render(query);

        String html;
        try {
            html = webClient.get()
                    .uri(uriBuilder -> {
                        URI uri = URI.create(baseUrl);
                        return uriBuilder
                                .scheme(uri.getScheme())
                                .host(uri.getHost())
                                .path(uri.getPath())
                                .queryParam("q", rendered)
                                .queryParam("kl", region)
                                .build();
                    })
                    .accept(MediaType.TEXT_HTML)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (Exception e) {
            throw new ProviderException(getConnectorName(), "DuckDuckGo request failed: " + e.getMessage(), e);
        }

        List<WebSearchResult> results = parseResults(html, options.maxResults());
        log.debug("DuckDuckGo returned {} results for '{}'", results.size(), rendered);
        return results;
    }

    List<WebSearchResult> parseResults(String html, int maxResults) {
        List<WebSearchResult> results = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return results;
        }

        Document doc = Jsoup.parse(html);
        for (Element result : doc.select("div.result")) {
            if (results.size() >= maxResults) {
                break;
            }
            Element link = result.selectFirst("a.result__a");
            if (link == null) {
                continue;
            }
            String url = unwrapRedirect(link.attr("href"));
            if (url == null || url.isBlank()) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            results.add(new WebSearchResult(
                    link.text(),
                    snippet != null ? snippet.text() : "",
                    url
            ));
        }
        return results;
    }

    /**
     * DuckDuckGo wraps targets as //duckduckgo.com/l/?uddg=&lt;encoded&gt;&amp;rut=...
     */
    static String unwrapRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        int marker = href.indexOf("uddg=");
        if (marker < 0) {
            return href.startsWith("//") ? "https:" + href : href;
        }
        String encoded = href.substring(marker + 5);
        int end = encoded.indexOf('&');
        if (end >= 0) {
            encoded = encoded.substring(0, end);
        }
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
