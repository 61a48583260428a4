package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.client.SearchOptions;
import com.brandinsight.research.client.WebSearchClient;
import com.brandinsight.research.client.WebSearchResult;
import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.store.RecordType;
import com.brandinsight.research.support.InMemoryResearchStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * BrandContextSearchService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class BrandContextSearchServiceTest {

    @Mock
    private WebSearchClient searchClient;

    private InMemoryResearchStore store;
    private BrandContextSearchService service;
    private ResearchContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryResearchStore();
        lenient().when(searchClient.getConnectorName()).thenReturn("duckduckgo_search");
        service = new BrandContextSearchService(searchClient, store, new ConnectorHealthTracker(), new ResearchProperties());
        context = new ResearchContext("rj_brand", "Acme Coffee", "acme_coffee", "coffee", null, null, Map.of(), null);
    }

    @Test
    @DisplayName("검색 결과를 URL 기준으로 한 번만 저장하고 요약을 만든다")
    void storesResultsAndSummarizes() {
        // given
        when(searchClient.search(anyString(), any(SearchOptions.class))).thenReturn(List.of(
                new WebSearchResult("Acme Coffee", "Single origin roaster in Portland.", "https://acme.example"),
                new WebSearchResult("Acme review", "  ", "https://blog.example/acme")));

        // when
        BrandContextResult result = service.gather(context);

        // then
        assertThat(result.resultsFound()).isEqualTo(10);
        assertThat(result.resultsSaved()).isEqualTo(2);
        assertThat(result.failedQueries()).isZero();
        assertThat(store.countRecords("rj_brand", RecordType.RAW_SEARCH_RESULT)).isEqualTo(2);
        assertThat(result.summary()).startsWith("Single origin roaster in Portland.");
        assertThat(service.summaryFromStore("rj_brand")).isEqualTo("Single origin roaster in Portland.");
    }

    @Test
    @DisplayName("일부 쿼리 실패는 허용하지만 모든 쿼리가 실패하면 예외를 던진다")
    void allQueriesFailing() {
        // given
        when(searchClient.search(anyString(), any(SearchOptions.class)))
                .thenThrow(new ProviderException("duckduckgo_search", "HTTP 403"));

        // when / then
        assertThatThrownBy(() -> service.gather(context))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("HTTP 403");
    }

    @Test
    @DisplayName("쿼리는 브랜드명과 핸들로 만든다")
    void queries() {
        assertThat(BrandContextSearchService.buildQueries(context)).containsExactly(
                "\"Acme Coffee\"", "\"Acme Coffee\" official", "\"acme_coffee\" website",
                "\"acme_coffee\" about", "\"acme_coffee\" review");
    }
}
