package com.brandinsight.research.service.community;

import com.brandinsight.research.dto.ResearchContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CommunityQueryBuilder 단위 테스트
 */
class CommunityQueryBuilderTest {

    private final CommunityQueryBuilder builder = new CommunityQueryBuilder();

    @Test
    @DisplayName("핸들과 브랜드명으로 12개의 고정 쿼리를 만든다")
    void buildsFixedQueries() {
        // given
        ResearchContext context = new ResearchContext("rj_1", "Acme Coffee", "@Acme_Coffee", "coffee",
                null, null, Map.of(), null);

        // when
        List<String> queries = builder.buildQueries(context);

        // then
        assertThat(queries).hasSize(12).doesNotHaveDuplicates();
        assertThat(queries.get(0)).isEqualTo("site:reddit.com \"acme_coffee\"");
        assertThat(queries).contains(
                "site:reddit.com \"@acme_coffee\"",
                "site:quora.com \"Acme Coffee\"",
                "site:trustpilot.com \"Acme Coffee\"",
                "\"Acme Coffee\" community discussion");
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 쿼리 목록을 만든다")
    void deterministic() {
        ResearchContext context = new ResearchContext("rj_1", null, "acme_coffee", null, null, null, Map.of(), null);

        List<String> first = builder.buildQueries(context);
        List<String> second = builder.buildQueries(context);

        assertThat(first).isEqualTo(second).doesNotHaveDuplicates();
        assertThat(first).hasSize(11);
    }
}
