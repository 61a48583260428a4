package com.brandinsight.research.service.community;

import com.brandinsight.research.dto.ResearchContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed discussion-site query templates. Deterministic for a given target.
 */
@Component
public class CommunityQueryBuilder {

    public List<String> buildQueries(ResearchContext context) {
        String handle = context.cleanHandle();
        String brand = context.displayName();
        String h = handle.isBlank() ? brand : handle;

        Set<String> queries = new LinkedHashSet<>();
        queries.add("site:reddit.com \"" + h + "\"");
        queries.add("site:reddit.com \"@" + h + "\"");
        queries.add("site:reddit.com \"" + h + "\" review");
        queries.add("site:reddit.com \"" + h + "\" worth it");
        queries.add("site:reddit.com \"" + h + "\" vs");
        queries.add("site:reddit.com \"" + h + "\" alternative");
        queries.add("site:reddit.com \"" + h + "\" problem");
        queries.add("site:reddit.com \"" + brand + "\"");
        queries.add("site:quora.com \"" + brand + "\"");
        queries.add("site:trustpilot.com \"" + brand + "\"");
        queries.add("\"" + brand + "\" forum");
        queries.add("\"" + brand + "\" community discussion");
        return new ArrayList<>(queries);
    }
}
