package com.brandinsight.research.client;

import java.util.List;

public interface TrendLookupClient {

    String CONNECTOR = "search_trends";

    List<TrendSeries> lookup(List<String> keywords);
}
