package com.brandinsight.research.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 외부 커넥터(검색, LLM, 브라우저 에이전트) 공용 WebClient.
 * 커넥터별 타임아웃은 각 클라이언트가 block 시점에 따로 겁니다.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    /** Search result pages and chat completions can exceed the 256KB default */
    private static final int MAX_IN_MEMORY_BYTES = 10 * 1024 * 1024;

    @Bean
    public WebClient webClient(
            @Value("${research.http.user-agent:Mozilla/5.0 (compatible; BrandInsight-Research/1.0)}") String userAgent,
            @Value("${research.http.timeout.connect:10000}") int connectTimeoutMs,
            @Value("${research.http.timeout.read:30000}") int readTimeoutMs) {

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(Duration.ofMillis(readTimeoutMs))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS)))
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .filter(logConnectorResponses())
                .build();
    }

    private static ExchangeFilterFunction logConnectorResponses() {
        return ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (response.statusCode().isError()) {
                log.debug("[Connector] HTTP {} from upstream", response.statusCode().value());
            }
            return Mono.just(response);
        });
    }
}
