package com.eyelevel.mediadownloader.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Configures the {@link WebClient} used to fetch remote media.
 */
@Slf4j
@Configuration
public class DownloadClientConfiguration {

    /**
     * Creates the WebClient for media downloads. Redirects are followed because media hosts
     * routinely bounce requests to CDN nodes; the read timeout bounds a stalled body stream.
     *
     * @param properties The download configuration.
     * @return A configured {@link WebClient} bean named "downloadWebClient".
     */
    @Bean("downloadWebClient")
    public WebClient downloadWebClient(DownloadProperties properties) {
        DownloadProperties.Http http = properties.getHttp();
        log.info("Initializing download WebClient (connect timeout: {}, response timeout: {}, read timeout: {})",
                http.getConnectTimeout(), http.getResponseTimeout(), http.getReadTimeout());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .responseTimeout(http.getResponseTimeout())
                .followRedirect(true)
                .doOnConnected(connection -> connection.addHandlerLast(
                        new ReadTimeoutHandler(http.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .build();
    }
}
