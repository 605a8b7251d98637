package com.musictracker.sync.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per provider, each with the per-call connect and read timeouts.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final LibrarySyncProperties properties;

    @Bean
    public RestTemplate discogsRestTemplate(RestTemplateBuilder builder) {
        LibrarySyncProperties.Discogs discogs = properties.getDiscogs();
        RestTemplateBuilder configured = withTimeouts(builder)
                .defaultHeader(HttpHeaders.USER_AGENT, discogs.getUserAgent());
        if (StringUtils.hasText(discogs.getToken())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Discogs token=" + discogs.getToken());
        }
        return configured.build();
    }

    @Bean
    public RestTemplate lastFmRestTemplate(RestTemplateBuilder builder) {
        return withTimeouts(builder).build();
    }

    private RestTemplateBuilder withTimeouts(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getResilience().getConnectTimeout())
                .setReadTimeout(properties.getResilience().getReadTimeout());
    }
}
