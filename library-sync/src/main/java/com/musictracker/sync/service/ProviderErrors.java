package com.musictracker.sync.service;

import com.musictracker.sync.exception.ProviderException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.exception.TerminalProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps RestTemplate failures onto the provider error taxonomy.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderException translate(String provider, String url, RestClientException e) {
        if (e instanceof HttpClientErrorException clientError) {
            if (clientError.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new RateLimitedException(provider, "Rate limited (429) by " + provider);
            }
            return new TerminalProviderException(provider, clientError.getStatusCode().value(),
                    provider + " rejected request with HTTP " + clientError.getStatusCode().value(), e);
        }
        if (e instanceof HttpServerErrorException serverError) {
            return new RetryableProviderException(provider,
                    provider + " server error HTTP " + serverError.getStatusCode().value(), e);
        }
        if (e instanceof RestClientResponseException responseError) {
            return new RetryableProviderException(provider,
                    provider + " returned unexpected HTTP " + responseError.getStatusCode().value(), e);
        }
        if (e instanceof ResourceAccessException) {
            return new RetryableProviderException(provider, "I/O error calling " + url + ": " + e.getMessage(), e);
        }
        // unreadable body
        return new TerminalProviderException(provider, 0, "Malformed response from " + provider + ": " + e.getMessage(), e);
    }
}
