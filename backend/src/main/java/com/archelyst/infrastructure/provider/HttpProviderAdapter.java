/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared blocking call and error mapping for adapters that talk to a vendor over
 * {@link org.springframework.web.reactive.function.client.WebClient}.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    protected JsonNode call(Mono<JsonNode> request, Duration timeout) {
        try {
            JsonNode body = request.timeout(timeout).block();
            if (body == null || body.isMissingNode() || body.isNull()) {
                throw new ProviderException(provider(), ProviderErrorType.INVALID_RESPONSE, vendorName() + " returned an empty body");
            }
            return body;
        } catch (ProviderException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw mapWebClientException(e);
        } catch (WebClientRequestException e) {
            log.warn("{} connection failed provider={} message={}", vendorName(), provider(), e.getMessage());
            throw new ProviderException(provider(), ProviderErrorType.UNAVAILABLE, vendorName() + " unreachable", e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException || cause instanceof InterruptedException) {
                throw new ProviderException(provider(), ProviderErrorType.TIMEOUT, vendorName() + " request timed out", cause);
            }
            throw new ProviderException(provider(), ProviderErrorType.UNAVAILABLE, vendorName() + " request failed", e);
        }
    }

    protected ProviderException invalid(String message) {
        return new ProviderException(provider(), ProviderErrorType.INVALID_RESPONSE, vendorName() + ": " + message);
    }

    protected ProviderException notConfigured() {
        return new ProviderException(provider(), ProviderErrorType.UNAVAILABLE, vendorName() + " is not configured");
    }

    protected ProviderException unsupported(String capability) {
        return new ProviderException(provider(), ProviderErrorType.UNAVAILABLE,
                vendorName() + " does not support capability " + capability);
    }

    protected abstract String vendorName();

    private ProviderException mapWebClientException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        ProviderErrorType type = ProviderErrorType.fromHttpStatus(status);
        log.warn("{} error type={} status={}", vendorName(), type, status);
        return new ProviderException(provider(), type, vendorName() + " request failed with status " + status);
    }
}
