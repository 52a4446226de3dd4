package edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest;

import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiConnectionException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Blocks on a request and turns transport and HTTP failures into {@link ApiConnectionException}.
 */
final class RestCalls {

    private RestCalls() {
    }

    static <T> T block(Mono<T> request, Duration timeout, String action) throws ApiConnectionException {
        try {
            return request.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value() || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                throw new ApiConnectionException("Sample service refused access while " + action + " (" + e.getStatusCode().value() + ")", e);
            }
            throw new ApiConnectionException("Sample service answered " + e.getStatusCode().value() + " while " + action
                + ": " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            throw new ApiConnectionException("Could not reach the sample service while " + action + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new ApiConnectionException("Sample service did not answer within " + timeout + " while " + action, e);
            }
            throw e;
        }
    }
}
