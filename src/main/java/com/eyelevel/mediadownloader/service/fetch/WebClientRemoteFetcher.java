package com.eyelevel.mediadownloader.service.fetch;

import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.IncompleteTransferException;
import com.eyelevel.mediadownloader.exception.apiclient.ApiException;
import com.eyelevel.mediadownloader.exception.apiclient.BadGatewayException;
import com.eyelevel.mediadownloader.exception.apiclient.BadRequestException;
import com.eyelevel.mediadownloader.exception.apiclient.ForbiddenException;
import com.eyelevel.mediadownloader.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.mediadownloader.exception.apiclient.InternalServerException;
import com.eyelevel.mediadownloader.exception.apiclient.NotFoundException;
import com.eyelevel.mediadownloader.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.mediadownloader.exception.apiclient.TooManyRequestsException;
import com.eyelevel.mediadownloader.model.DownloadJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * {@link RemoteFetcher} backed by the shared download {@link WebClient}.
 * <p>
 * Error statuses are turned into the {@link ApiException} family by status code; transport
 * failures become {@link ServiceUnavailableException} or {@link GatewayTimeoutException}. The
 * body is handed over as a blocking stream so it can be metered and written by the calling thread.
 */
@Slf4j
@Component
public class WebClientRemoteFetcher implements RemoteFetcher {

    private static final int BODY_PREFETCH = 32;
    private static final int MAX_ERROR_BODY_CHARS = 256;

    private final WebClient webClient;

    public WebClientRemoteFetcher(@Qualifier("downloadWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public FetchResponse fetch(DownloadJob job) {
        log.debug("[{}] Requesting {}", job.label(), job.sourceUrl());
        try {
            ResponseEntity<Flux<DataBuffer>> entity = webClient.get()
                    .uri(job.sourceUrl())
                    .headers(headers -> configureHeaders(job, headers))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
                    .toEntityFlux(DataBuffer.class)
                    .block();

            if (entity == null || entity.getBody() == null) {
                throw new IncompleteTransferException("No response received from " + job.sourceUrl());
            }
            HttpHeaders headers = entity.getHeaders();
            log.debug("[{}] Response {} (type: {}, length: {})", job.label(), entity.getStatusCode(),
                    headers.getContentType(), headers.getContentLength());
            return new FetchResponse(headers.getContentType(), headers.getContentLength(),
                    new DataBufferInputStream(entity.getBody().toStream(BODY_PREFETCH)));
        } catch (ApiException | IncompleteTransferException e) {
            throw e;
        } catch (RuntimeException e) {
            throw mapException(e);
        }
    }

    /**
     * Applies the job's referer and extra headers on top of the client's defaults.
     */
    private void configureHeaders(DownloadJob job, HttpHeaders headers) {
        if (job.referer() != null && !job.referer().isBlank()) {
            headers.set(HttpHeaders.REFERER, job.referer());
        }
        job.headers().forEach(headers::set);
    }

    private Mono<ApiException> handleErrorResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty(response.statusCode().toString())
                .onErrorReturn(response.statusCode().toString())
                .map(body -> createException(abbreviate(body), statusCode));
    }

    /**
     * Maps transport-level failures to the {@link ApiException} family, or to cancellation when
     * the waiting thread was interrupted.
     */
    private RuntimeException mapException(Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);
        if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new DownloadCancelledException("Interrupted while waiting for a response", unwrapped);
        }
        if (unwrapped instanceof DownloadCancelledException cancelled) {
            return cancelled;
        }
        if (unwrapped instanceof WebClientResponseException responseError) {
            return createException(abbreviate(responseError.getResponseBodyAsString()),
                    responseError.getStatusCode().value());
        }
        Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(unwrapped);
        if (isTimeout(unwrapped) || isTimeout(rootCause)) {
            log.debug("Request timed out: {}", rootCause.toString());
            return new GatewayTimeoutException("Request timed out: " + rootCause.getMessage(), unwrapped);
        }
        if (unwrapped instanceof WebClientRequestException) {
            log.debug("Request failed: {}", rootCause.toString());
            return new ServiceUnavailableException("Failed to connect to remote origin: " + rootCause.getMessage(),
                    unwrapped);
        }
        return new ApiException("Unexpected WebClient error: " + unwrapped.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(), unwrapped);
    }

    private boolean isTimeout(Throwable error) {
        return error instanceof TimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof io.netty.handler.timeout.TimeoutException
                || error instanceof io.netty.channel.ConnectTimeoutException;
    }

    /**
     * Creates an appropriate {@link ApiException} based on the provided HTTP status code.
     *
     * @param body       The (abbreviated) response body.
     * @param statusCode The HTTP status code.
     * @return An {@link ApiException} representing the error.
     */
    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.debug("Remote origin answered {}: {}", statusCode, exception.getMessage());
        return exception;
    }

    private static String abbreviate(String body) {
        String trimmed = body == null ? "" : body.strip();
        return trimmed.length() <= MAX_ERROR_BODY_CHARS ? trimmed : trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
