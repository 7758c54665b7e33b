package com.contentlib.ingest.pipeline.reader;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

@Component
public class ReaderHttpTransport {
    private final HttpClient client;

    @Autowired
    public ReaderHttpTransport(@Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .executor(httpExecutor)
            .build());
    }

    public ReaderHttpTransport(HttpClient client) {
        this.client = client;
    }

    public String send(String provider, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ReaderException(ReaderErrorCode.TIMEOUT, provider, provider + " timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new ReaderException(ReaderErrorCode.NETWORK, provider, provider + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReaderException(ReaderErrorCode.NETWORK, provider, provider + " request interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw ReaderException.fromStatus(provider, status, response.body());
        }
        return response.body();
    }
}
