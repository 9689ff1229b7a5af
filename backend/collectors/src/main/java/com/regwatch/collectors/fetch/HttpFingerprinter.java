package com.regwatch.collectors.fetch;

import com.regwatch.collectors.api.FetchException;
import com.regwatch.collectors.api.Fingerprinter;
import com.regwatch.core.model.Source;
import com.regwatch.core.util.HashingUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Fingerprints a page by hashing the exact bytes the server returns. Dynamic server
 * output such as embedded timestamps therefore shows up as a change.
 */
public class HttpFingerprinter implements Fingerprinter {
    private final HttpClient httpClient;
    private final FetchSettings settings;

    public HttpFingerprinter(HttpClient httpClient, FetchSettings settings) {
        this.httpClient = httpClient;
        this.settings = settings;
    }

    @Override
    public String fingerprint(Source source) throws FetchException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(source.url()))
                    .GET()
                    .timeout(settings.requestTimeout())
                    .header("User-Agent", settings.userAgent())
                    .build();
        } catch (IllegalArgumentException invalidUrl) {
            throw FetchException.fromTransport(source.url(), invalidUrl);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw FetchException.fromTransport(source.url(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw FetchException.httpStatus(source.url(), status);
        }
        return HashingUtils.sha256(response.body());
    }
}
