package com.leadgen.backend.integrations;

import com.leadgen.backend.config.ResearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Optional;

/**
 * Fetches web pages over HTTP with Jsoup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsoupContentFetcher implements ContentFetcher {

    private final ResearchProperties properties;

    @Override
    public Optional<FetchedContent> fetch(String url, long maxBytes) throws CapabilityException {
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .userAgent(properties.userAgent())
                    .timeout((int) properties.fetchTimeout().toMillis())
                    .maxBodySize((int) Math.max(1, Math.min(maxBytes, Integer.MAX_VALUE)))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(false)
                    .execute();
        } catch (SocketTimeoutException e) {
            throw new CapabilityException("Timed out fetching " + url, e);
        } catch (IOException e) {
            throw new CapabilityException("Could not fetch " + url + ": " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 404 || status == 410) {
            log.debug("{} returned {}", url, status);
            return Optional.empty();
        }
        if (status == 429) {
            throw new ThrottledException(url + " returned 429 Too Many Requests");
        }
        if (status >= 400) {
            throw new CapabilityException(url + " returned HTTP " + status);
        }
        return Optional.of(new FetchedContent(response.url().toString(), response.contentType(), response.body()));
    }
}
