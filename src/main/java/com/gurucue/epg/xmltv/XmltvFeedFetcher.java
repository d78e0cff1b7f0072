/*
 * This file is part of Guru Cue Search & Recommendation Engine.
 * Copyright (C) 2017 Guru Cue Ltd.
 *
 * Guru Cue Search & Recommendation Engine is free software: you can
 * redistribute it and/or modify it under the terms of the GNU General
 * Public License as published by the Free Software Foundation, either
 * version 3 of the License, or (at your option) any later version.
 *
 * Guru Cue Search & Recommendation Engine is distributed in the hope
 * that it will be useful, but WITHOUT ANY WARRANTY; without even the
 * implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Guru Cue Search & Recommendation Engine. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.gurucue.epg.xmltv;

import com.gurucue.epg.SyncException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.zip.GZIPInputStream;

/**
 * Downloads the XMLTV feed as a byte stream. The body is not buffered;
 * the caller reads it while it arrives and must close it.
 */
public final class XmltvFeedFetcher implements FeedSource {
    private static final Logger log = LogManager.getLogger(XmltvFeedFetcher.class);
    private static final String USER_AGENT = "GuruCueEpg/1.0";

    private final HttpClient httpClient;
    private final URI feedUri;
    private final Duration requestTimeout;

    public XmltvFeedFetcher(final URI feedUri, final Duration connectTimeout, final Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), feedUri, requestTimeout);
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    XmltvFeedFetcher(final HttpClient httpClient, final URI feedUri, final Duration requestTimeout) {
        if (feedUri == null) throw new IllegalArgumentException("No XMLTV feed URL given");
        this.httpClient = httpClient;
        this.feedUri = feedUri;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Opens the feed.
     *
     * @return the (decompressed) document stream, to be closed by the caller
     * @throws SyncException of kind {@link SyncException.Kind#RETRYABLE_TRANSPORT} when the
     * server responds with a non-2xx status or the connection fails
     */
    @Override
    public InputStream open() throws SyncException {
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(feedUri)
                .header("User-Agent", USER_AGENT)
                .header("Accept-Encoding", "gzip")
                .timeout(requestTimeout)
                .GET()
                .build();

        final HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        }
        catch (IOException e) {
            final String reason = "Failed to download the XMLTV feed from " + feedUri + ": " + e.toString();
            log.warn(reason, e);
            throw SyncException.retryable(reason, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SyncException.terminal("Interrupted while downloading the XMLTV feed from " + feedUri, e);
        }

        final int statusCode = response.statusCode();
        if ((statusCode < 200) || (statusCode >= 300)) {
            closeQuietly(response.body());
            final String reason = "XMLTV feed " + feedUri + " responded with status " + statusCode;
            log.warn(reason);
            throw new SyncException(SyncException.Kind.RETRYABLE_TRANSPORT, reason);
        }

        final InputStream body = response.body();
        if (body == null) throw new SyncException(SyncException.Kind.RETRYABLE_TRANSPORT, "XMLTV feed " + feedUri + " returned no body");
        final boolean gzipped = response.headers().firstValue("Content-Encoding").map(v -> v.equalsIgnoreCase("gzip")).orElse(Boolean.FALSE) ||
                ((feedUri.getPath() != null) && feedUri.getPath().endsWith(".gz"));
        if (!gzipped) return body;
        try {
            return new GZIPInputStream(body, 65536);
        }
        catch (IOException e) {
            closeQuietly(body);
            final String reason = "XMLTV feed " + feedUri + " is not a valid gzip stream: " + e.toString();
            log.warn(reason, e);
            throw SyncException.retryable(reason, e);
        }
    }

    @Override
    public String toString() {
        return feedUri.toString();
    }

    private static void closeQuietly(final InputStream in) {
        if (in == null) return;
        try {
            in.close();
        }
        catch (IOException e) {
            log.debug("Failed to close an abandoned response body: " + e.toString());
        }
    }
}
