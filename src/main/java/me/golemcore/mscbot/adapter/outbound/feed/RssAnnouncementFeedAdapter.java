/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mscbot.adapter.outbound.feed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.AnnouncementFeedPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * {@link AnnouncementFeedPort} reading an RSS or Atom feed.
 *
 * <p>
 * The first {@code item/pubDate} (RSS) or {@code entry/published} /
 * {@code entry/updated} (Atom) is taken as the newest announcement.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RssAnnouncementFeedAdapter implements AnnouncementFeedPort {

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;

    @Override
    public Instant latestPublishedAt() {
        String url = properties.getNews().getAnnouncementFeedUrl();
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", "msc-bot")
                .get()
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new ExternalServiceException("Announcement feed returned HTTP " + response.code());
            }
            Instant published = parseLatestPublished(response.body().string());
            log.debug("[News] Latest announcement published at {}", published);
            return published;
        } catch (IOException e) {
            throw new ExternalServiceException("Unable to read announcement feed " + url, e);
        }
    }

    /**
     * @throws ExternalServiceException
     *             if the feed has no entry with a readable timestamp
     */
    static Instant parseLatestPublished(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());

        Element timestamp = document.selectFirst("item > pubDate");
        if (timestamp == null) {
            timestamp = document.selectFirst("entry > published");
        }
        if (timestamp == null) {
            timestamp = document.selectFirst("entry > updated");
        }
        if (timestamp == null) {
            throw new ExternalServiceException("Announcement feed has no dated entry");
        }
        return parseTimestamp(timestamp.text().trim());
    }

    static Instant parseTimestamp(String value) {
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException rfc) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException iso) {
                iso.addSuppressed(rfc);
                throw new ExternalServiceException("Unparseable feed timestamp: " + value, iso);
            }
        }
    }
}
