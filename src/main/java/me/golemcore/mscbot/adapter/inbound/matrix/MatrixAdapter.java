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

package me.golemcore.mscbot.adapter.inbound.matrix;

import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import feign.RequestInterceptor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.RoomMessage;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.infrastructure.http.FeignClientFactory;
import me.golemcore.mscbot.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Matrix channel adapter polling {@code /sync}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Initial sync on start that only keeps the {@code next_batch} token, so
 * messages sent while the bot was offline are not answered
 * <li>Auto-join on invite, delayed and retried a bounded number of times
 * <li>Markdown replies sent with an HTML body via {@link MatrixHtmlFormatter}
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts if
 * {@code bot.matrix.enabled=true} and an access token is configured.
 *
 * @see me.golemcore.mscbot.port.inbound.ChannelPort
 */
@Component
@Slf4j
public class MatrixAdapter implements ChannelPort {

    private static final String CHANNEL_TYPE = "matrix";
    private static final String HTML_FORMAT = "org.matrix.custom.html";
    private static final String EVENT_ROOM_MESSAGE = "m.room.message";

    private final BotProperties.MatrixProperties config;
    private final FeignClientFactory feignClientFactory;
    private final MatrixHtmlFormatter htmlFormatter = new MatrixHtmlFormatter();
    private final List<Consumer<RoomMessage>> messageHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> inviteHandlers = new CopyOnWriteArrayList<>();
    private final AtomicLong transactionCounter = new AtomicLong();

    private MatrixApi matrixApi;
    private volatile String nextBatch;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    public MatrixAdapter(BotProperties properties, FeignClientFactory feignClientFactory) {
        this.config = properties.getMatrix();
        this.feignClientFactory = feignClientFactory;
    }

    /**
     * Package-private setter for testing.
     */
    void setMatrixApi(MatrixApi matrixApi) {
        this.matrixApi = matrixApi;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getAccessToken() != null && !config.getAccessToken().isBlank();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Matrix] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Matrix] Channel disabled");
                return;
            }
            ensureInitialized();

            JsonNode initial = callSync(null, 0);
            nextBatch = initial.path("next_batch").asText(null);
            handleInvites(initial);
            running = true;
            log.info("[Matrix] Connected as {} to {}", config.getUserId(), resolveHomeserverUrl(config));
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            log.info("[Matrix] Adapter stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void sync() {
        if (!running) {
            return;
        }
        JsonNode response = callSync(nextBatch, config.getSyncTimeoutMs());
        String token = response.path("next_batch").asText(null);
        if (token != null) {
            nextBatch = token;
        }
        handleInvites(response);
        handleTimelines(response);
    }

    @Override
    public void sendMessage(String roomId, String markdown) {
        if (matrixApi == null) {
            throw new ExternalServiceException("Matrix channel not started");
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", config.getMessageType());
        content.put("body", markdown);
        content.put("format", HTML_FORMAT);
        content.put("formatted_body", htmlFormatter.format(markdown));

        String txnId = "mscbot" + System.currentTimeMillis() + "." + transactionCounter.incrementAndGet();
        try {
            matrixApi.sendMessage(roomId, txnId, content);
            log.debug("[Matrix] Sent message to {}", roomId);
        } catch (FeignException e) {
            throw new ExternalServiceException("Unable to post to room " + roomId + ": HTTP " + e.status(), e);
        }
    }

    @Override
    public void onMessage(Consumer<RoomMessage> handler) {
        messageHandlers.add(handler);
    }

    @Override
    public void onInvite(Consumer<String> handler) {
        inviteHandlers.add(handler);
    }

    /**
     * Join an invited room. The homeserver may not have finished processing the
     * invite yet, so the first attempt is delayed and failures are retried with
     * a fixed backoff up to the configured attempt count.
     *
     * @return whether the room was joined
     */
    boolean joinRoom(String roomId) {
        if (!sleepForRetry(config.getJoinDelayMs())) {
            return false;
        }
        int maxAttempts = Math.max(1, config.getJoinMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                matrixApi.join(roomId, Map.of());
                log.info("[Matrix] Joined {}", roomId);
                inviteHandlers.forEach(handler -> handler.accept(roomId));
                return true;
            } catch (FeignException e) {
                log.warn("[Matrix] Unable to join {} (attempt {}/{}): HTTP {}", roomId, attempt, maxAttempts,
                        e.status());
                if (attempt < maxAttempts && !sleepForRetry(config.getJoinRetryBackoffMs())) {
                    return false;
                }
            }
        }
        log.error("[Matrix] Giving up joining {}", roomId);
        return false;
    }

    /**
     * @return {@code false} if the thread was interrupted
     */
    boolean sleepForRetry(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Matrix] Interrupted while waiting to retry");
            return false;
        }
    }

    static String resolveHomeserverUrl(BotProperties.MatrixProperties config) {
        String url = config.getHomeserverUrl();
        if (url != null && !url.isBlank()) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
        String userId = config.getUserId();
        int separator = userId.indexOf(':');
        if (separator < 0) {
            throw new IllegalStateException("Matrix user id has no server part: " + userId);
        }
        return "https://" + userId.substring(separator + 1);
    }

    private void ensureInitialized() {
        if (matrixApi != null) {
            return;
        }
        String token = config.getAccessToken();
        List<RequestInterceptor> interceptors = List.of(
                template -> template.header("Authorization", "Bearer " + token));
        matrixApi = feignClientFactory.create(MatrixApi.class, resolveHomeserverUrl(config), interceptors);
    }

    private JsonNode callSync(String since, long timeoutMs) {
        try {
            return matrixApi.sync(since, timeoutMs);
        } catch (FeignException e) {
            throw new ExternalServiceException("Unable to contact /sync: HTTP " + e.status(), e);
        }
    }

    private void handleInvites(JsonNode response) {
        Iterator<String> invited = response.path("rooms").path("invite").fieldNames();
        while (invited.hasNext()) {
            String roomId = invited.next();
            log.info("[Matrix] Invited to {}", roomId);
            joinRoom(roomId);
        }
    }

    private void handleTimelines(JsonNode response) {
        Iterator<Map.Entry<String, JsonNode>> joined = response.path("rooms").path("join").fields();
        while (joined.hasNext()) {
            Map.Entry<String, JsonNode> room = joined.next();
            for (JsonNode event : room.getValue().path("timeline").path("events")) {
                toRoomMessage(room.getKey(), event).ifPresent(this::dispatch);
            }
        }
    }

    private Optional<RoomMessage> toRoomMessage(String roomId, JsonNode event) {
        if (!EVENT_ROOM_MESSAGE.equals(event.path("type").asText())) {
            return Optional.empty();
        }
        String sender = event.path("sender").asText(null);
        if (config.getUserId().equals(sender)) {
            return Optional.empty();
        }
        JsonNode content = event.path("content");
        return Optional.of(new RoomMessage(roomId, sender,
                content.path("msgtype").asText(null), content.path("body").asText(null)));
    }

    private void dispatch(RoomMessage message) {
        for (Consumer<RoomMessage> handler : messageHandlers) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                log.error("[Matrix] Message handler failed in {}: {}", message.roomId(), e.getMessage(), e);
            }
        }
    }
}
