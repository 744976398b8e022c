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

package me.golemcore.mscbot.domain.loop;

import me.golemcore.mscbot.auto.SummaryScheduler;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single control loop of the bot.
 *
 * <p>
 * Each tick syncs every running channel once, which dispatches invites and
 * commands on the loop thread, and then sends the summaries that are due.
 * Ticks are separated by a fixed delay, so a slow network call delays the
 * next tick instead of overlapping with it.
 */
@Component
@Slf4j
public class BotLoop {

    private final List<ChannelPort> channels;
    private final InboundMessageListener inboundMessageListener;
    private final SummaryScheduler summaryScheduler;
    private final BotProperties properties;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;

    public BotLoop(List<ChannelPort> channels, InboundMessageListener inboundMessageListener,
            SummaryScheduler summaryScheduler, BotProperties properties) {
        this.channels = channels;
        this.inboundMessageListener = inboundMessageListener;
        this.summaryScheduler = summaryScheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        for (ChannelPort channel : channels) {
            channel.onMessage(message -> inboundMessageListener.onMessage(channel, message));
            channel.onInvite(inboundMessageListener::onInvite);
        }

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bot-loop");
            t.setDaemon(true);
            return t;
        });

        long interval = properties.getLoop().getPollIntervalMs();
        tickTask = executor.scheduleWithFixedDelay(this::tick, 0, interval, TimeUnit.MILLISECONDS);
        log.info("[Loop] Started with poll interval: {}ms", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        for (ChannelPort channel : channels) {
            if (channel.isRunning()) {
                channel.stop();
            }
        }
        log.info("[Loop] Shut down");
    }

    void tick() {
        for (ChannelPort channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }
            try {
                if (!channel.isRunning()) {
                    channel.start();
                }
                if (channel.isRunning()) {
                    channel.sync();
                }
            } catch (RuntimeException e) {
                log.error("[Loop] {} sync failed: {}", channel.getChannelType(), e.getMessage(), e);
            }
        }

        try {
            summaryScheduler.runPending();
        } catch (RuntimeException e) {
            log.error("[Loop] Summary run failed: {}", e.getMessage(), e);
        }
    }
}
