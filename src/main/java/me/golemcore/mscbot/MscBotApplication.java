package me.golemcore.mscbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the MSC bot.
 *
 * <p>
 * The bot sits in Matrix rooms, answers operator commands about the state of
 * Matrix Spec Change proposals and posts a daily digest per room.
 *
 * <h2>Architecture</h2>
 * <ul>
 * <li><b>Status aggregation</b> - open proposals from GitHub joined with FCP
 * reviews from the mscbot feed</li>
 * <li><b>Reports</b> - in-progress, pending FCP and in-FCP sections, plus a
 * label-change news digest over a time window</li>
 * <li><b>Commands</b> - phrase table matched against {@code mscbot: ...}
 * messages</li>
 * <li><b>Room settings</b> - persisted per-room options that drive the daily
 * summary scheduler</li>
 * </ul>
 *
 * <p>
 * A single loop thread alternates between Matrix sync and due summaries, so
 * command handlers and scheduled digests never run concurrently.
 *
 * @since 1.0
 */
@SpringBootApplication
public class MscBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MscBotApplication.class, args);
    }
}
