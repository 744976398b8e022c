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
import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.Map;

/**
 * Subset of the Matrix client-server API used by the bot. Access token and
 * user agent are added by request interceptors.
 */
interface MatrixApi {

    /**
     * A {@code null} {@code since} token requests an initial sync.
     */
    @RequestLine("GET /_matrix/client/v3/sync?since={since}&timeout={timeout}")
    JsonNode sync(@Param("since") String since, @Param("timeout") long timeoutMs);

    @RequestLine("POST /_matrix/client/v3/rooms/{roomId}/join")
    @Headers("Content-Type: application/json")
    JsonNode join(@Param("roomId") String roomId, Map<String, Object> body);

    @RequestLine("PUT /_matrix/client/v3/rooms/{roomId}/send/m.room.message/{txnId}")
    @Headers("Content-Type: application/json")
    JsonNode sendMessage(@Param("roomId") String roomId, @Param("txnId") String txnId,
            Map<String, Object> content);
}
