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

package me.golemcore.mscbot.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.RequestInterceptor;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Factory for Feign HTTP clients with OkHttp transport and Jackson JSON
 * encoding.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * GitHubApi api = factory.create(GitHubApi.class, "https://api.github.com",
 *         List.of(template -> template.header("Authorization", "token " + token)));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client for the given API interface.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        return create(apiType, baseUrl, List.of());
    }

    /**
     * Create a Feign client that applies the given interceptors (auth headers,
     * user agent) to every request.
     */
    public <T> T create(Class<T> apiType, String baseUrl, List<RequestInterceptor> interceptors) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .requestInterceptors(interceptors)
                .target(apiType, baseUrl);
    }
}
