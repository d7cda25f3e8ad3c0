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

package me.golemcore.seeker.infrastructure.http;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the search API client and the HTTP document
 * fetcher, built from {@code seeker.http.*}. The fetcher derives its own
 * per-call timeout from this client.
 */
@Configuration
@Slf4j
public class HttpClientConfiguration {

    @Bean
    public OkHttpClient okHttpClient(SeekerProperties properties) {
        SeekerProperties.HttpProperties http = properties.getHttp();
        log.debug("[HTTP] connect={}, read={}, write={}, pool={}", http.getConnectTimeout(), http.getReadTimeout(),
                http.getWriteTimeout(), http.getMaxIdleConnections());

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }
}
