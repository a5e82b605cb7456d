package me.golemcore.resilience.adapter.outbound.otlp;

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

import me.golemcore.resilience.port.outbound.MetricsSenderPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OTLP/HTTP metrics sender. POSTs one encoded snapshot to the collector's
 * metrics endpoint.
 *
 * <p>
 * Success means a 2xx response. Any other status and any I/O error are
 * reported as failure; the {@link ExportQueue} decides whether to retry.
 */
@Slf4j
public class OtlpHttpMetricsSender implements MetricsSenderPort {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final Map<String, String> headers;

    public OtlpHttpMetricsSender(OkHttpClient baseHttpClient, String endpoint, Map<String, String> headers,
            long timeoutMs) {
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.endpoint = endpoint;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    @Override
    public boolean send(byte[] encodedSnapshot) {
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(encodedSnapshot, JSON));
        headers.forEach(requestBuilder::header);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[OtlpExport] Collector returned HTTP {}", response.code());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("[OtlpExport] Collector unreachable: {}", e.getMessage());
            return false;
        }
    }
}
