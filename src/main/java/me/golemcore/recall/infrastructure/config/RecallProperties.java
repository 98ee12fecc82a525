package me.golemcore.recall.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties bound from {@code recall.*}.
 */
@Component
@ConfigurationProperties(prefix = "recall")
@Data
public class RecallProperties {

    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private MatcherProperties matcher = new MatcherProperties();
    private CompressionProperties compression = new CompressionProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        /** Model in {@code provider/name} form, e.g. {@code openai/gpt-4o-mini}. */
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 30_000;
        private double temperature = 0.2;
        private int maxTokens = 2048;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore-recall";
    }

    @Data
    public static class IngestionProperties {
        private boolean processOwnMessages = true;
        private boolean skipGroupMessages = false;
        private double actionConfidenceThreshold = 0.6;
        private double extractionConfidenceThreshold = 0.65;
        private int contextMessages = 5;
        private int activeEventsLimit = 20;
        private int duplicateWindowHours = 48;
        private int conflictWindowMinutes = 60;
        private int defaultSnoozeMinutes = 30;
        private String zoneId = "UTC";
    }

    @Data
    public static class MatcherProperties {
        private int hotWindowDays = 90;
        private int candidateLimit = 10;
        private int quickKeywordLimit = 3;
        private int quickResultLimit = 5;
    }

    @Data
    public static class CompressionProperties {
        private int maxEvents = 60;
        private int recentTurns = 6;
        private int maxEdgesShown = 10;
    }
}
