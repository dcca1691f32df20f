package me.golemcore.scheduler.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Opaque model-call input. The scheduler never inspects the messages; only the
 * model invoker translates them into a provider request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPayload {

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Double temperature;
    private Integer maxOutputTokens;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static ModelPayload ofUserText(String text) {
        return ModelPayload.builder()
                .messages(new ArrayList<>(List.of(Message.user(text))))
                .build();
    }

    /**
     * Single conversation turn.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {

        private String role;
        private String content;

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }

        public static Message assistant(String content) {
            return new Message("assistant", content);
        }
    }
}
