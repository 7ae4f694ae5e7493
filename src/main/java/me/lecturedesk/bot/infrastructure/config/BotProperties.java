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

package me.lecturedesk.bot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration under the {@code bot.*} prefix.
 *
 * <p>
 * The Telegram token and reviewer id normally come from the {@code BOT_TOKEN}
 * and {@code ADMIN_CHAT_ID} environment variables, see
 * {@code application.properties}.
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private Map<String, ChannelProperties> channels = new HashMap<>();
    private ReviewerProperties reviewer = new ReviewerProperties();
    private ComplaintsProperties complaints = new ComplaintsProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private boolean dropPendingUpdates = true;
    }

    @Data
    public static class ReviewerProperties {
        /** Telegram id of the only user allowed to change complaint status. */
        private Long chatId;
    }

    @Data
    public static class ComplaintsProperties {
        private List<String> batches = new ArrayList<>(List.of(
                "Master quest 2.0 2025",
                "master quest 2026",
                "Ace ipm crash course"));
        private List<String> subjects = new ArrayList<>(List.of(
                "Quant",
                "DILR",
                "VARC",
                "Current Affairs"));
    }

    public ChannelProperties telegramChannel() {
        return channels.computeIfAbsent("telegram", key -> new ChannelProperties());
    }
}
