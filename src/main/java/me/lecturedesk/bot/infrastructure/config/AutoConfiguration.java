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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that starts the bot on application startup.
 *
 * <p>
 * Logs the effective setup (masked token, reviewer, catalog sizes) and starts
 * every channel whose {@code bot.channels.<type>.enabled} property is true.
 * A missing reviewer id is logged loudly but does not stop the bot: users can
 * still submit, complaints just cannot be forwarded or reviewed.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private static final int TOKEN_VISIBLE_CHARS = 10;

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @PostConstruct
    public void init() {
        log.info("Complaint Submission Bot starting...");
        log.info("Bot Token: {}", maskToken(properties.telegramChannel().getToken()));
        Long reviewer = properties.getReviewer().getChatId();
        if (reviewer == null) {
            log.error("bot.reviewer.chat-id is not set; complaints cannot be forwarded or reviewed");
        } else {
            log.info("Reviewer chat: {}", reviewer);
        }
        log.info("Batches: {}", properties.getComplaints().getBatches());
        log.info("Subjects: {}", properties.getComplaints().getSubjects());

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            } else {
                log.info("Channel disabled: {}", channelType);
            }
        }

        log.info("Complaint Submission Bot started");
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }

    static String maskToken(String token) {
        if (token == null || token.isBlank()) {
            return "<not set>";
        }
        if (token.length() <= TOKEN_VISIBLE_CHARS) {
            return "***";
        }
        return token.substring(0, TOKEN_VISIBLE_CHARS) + "...";
    }
}
