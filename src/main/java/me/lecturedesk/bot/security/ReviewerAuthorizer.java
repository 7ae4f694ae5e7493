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

package me.lecturedesk.bot.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

/**
 * Decides whether a user may act as the complaint reviewer.
 *
 * <p>
 * Exactly one user id is privileged: {@code bot.reviewer.chat-id}. When it is
 * not configured nobody is authorized (fail-closed).
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewerAuthorizer {

    private final BotProperties properties;

    public boolean isReviewer(long userId) {
        Long reviewerId = properties.getReviewer().getChatId();
        if (reviewerId == null) {
            log.warn("[Security] Reviewer id not configured, denying user {}", userId);
            return false;
        }
        boolean allowed = reviewerId == userId;
        if (!allowed) {
            log.warn("[Security] Unauthorized status change attempt by user {}", userId);
        }
        return allowed;
    }

    /**
     * Chat that receives forwarded complaints, if configured.
     */
    public Long reviewerChatId() {
        return properties.getReviewer().getChatId();
    }
}
