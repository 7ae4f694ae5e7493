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

package me.lecturedesk.bot.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * A submitted complaint. Everything except {@link #getStatus() status} is fixed
 * at creation.
 */
@Getter
@Builder
public class Complaint {

    private final long id;
    private final long userId;
    private final long chatId;
    private final String username; // may be null, Telegram usernames are optional
    private final String batch;
    private final String subject;
    private final String lectureName;
    private final String photoReference;
    private final Instant createdAt;

    @Builder.Default
    private volatile ComplaintStatus status = ComplaintStatus.SUBMITTED;

    public void changeStatus(ComplaintStatus newStatus) {
        if (newStatus == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        this.status = newStatus;
    }
}
