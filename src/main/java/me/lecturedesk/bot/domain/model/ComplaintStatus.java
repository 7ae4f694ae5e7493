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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a complaint. Any status may follow any other; only the
 * reviewer changes it.
 */
public enum ComplaintStatus {

    SUBMITTED("submitted", "Submitted"),
    SEND("send", "Send"),
    SEEN("seen", "Seen"),
    APPROVED("approved", "Approved"),
    RESOLVED("resolved", "Resolved");

    private static final List<ComplaintStatus> REVIEWER_OPTIONS = List.of(SEND, SEEN, APPROVED, RESOLVED);

    private final String token;
    private final String label;

    ComplaintStatus(String token, String label) {
        this.token = token;
        this.label = label;
    }

    public String getToken() {
        return token;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Statuses offered to the reviewer as buttons, in display order.
     */
    public static List<ComplaintStatus> reviewerOptions() {
        return REVIEWER_OPTIONS;
    }

    /**
     * Resolves a wire token (case-insensitive). Unknown tokens yield empty.
     */
    public static Optional<ComplaintStatus> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.token.equals(normalized))
                .findFirst();
    }
}
