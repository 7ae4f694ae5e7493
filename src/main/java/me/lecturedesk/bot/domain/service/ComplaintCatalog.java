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

package me.lecturedesk.bot.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed batch and subject choices offered during submission.
 *
 * <p>
 * Lists come from {@code bot.complaints.*} and are validated once at startup:
 * they must be non-empty, free of duplicates and short enough to fit into
 * Telegram callback data together with their prefix.
 */
@Service
@Slf4j
public class ComplaintCatalog {

    static final int MAX_CALLBACK_DATA_BYTES = 64;

    private final List<String> batches;
    private final List<String> subjects;

    public ComplaintCatalog(BotProperties properties) {
        BotProperties.ComplaintsProperties config = properties.getComplaints();
        this.batches = validate("batches", config.getBatches(), KeyboardFactory.BATCH_PREFIX);
        this.subjects = validate("subjects", config.getSubjects(), KeyboardFactory.SUBJECT_PREFIX);
        log.info("Complaint catalog: {} batches, {} subjects", batches.size(), subjects.size());
    }

    public List<String> getBatches() {
        return batches;
    }

    public List<String> getSubjects() {
        return subjects;
    }

    public boolean isBatch(String value) {
        return value != null && batches.contains(value);
    }

    public boolean isSubject(String value) {
        return value != null && subjects.contains(value);
    }

    private static List<String> validate(String name, List<String> values, String callbackPrefix) {
        if (values == null || values.isEmpty()) {
            throw new IllegalStateException("bot.complaints." + name + " must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalStateException("bot.complaints." + name + " contains a blank entry");
            }
            if (!seen.add(value)) {
                throw new IllegalStateException("bot.complaints." + name + " contains duplicate: " + value);
            }
            int callbackBytes = (callbackPrefix + value).getBytes(StandardCharsets.UTF_8).length;
            if (callbackBytes > MAX_CALLBACK_DATA_BYTES) {
                throw new IllegalStateException("bot.complaints." + name + " entry too long for a button: " + value);
            }
        }
        return List.copyOf(values);
    }
}
