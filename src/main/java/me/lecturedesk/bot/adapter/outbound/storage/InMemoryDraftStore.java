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

package me.lecturedesk.bot.adapter.outbound.storage;

import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.domain.model.Draft;
import me.lecturedesk.bot.port.outbound.DraftStorePort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local draft registry keyed by user id.
 */
@Component
@Slf4j
public class InMemoryDraftStore implements DraftStorePort {

    private final Map<Long, Draft> drafts = new ConcurrentHashMap<>();

    @Override
    public Optional<Draft> get(long userId) {
        return Optional.ofNullable(drafts.get(userId));
    }

    @Override
    public void put(Draft draft) {
        Draft previous = drafts.put(draft.getUserId(), draft);
        if (previous != null) {
            log.debug("Replaced draft of user {} at step {}", draft.getUserId(), previous.currentStep());
        }
    }

    @Override
    public void remove(long userId) {
        if (drafts.remove(userId) != null) {
            log.info("Cleared draft for user {}", userId);
        }
    }
}
