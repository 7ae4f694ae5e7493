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
import me.lecturedesk.bot.domain.model.Complaint;
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.Draft;
import me.lecturedesk.bot.port.outbound.ComplaintStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local implementation of {@link ComplaintStorePort}.
 *
 * <p>
 * Complaints live only as long as the JVM. Ids start at 1 and come from a
 * single counter, so they are unique and strictly increasing even if complaints
 * are created from several threads.
 */
@Component
@Slf4j
public class InMemoryComplaintStore implements ComplaintStorePort {

    private final Map<Long, Complaint> complaints = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryComplaintStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Complaint create(Draft draft, String photoReference) {
        if (!draft.isComplete()) {
            throw new IllegalStateException("Draft of user " + draft.getUserId() + " is incomplete: "
                    + draft.currentStep());
        }
        if (photoReference == null || photoReference.isBlank()) {
            throw new IllegalArgumentException("photoReference must not be blank");
        }
        long id = sequence.incrementAndGet();
        Complaint complaint = Complaint.builder()
                .id(id)
                .userId(draft.getUserId())
                .chatId(draft.getChatId())
                .username(draft.getUsername())
                .batch(draft.getBatch())
                .subject(draft.getSubject())
                .lectureName(draft.getLectureName())
                .photoReference(photoReference)
                .createdAt(Instant.now(clock))
                .build();
        complaints.put(id, complaint);
        log.info("Created complaint {} for user {}", id, draft.getUserId());
        return complaint;
    }

    @Override
    public Optional<Complaint> get(long id) {
        return Optional.ofNullable(complaints.get(id));
    }

    @Override
    public boolean setStatus(long id, ComplaintStatus status) {
        Complaint complaint = complaints.get(id);
        if (complaint == null) {
            log.debug("Status change for unknown complaint {}", id);
            return false;
        }
        complaint.changeStatus(status);
        log.info("Updated complaint {} status to {}", id, status.getToken());
        return true;
    }

    @Override
    public int count() {
        return complaints.size();
    }
}
