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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.domain.model.Complaint;
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.InboundEvent;
import me.lecturedesk.bot.domain.model.StatusUpdateOutcome;
import me.lecturedesk.bot.domain.model.StatusUpdateResult;
import me.lecturedesk.bot.port.outbound.ComplaintStorePort;
import me.lecturedesk.bot.port.outbound.MessengerPort;
import me.lecturedesk.bot.security.ReviewerAuthorizer;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies reviewer status actions to submitted complaints.
 *
 * <p>
 * A status button press carries {@code status:<complaint id>:<token>}. Only the
 * configured reviewer may press it. There is no transition table: the new
 * status simply replaces the old one. Once stored, a status change is never
 * rolled back, even if the submitter cannot be notified.
 *
 * @see KeyboardFactory#statusKeyboard(long)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusWorkflowService {

    private static final int CALLBACK_DATA_PARTS_COUNT = 3;

    private final ComplaintStorePort complaintStore;
    private final ReviewerAuthorizer reviewerAuthorizer;
    private final NotificationService notifications;
    private final ComplaintFormatter formatter;
    private final MessengerPort messenger;

    public static boolean isStatusAction(String callbackData) {
        return callbackData != null && callbackData.startsWith(KeyboardFactory.STATUS_PREFIX);
    }

    /**
     * Handles a reviewer status button press and acknowledges it.
     */
    public StatusUpdateResult handle(InboundEvent event) {
        if (!reviewerAuthorizer.isReviewer(event.userId())) {
            answer(event, formatter.text("review.unauthorized"), true);
            return StatusUpdateResult.rejected(StatusUpdateOutcome.UNAUTHORIZED);
        }

        // Format: status:<id>:<token>
        String[] parts = event.payload().split(":");
        if (parts.length != CALLBACK_DATA_PARTS_COUNT) {
            log.warn("Invalid status callback data: {}", event.payload());
            answer(event, formatter.text("review.unknown.status"), false);
            return StatusUpdateResult.rejected(StatusUpdateOutcome.UNKNOWN_STATUS);
        }
        Optional<ComplaintStatus> status = ComplaintStatus.fromToken(parts[2]);
        Long complaintId = parseId(parts[1]);
        if (status.isEmpty() || complaintId == null) {
            log.warn("Rejected status callback data: {}", event.payload());
            answer(event, formatter.text("review.unknown.status"), false);
            return StatusUpdateResult.rejected(StatusUpdateOutcome.UNKNOWN_STATUS);
        }

        answer(event, null, false);
        return changeStatus(event, complaintId, status.get());
    }

    private StatusUpdateResult changeStatus(InboundEvent event, long complaintId, ComplaintStatus status) {
        if (!complaintStore.setStatus(complaintId, status)) {
            notifications.reply(event.chatId(), formatter.text("review.not.found"));
            return StatusUpdateResult.rejected(StatusUpdateOutcome.NOT_FOUND);
        }
        Complaint complaint = complaintStore.get(complaintId)
                .orElseThrow(() -> new IllegalStateException("Complaint " + complaintId + " vanished"));
        log.info("Reviewer updated complaint {} status to {}", complaintId, status.getToken());

        boolean notified = notifications.notifySubmitter(complaint);
        boolean refreshed = event.messageRef() != null
                && notifications.refreshReviewerView(event.messageRef(), complaint);

        if (!notified || !refreshed) {
            notifications.reply(event.chatId(), formatter.statusUpdated(status, notified));
        }
        StatusUpdateOutcome outcome = notified ? StatusUpdateOutcome.UPDATED : StatusUpdateOutcome.NOTIFICATION_FAILED;
        return new StatusUpdateResult(outcome, complaint);
    }

    private void answer(InboundEvent event, String text, boolean alert) {
        if (event.callbackId() == null) {
            return;
        }
        try {
            messenger.answerCallback(event.callbackId(), text, alert).join();
        } catch (Exception e) {
            log.debug("Failed to answer callback {}", event.callbackId(), e);
        }
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
