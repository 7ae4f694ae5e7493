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
import me.lecturedesk.bot.domain.model.InlineKeyboard;
import me.lecturedesk.bot.domain.model.MessageRef;
import me.lecturedesk.bot.port.outbound.MessengerPort;
import me.lecturedesk.bot.security.ReviewerAuthorizer;
import org.springframework.stereotype.Service;

/**
 * Pushes complaints, status changes and flow prompts out through
 * {@link MessengerPort}.
 *
 * <p>
 * Every method blocks until the messenger has answered and reports failure
 * through its return value instead of throwing. Nothing is retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final MessengerPort messenger;
    private final ComplaintFormatter formatter;
    private final KeyboardFactory keyboards;
    private final ReviewerAuthorizer reviewerAuthorizer;

    /**
     * Sends the complaint photo followed by the summary with status buttons to
     * the reviewer chat.
     */
    public boolean forwardToReviewer(Complaint complaint) {
        Long reviewerChatId = reviewerAuthorizer.reviewerChatId();
        if (reviewerChatId == null) {
            log.error("Reviewer chat not configured, complaint {} not forwarded", complaint.getId());
            return false;
        }
        try {
            messenger.sendPhoto(reviewerChatId, complaint.getPhotoReference()).join();
            messenger.sendText(reviewerChatId, formatter.reviewerSummary(complaint),
                    keyboards.statusKeyboard(complaint.getId())).join();
            log.info("Complaint {} sent to reviewer", complaint.getId());
            return true;
        } catch (Exception e) {
            log.error("Error sending complaint {} to reviewer", complaint.getId(), e);
            return false;
        }
    }

    /**
     * Tells the submitter about the complaint's current status.
     */
    public boolean notifySubmitter(Complaint complaint) {
        try {
            messenger.sendText(complaint.getChatId(), formatter.statusChanged(complaint)).join();
            return true;
        } catch (Exception e) {
            log.error("Error notifying user {} about complaint {}", complaint.getUserId(), complaint.getId(), e);
            return false;
        }
    }

    /**
     * Re-renders the reviewer message of a complaint with the same status
     * buttons.
     */
    public boolean refreshReviewerView(MessageRef message, Complaint complaint) {
        try {
            messenger.editMessage(message, formatter.reviewerSummary(complaint),
                    keyboards.statusKeyboard(complaint.getId())).join();
            return true;
        } catch (Exception e) {
            log.warn("Failed to refresh reviewer message for complaint {}: {}", complaint.getId(), e.getMessage());
            return false;
        }
    }

    public boolean reply(long chatId, String html) {
        return reply(chatId, html, null);
    }

    /**
     * Sends a text to a chat, logging instead of throwing on failure.
     */
    public boolean reply(long chatId, String html, InlineKeyboard keyboard) {
        try {
            messenger.sendText(chatId, html, keyboard).join();
            return true;
        } catch (Exception e) {
            log.error("Failed to send message to chat: {}", chatId, e);
            return false;
        }
    }
}
