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

import lombok.Getter;

/**
 * In-progress complaint of a single user.
 *
 * <p>
 * Fields can only be filled in order: batch, subject, lecture name. The current
 * {@link ConversationStep} is derived from which fields are present, so a draft
 * can never be in a step that contradicts its contents.
 */
@Getter
public class Draft {

    private final long userId;
    private final long chatId;
    private final String username;
    private String batch;
    private String subject;
    private String lectureName;

    public Draft(long userId, long chatId, String username) {
        this.userId = userId;
        this.chatId = chatId;
        this.username = username;
    }

    public ConversationStep currentStep() {
        if (batch == null) {
            return ConversationStep.AWAITING_BATCH;
        }
        if (subject == null) {
            return ConversationStep.AWAITING_SUBJECT;
        }
        if (lectureName == null) {
            return ConversationStep.AWAITING_LECTURE_NAME;
        }
        return ConversationStep.AWAITING_PHOTO;
    }

    public boolean isComplete() {
        return currentStep() == ConversationStep.AWAITING_PHOTO;
    }

    public void selectBatch(String value) {
        requireStep(ConversationStep.AWAITING_BATCH);
        this.batch = value;
    }

    public void selectSubject(String value) {
        requireStep(ConversationStep.AWAITING_SUBJECT);
        this.subject = value;
    }

    public void enterLectureName(String value) {
        requireStep(ConversationStep.AWAITING_LECTURE_NAME);
        this.lectureName = value;
    }

    private void requireStep(ConversationStep expected) {
        ConversationStep actual = currentStep();
        if (actual != expected) {
            throw new IllegalStateException("Draft of user " + userId + " is at " + actual + ", not " + expected);
        }
    }
}
