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
import me.lecturedesk.bot.domain.model.ConversationOutcome;
import me.lecturedesk.bot.domain.model.ConversationResult;
import me.lecturedesk.bot.domain.model.ConversationStep;
import me.lecturedesk.bot.domain.model.Draft;
import me.lecturedesk.bot.domain.model.InboundEvent;
import me.lecturedesk.bot.domain.model.PhotoVariant;
import me.lecturedesk.bot.port.outbound.ComplaintStorePort;
import me.lecturedesk.bot.port.outbound.DraftStorePort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Per-user state machine of the complaint submission flow.
 *
 * <p>
 * Steps, in order:
 *
 * <pre>
 * AWAITING_BATCH -> AWAITING_SUBJECT -> AWAITING_LECTURE_NAME -> AWAITING_PHOTO -> TERMINAL
 * </pre>
 *
 * <p>
 * The step is derived from the user's {@link Draft}; no draft means
 * {@link ConversationStep#TERMINAL}. Each step accepts exactly one kind of
 * input. Anything else leaves the draft untouched and, where the user could be
 * confused, re-prompts. {@code /start} resets the flow from any step and
 * {@code /cancel} abandons it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplaintConversationService {

    private final DraftStorePort draftStore;
    private final ComplaintStorePort complaintStore;
    private final ComplaintCatalog catalog;
    private final KeyboardFactory keyboards;
    private final ComplaintFormatter formatter;
    private final NotificationService notifications;

    public ConversationStep currentStep(long userId) {
        return draftStore.get(userId).map(Draft::currentStep).orElse(ConversationStep.TERMINAL);
    }

    /**
     * Starts a new submission, silently discarding any draft in progress.
     */
    public ConversationResult start(InboundEvent event) {
        draftStore.put(new Draft(event.userId(), event.chatId(), event.username()));
        notifications.reply(event.chatId(), formatter.welcome(event.firstName()), keyboards.batchKeyboard());
        return ConversationResult.of(ConversationStep.AWAITING_BATCH, ConversationOutcome.STARTED);
    }

    /**
     * Abandons the draft of the user. Callers only route here while a draft
     * exists.
     */
    public ConversationResult cancel(InboundEvent event) {
        draftStore.remove(event.userId());
        notifications.reply(event.chatId(), formatter.text("flow.cancelled"));
        return ConversationResult.of(ConversationStep.TERMINAL, ConversationOutcome.CANCELLED);
    }

    /**
     * Feeds a text, button or attachment event into the user's current step.
     */
    public ConversationResult handle(InboundEvent event) {
        Optional<Draft> found = draftStore.get(event.userId());
        if (found.isEmpty()) {
            log.debug("No draft for user {}, ignoring {}", event.userId(), event.kind());
            return ConversationResult.of(ConversationStep.TERMINAL, ConversationOutcome.IGNORED);
        }
        Draft draft = found.get();
        return switch (draft.currentStep()) {
        case AWAITING_BATCH -> onAwaitingBatch(draft, event);
        case AWAITING_SUBJECT -> onAwaitingSubject(draft, event);
        case AWAITING_LECTURE_NAME -> onAwaitingLectureName(draft, event);
        case AWAITING_PHOTO -> onAwaitingPhoto(draft, event);
        case TERMINAL -> throw new IllegalStateException("Stored draft cannot be terminal");
        };
    }

    private ConversationResult onAwaitingBatch(Draft draft, InboundEvent event) {
        if (event.kind() != InboundEvent.Kind.BUTTON) {
            return remindToUseButtons(draft, event);
        }
        String data = event.payload();
        if (KeyboardFactory.RESTART.equals(data)) {
            notifications.reply(event.chatId(), formatter.text("flow.restart"), keyboards.batchKeyboard());
            return ConversationResult.of(ConversationStep.AWAITING_BATCH, ConversationOutcome.IGNORED);
        }
        String batch = stripPrefix(data, KeyboardFactory.BATCH_PREFIX);
        if (!catalog.isBatch(batch)) {
            log.debug("Ignoring button {} at batch step of user {}", data, draft.getUserId());
            return ConversationResult.of(ConversationStep.AWAITING_BATCH, ConversationOutcome.IGNORED);
        }
        draft.selectBatch(batch);
        log.info("Stored batch for user {}: {}", draft.getUserId(), batch);
        notifications.reply(event.chatId(), formatter.batchSelected(draft), keyboards.subjectKeyboard());
        return ConversationResult.of(ConversationStep.AWAITING_SUBJECT, ConversationOutcome.ADVANCED);
    }

    private ConversationResult onAwaitingSubject(Draft draft, InboundEvent event) {
        if (event.kind() != InboundEvent.Kind.BUTTON) {
            return remindToUseButtons(draft, event);
        }
        String subject = stripPrefix(event.payload(), KeyboardFactory.SUBJECT_PREFIX);
        if (!catalog.isSubject(subject)) {
            log.debug("Ignoring button {} at subject step of user {}", event.payload(), draft.getUserId());
            return ConversationResult.of(ConversationStep.AWAITING_SUBJECT, ConversationOutcome.IGNORED);
        }
        draft.selectSubject(subject);
        log.info("Stored subject for user {}: {}", draft.getUserId(), subject);
        notifications.reply(event.chatId(), formatter.subjectSelected(draft));
        return ConversationResult.of(ConversationStep.AWAITING_LECTURE_NAME, ConversationOutcome.ADVANCED);
    }

    private ConversationResult onAwaitingLectureName(Draft draft, InboundEvent event) {
        if (event.kind() == InboundEvent.Kind.BUTTON) {
            return ConversationResult.of(ConversationStep.AWAITING_LECTURE_NAME, ConversationOutcome.IGNORED);
        }
        String lectureName = event.kind() == InboundEvent.Kind.TEXT && event.payload() != null
                ? event.payload().strip()
                : "";
        if (lectureName.isEmpty()) {
            notifications.reply(event.chatId(), formatter.text("flow.lecture.invalid"));
            return ConversationResult.of(ConversationStep.AWAITING_LECTURE_NAME,
                    ConversationOutcome.VALIDATION_REJECTED);
        }
        draft.enterLectureName(lectureName);
        log.info("Stored lecture name for user {}: {}", draft.getUserId(), lectureName);
        notifications.reply(event.chatId(), formatter.lectureSaved(draft));
        return ConversationResult.of(ConversationStep.AWAITING_PHOTO, ConversationOutcome.ADVANCED);
    }

    private ConversationResult onAwaitingPhoto(Draft draft, InboundEvent event) {
        if (event.kind() == InboundEvent.Kind.BUTTON) {
            return ConversationResult.of(ConversationStep.AWAITING_PHOTO, ConversationOutcome.IGNORED);
        }
        Optional<PhotoVariant> photo = event.kind() == InboundEvent.Kind.PHOTO
                ? PhotoVariant.largest(event.photos())
                : Optional.empty();
        if (photo.isEmpty()) {
            notifications.reply(event.chatId(), formatter.text("flow.photo.invalid"));
            return ConversationResult.of(ConversationStep.AWAITING_PHOTO, ConversationOutcome.VALIDATION_REJECTED);
        }

        Complaint complaint = complaintStore.create(draft, photo.get().fileId());
        draftStore.remove(draft.getUserId());
        notifications.reply(event.chatId(), formatter.submitted(complaint));
        notifications.forwardToReviewer(complaint);
        return ConversationResult.submitted(complaint.getId());
    }

    private ConversationResult remindToUseButtons(Draft draft, InboundEvent event) {
        if (event.kind() == InboundEvent.Kind.TEXT || event.kind() == InboundEvent.Kind.PHOTO
                || event.kind() == InboundEvent.Kind.OTHER) {
            notifications.reply(event.chatId(), formatter.text("flow.use.buttons"));
            return ConversationResult.of(draft.currentStep(), ConversationOutcome.VALIDATION_REJECTED);
        }
        return ConversationResult.of(draft.currentStep(), ConversationOutcome.IGNORED);
    }

    private static String stripPrefix(String data, String prefix) {
        if (data == null || !data.startsWith(prefix)) {
            return null;
        }
        return data.substring(prefix.length());
    }
}
