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

package me.lecturedesk.bot.domain.loop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.domain.model.ConversationStep;
import me.lecturedesk.bot.domain.model.InboundEvent;
import me.lecturedesk.bot.domain.service.ComplaintConversationService;
import me.lecturedesk.bot.domain.service.ComplaintFormatter;
import me.lecturedesk.bot.domain.service.NotificationService;
import me.lecturedesk.bot.domain.service.StatusWorkflowService;
import me.lecturedesk.bot.port.outbound.MessengerPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Entry point of the domain for inbound events.
 *
 * <p>
 * Routing:
 * <ul>
 * <li>{@code /start} - new submission, from any step</li>
 * <li>{@code /cancel} - abandon the submission; unknown command when there is
 * none</li>
 * <li>other commands - "unknown command" reply</li>
 * <li>{@code status:*} buttons - reviewer status workflow</li>
 * <li>everything else - the user's current submission step</li>
 * </ul>
 *
 * <p>
 * Failures never escape: an exception while handling one event is logged and
 * the next event is served normally.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComplaintEventRouter {

    static final String START_COMMAND = "start";
    static final String CANCEL_COMMAND = "cancel";

    private final ComplaintConversationService conversation;
    private final StatusWorkflowService statusWorkflow;
    private final NotificationService notifications;
    private final ComplaintFormatter formatter;
    private final MessengerPort messenger;

    @EventListener
    public void onInboundEvent(InboundEvent event) {
        try {
            route(event);
        } catch (Exception e) {
            log.error("Exception while handling {} from user {}", event.kind(), event.userId(), e);
        }
    }

    void route(InboundEvent event) {
        switch (event.kind()) {
        case COMMAND -> routeCommand(event);
        case BUTTON -> routeButton(event);
        case TEXT, PHOTO, OTHER -> conversation.handle(event);
        default -> log.debug("Unsupported event kind: {}", event.kind());
        }
    }

    private void routeCommand(InboundEvent event) {
        if (event.isCommand(START_COMMAND)) {
            conversation.start(event);
        } else if (event.isCommand(CANCEL_COMMAND)
                && conversation.currentStep(event.userId()) != ConversationStep.TERMINAL) {
            conversation.cancel(event);
        } else {
            log.debug("Unknown command /{} from user {}", event.payload(), event.userId());
            notifications.reply(event.chatId(), formatter.text("flow.unknown.command"));
        }
    }

    private void routeButton(InboundEvent event) {
        if (StatusWorkflowService.isStatusAction(event.payload())) {
            statusWorkflow.handle(event);
            return;
        }
        acknowledge(event);
        conversation.handle(event);
    }

    private void acknowledge(InboundEvent event) {
        if (event.callbackId() == null) {
            return;
        }
        try {
            messenger.answerCallback(event.callbackId(), null, false).join();
        } catch (Exception e) {
            log.debug("Failed to answer callback {}", event.callbackId(), e);
        }
    }
}
