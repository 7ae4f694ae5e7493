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

/**
 * Result of feeding one event into the submission flow.
 *
 * @param step
 *            step the user is at after the event
 * @param outcome
 *            what the event did
 * @param complaintId
 *            id of the created complaint when {@code outcome} is
 *            {@link ConversationOutcome#SUBMITTED}, otherwise null
 */
public record ConversationResult(ConversationStep step, ConversationOutcome outcome, Long complaintId) {

    public static ConversationResult of(ConversationStep step, ConversationOutcome outcome) {
        return new ConversationResult(step, outcome, null);
    }

    public static ConversationResult submitted(long complaintId) {
        return new ConversationResult(ConversationStep.TERMINAL, ConversationOutcome.SUBMITTED, complaintId);
    }
}
