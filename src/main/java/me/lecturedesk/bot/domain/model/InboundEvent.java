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

import lombok.Builder;

import java.util.List;

/**
 * A single inbound interaction delivered by a messaging channel.
 *
 * <p>
 * Published by inbound channel adapters on the application event bus and
 * consumed by {@link me.lecturedesk.bot.domain.loop.ComplaintEventRouter}.
 *
 * @param kind
 *            what the user did
 * @param userId
 *            messenger id of the acting user
 * @param chatId
 *            chat the interaction happened in
 * @param username
 *            public handle, may be null
 * @param firstName
 *            display name used in greetings, may be null
 * @param payload
 *            command name without slash, message text, or button data
 * @param photos
 *            all resolutions of an uploaded photo, empty for other kinds
 * @param callbackId
 *            id to acknowledge a button press with, null for other kinds
 * @param messageRef
 *            message carrying the pressed button, null for other kinds
 */
@Builder
public record InboundEvent(
        Kind kind,
        long userId,
        long chatId,
        String username,
        String firstName,
        String payload,
        List<PhotoVariant> photos,
        String callbackId,
        MessageRef messageRef) {

    public InboundEvent {
        photos = photos == null ? List.of() : List.copyOf(photos);
    }

    public boolean isCommand(String name) {
        return kind == Kind.COMMAND && name.equals(payload);
    }

    public enum Kind {
        COMMAND,
        TEXT,
        BUTTON,
        PHOTO,
        /** Attachments other than photos: documents, stickers, voice. */
        OTHER
    }
}
