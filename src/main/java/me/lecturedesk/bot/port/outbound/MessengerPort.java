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

package me.lecturedesk.bot.port.outbound;

import me.lecturedesk.bot.domain.model.InlineKeyboard;
import me.lecturedesk.bot.domain.model.MessageRef;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound messaging capability used by the domain to reach submitters and the
 * reviewer. Texts are HTML formatted. Futures complete exceptionally when the
 * messenger rejects the request.
 */
public interface MessengerPort {

    /**
     * Sends a text message, optionally with an inline keyboard.
     */
    CompletableFuture<Void> sendText(long chatId, String html, InlineKeyboard keyboard);

    default CompletableFuture<Void> sendText(long chatId, String html) {
        return sendText(chatId, html, null);
    }

    /**
     * Sends a previously uploaded photo by its messenger file reference.
     */
    CompletableFuture<Void> sendPhoto(long chatId, String photoReference);

    /**
     * Replaces text and keyboard of an already delivered message. Editing to
     * identical content counts as success.
     */
    CompletableFuture<Void> editMessage(MessageRef message, String html, InlineKeyboard keyboard);

    /**
     * Acknowledges a button press. With {@code alert} the text is shown as a
     * modal popup instead of a transient toast.
     */
    CompletableFuture<Void> answerCallback(String callbackId, String text, boolean alert);
}
