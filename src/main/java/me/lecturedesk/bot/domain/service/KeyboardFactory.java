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
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.InlineKeyboard;
import me.lecturedesk.bot.domain.model.KeyboardButton;
import me.lecturedesk.bot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the inline keyboards of the submission flow and the reviewer view.
 *
 * <p>
 * Callback data formats:
 * <ul>
 * <li>{@code batch:<batch name>}</li>
 * <li>{@code subject:<subject name>}</li>
 * <li>{@code restart}</li>
 * <li>{@code status:<complaint id>:<status token>}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class KeyboardFactory {

    public static final String BATCH_PREFIX = "batch:";
    public static final String SUBJECT_PREFIX = "subject:";
    public static final String RESTART = "restart";
    public static final String STATUS_PREFIX = "status:";

    private static final int STATUS_BUTTONS_PER_ROW = 2;

    private final ComplaintCatalog catalog;
    private final MessageService messageService;

    public InlineKeyboard batchKeyboard() {
        List<KeyboardButton> buttons = new ArrayList<>();
        for (String batch : catalog.getBatches()) {
            buttons.add(new KeyboardButton(batch, BATCH_PREFIX + batch));
        }
        buttons.add(new KeyboardButton(messageService.getMessage("keyboard.restart"), RESTART));
        return InlineKeyboard.singleColumn(buttons);
    }

    public InlineKeyboard subjectKeyboard() {
        List<KeyboardButton> buttons = new ArrayList<>();
        for (String subject : catalog.getSubjects()) {
            buttons.add(new KeyboardButton(subject, SUBJECT_PREFIX + subject));
        }
        return InlineKeyboard.singleColumn(buttons);
    }

    public InlineKeyboard statusKeyboard(long complaintId) {
        List<KeyboardButton> buttons = new ArrayList<>();
        for (ComplaintStatus status : ComplaintStatus.reviewerOptions()) {
            buttons.add(new KeyboardButton(status.getLabel(), STATUS_PREFIX + complaintId + ":" + status.getToken()));
        }
        return InlineKeyboard.grid(buttons, STATUS_BUTTONS_PER_ROW);
    }
}
