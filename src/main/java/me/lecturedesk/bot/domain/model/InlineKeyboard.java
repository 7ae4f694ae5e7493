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

import java.util.ArrayList;
import java.util.List;

/**
 * Channel-neutral inline keyboard: rows of buttons carrying callback data.
 */
public record InlineKeyboard(List<List<KeyboardButton>> rows) {

    public InlineKeyboard {
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static InlineKeyboard singleColumn(List<KeyboardButton> buttons) {
        List<List<KeyboardButton>> rows = new ArrayList<>();
        for (KeyboardButton button : buttons) {
            rows.add(List.of(button));
        }
        return new InlineKeyboard(rows);
    }

    public static InlineKeyboard grid(List<KeyboardButton> buttons, int perRow) {
        if (perRow < 1) {
            throw new IllegalArgumentException("perRow must be positive");
        }
        List<List<KeyboardButton>> rows = new ArrayList<>();
        List<KeyboardButton> row = new ArrayList<>();
        for (KeyboardButton button : buttons) {
            row.add(button);
            if (row.size() == perRow) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        return new InlineKeyboard(rows);
    }

    public List<KeyboardButton> buttons() {
        return rows.stream().flatMap(List::stream).toList();
    }
}
