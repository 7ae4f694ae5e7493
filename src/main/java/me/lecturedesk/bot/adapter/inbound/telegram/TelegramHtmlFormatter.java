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

package me.lecturedesk.bot.adapter.inbound.telegram;

import java.util.regex.Pattern;

/**
 * Helpers for the Telegram HTML parse mode.
 *
 * <p>
 * Outgoing texts are rendered as Telegram HTML by the domain. When Telegram
 * refuses to parse such a text, {@link #toPlainText(String)} turns it into
 * something that can be sent without a parse mode.
 */
public final class TelegramHtmlFormatter {

    private TelegramHtmlFormatter() {
    }

    // <b>, </b>, <code>, <a href="...">
    private static final Pattern TAG_PATTERN = Pattern.compile("</?[a-zA-Z][^>]*>");

    /**
     * Removes tags and decodes the entities Telegram HTML requires.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isEmpty()) {
            return html;
        }
        String text = TAG_PATTERN.matcher(html).replaceAll("");
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }
}
