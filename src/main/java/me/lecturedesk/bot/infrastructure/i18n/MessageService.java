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

package me.lecturedesk.bot.infrastructure.i18n;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized bot texts.
 *
 * <p>
 * Texts are loaded from the {@code messages.properties} resource bundle and may
 * contain {@link MessageFormat} parameters. Only keys looked up with arguments
 * go through {@link MessageFormat}, so apostrophes in those values must be
 * doubled. A missing key resolves to the key itself.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    private static final String BUNDLE_NAME = "messages";

    private final ResourceBundle bundle;

    public MessageService() {
        this(Locale.ENGLISH);
    }

    public MessageService(Locale locale) {
        this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, locale);
        log.info("Loaded message bundle for locale: {}", locale);
    }

    public String getMessage(String key, Object... args) {
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return MessageFormat.format(message, args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {}", key);
            return key;
        }
    }
}
