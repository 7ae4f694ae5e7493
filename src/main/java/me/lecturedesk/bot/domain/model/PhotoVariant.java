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

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One resolution of an uploaded photo as reported by the messenger.
 */
public record PhotoVariant(String fileId, int width, int height, long fileSize) {

    private static final Comparator<PhotoVariant> BY_SIZE = Comparator
            .comparingLong((PhotoVariant photo) -> (long) photo.width() * photo.height())
            .thenComparingLong(PhotoVariant::fileSize);

    /**
     * Picks the variant with the most pixels, file size breaking ties.
     */
    public static Optional<PhotoVariant> largest(List<PhotoVariant> variants) {
        if (variants == null || variants.isEmpty()) {
            return Optional.empty();
        }
        return variants.stream().max(BY_SIZE);
    }
}
