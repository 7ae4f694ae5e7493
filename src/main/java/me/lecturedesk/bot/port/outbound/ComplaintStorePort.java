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

import me.lecturedesk.bot.domain.model.Complaint;
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.Draft;

import java.util.Optional;

/**
 * Store of submitted complaints. Ids are allocated sequentially and never
 * reused for the lifetime of the store.
 */
public interface ComplaintStorePort {

    /**
     * Creates a complaint with status {@link ComplaintStatus#SUBMITTED} from a
     * complete draft.
     *
     * @throws IllegalStateException
     *             if the draft is not complete
     */
    Complaint create(Draft draft, String photoReference);

    Optional<Complaint> get(long id);

    /**
     * Overwrites the status of a complaint.
     *
     * @return false if no complaint has this id
     */
    boolean setStatus(long id, ComplaintStatus status);

    int count();
}
