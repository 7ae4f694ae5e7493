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
import me.lecturedesk.bot.domain.model.Complaint;
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.Draft;
import me.lecturedesk.bot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

/**
 * Renders HTML texts for submitters and the reviewer. User supplied values are
 * escaped before they are placed into a template.
 */
@Component
@RequiredArgsConstructor
public class ComplaintFormatter {

    private final MessageService messageService;

    public String welcome(String firstName) {
        String name = firstName == null || firstName.isBlank()
                ? messageService.getMessage("flow.welcome.anonymous")
                : firstName;
        return messageService.getMessage("flow.welcome", escapeHtml(name));
    }

    public String batchSelected(Draft draft) {
        return messageService.getMessage("flow.batch.selected", escapeHtml(draft.getBatch()));
    }

    public String subjectSelected(Draft draft) {
        return messageService.getMessage("flow.subject.selected",
                escapeHtml(draft.getSubject()), escapeHtml(draft.getBatch()));
    }

    public String lectureSaved(Draft draft) {
        return messageService.getMessage("flow.lecture.saved",
                escapeHtml(draft.getLectureName()), escapeHtml(draft.getBatch()), escapeHtml(draft.getSubject()));
    }

    public String submitted(Complaint complaint) {
        return messageService.getMessage("flow.submitted",
                displayId(complaint), ComplaintStatus.SUBMITTED.getLabel());
    }

    /**
     * Reviewer-facing summary; reflects the complaint's current status.
     */
    public String reviewerSummary(Complaint complaint) {
        String username = complaint.getUsername() == null || complaint.getUsername().isBlank()
                ? messageService.getMessage("review.no.username")
                : "@" + escapeHtml(complaint.getUsername());
        return messageService.getMessage("review.summary",
                String.valueOf(complaint.getUserId()),
                username,
                escapeHtml(complaint.getBatch()),
                escapeHtml(complaint.getSubject()),
                escapeHtml(complaint.getLectureName()),
                complaint.getStatus().getLabel(),
                displayId(complaint));
    }

    public String statusChanged(Complaint complaint) {
        return messageService.getMessage("status.changed",
                displayId(complaint),
                complaint.getStatus().getLabel(),
                escapeHtml(complaint.getSubject()),
                escapeHtml(complaint.getLectureName()));
    }

    public String statusUpdated(ComplaintStatus status, boolean submitterNotified) {
        String key = submitterNotified ? "review.updated.notified" : "review.updated.not.notified";
        return messageService.getMessage(key, status.getLabel());
    }

    public String text(String key) {
        return messageService.getMessage(key);
    }

    static String displayId(Complaint complaint) {
        return "complaint_" + complaint.getId();
    }

    static String escapeHtml(String text) {
        if (text == null)
            return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
