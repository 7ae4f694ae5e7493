package me.lecturedesk.bot.domain.service;

import me.lecturedesk.bot.domain.model.Complaint;
import me.lecturedesk.bot.domain.model.ComplaintStatus;
import me.lecturedesk.bot.domain.model.ConversationOutcome;
import me.lecturedesk.bot.domain.model.ConversationResult;
import me.lecturedesk.bot.domain.model.ConversationStep;
import me.lecturedesk.bot.domain.model.Draft;
import me.lecturedesk.bot.domain.model.KeyboardButton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.lecturedesk.bot.domain.service.DomainFixture.REVIEWER_ID;
import static me.lecturedesk.bot.domain.service.DomainFixture.button;
import static me.lecturedesk.bot.domain.service.DomainFixture.command;
import static me.lecturedesk.bot.domain.service.DomainFixture.fullSize;
import static me.lecturedesk.bot.domain.service.DomainFixture.other;
import static me.lecturedesk.bot.domain.service.DomainFixture.photo;
import static me.lecturedesk.bot.domain.service.DomainFixture.text;
import static me.lecturedesk.bot.domain.service.DomainFixture.thumbnail;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComplaintConversationServiceTest {

    private static final long USER_ID = 1001L;
    private static final long OTHER_USER_ID = 2002L;
    private static final String BATCH = "Master quest 2.0 2025";
    private static final String SUBJECT = "Quant";
    private static final String LECTURE = "Linear Equations Lecture 3";

    private DomainFixture fixture;
    private ComplaintConversationService service;
    private RecordingMessenger messenger;

    @BeforeEach
    void setUp() {
        fixture = new DomainFixture();
        service = fixture.conversation;
        messenger = fixture.messenger;
    }

    private Draft draft(long userId) {
        return fixture.draftStore.get(userId).orElseThrow();
    }

    private void advanceToLectureName(long userId) {
        service.start(command(userId, "start"));
        service.handle(button(userId, "batch:" + BATCH));
        service.handle(button(userId, "subject:" + SUBJECT));
    }

    // ===== start =====

    @Test
    void shouldGreetUserAndOfferBatchesOnStart() {
        ConversationResult result = service.start(command(USER_ID, "start"));

        assertEquals(ConversationStep.AWAITING_BATCH, result.step());
        assertEquals(ConversationOutcome.STARTED, result.outcome());
        assertEquals(ConversationStep.AWAITING_BATCH, service.currentStep(USER_ID));

        RecordingMessenger.SentText welcome = messenger.lastTextTo(USER_ID);
        assertTrue(welcome.html().contains("Welcome Asha!"));
        List<String> callbacks = welcome.keyboard().buttons().stream().map(KeyboardButton::callbackData).toList();
        assertTrue(callbacks.contains("batch:" + BATCH));
        assertTrue(callbacks.contains("batch:master quest 2026"));
        assertTrue(callbacks.contains("batch:Ace ipm crash course"));
    }

    @Test
    void shouldDiscardDraftInProgressOnRestart() {
        advanceToLectureName(USER_ID);

        ConversationResult result = service.start(command(USER_ID, "start"));

        assertEquals(ConversationStep.AWAITING_BATCH, result.step());
        Draft draft = draft(USER_ID);
        assertNull(draft.getBatch());
        assertNull(draft.getSubject());
    }

    @Test
    void shouldReportTerminalWithoutDraft() {
        assertEquals(ConversationStep.TERMINAL, service.currentStep(USER_ID));
    }

    // ===== batch step =====

    @Test
    void shouldStoreBatchAndOfferSubjects() {
        service.start(command(USER_ID, "start"));

        ConversationResult result = service.handle(button(USER_ID, "batch:" + BATCH));

        assertEquals(ConversationStep.AWAITING_SUBJECT, result.step());
        assertEquals(ConversationOutcome.ADVANCED, result.outcome());
        assertEquals(BATCH, draft(USER_ID).getBatch());
        RecordingMessenger.SentText prompt = messenger.lastTextTo(USER_ID);
        assertTrue(prompt.html().contains("Batch selected: <b>" + BATCH + "</b>"));
        assertEquals("subject:Quant", prompt.keyboard().buttons().get(0).callbackData());
    }

    @Test
    void shouldIgnoreUnknownBatch() {
        service.start(command(USER_ID, "start"));
        messenger.clear();

        ConversationResult result = service.handle(button(USER_ID, "batch:Unknown batch"));

        assertEquals(ConversationOutcome.IGNORED, result.outcome());
        assertEquals(ConversationStep.AWAITING_BATCH, service.currentStep(USER_ID));
        assertTrue(messenger.texts.isEmpty());
    }

    @Test
    void shouldIgnoreSubjectButtonWhileAwaitingBatch() {
        service.start(command(USER_ID, "start"));

        ConversationResult result = service.handle(button(USER_ID, "subject:" + SUBJECT));

        assertEquals(ConversationOutcome.IGNORED, result.outcome());
        assertNull(draft(USER_ID).getSubject());
    }

    @Test
    void shouldResendBatchPromptOnRestartButton() {
        service.start(command(USER_ID, "start"));
        messenger.clear();

        ConversationResult result = service.handle(button(USER_ID, KeyboardFactory.RESTART));

        assertEquals(ConversationStep.AWAITING_BATCH, result.step());
        assertNull(draft(USER_ID).getBatch());
        RecordingMessenger.SentText prompt = messenger.lastTextTo(USER_ID);
        assertTrue(prompt.html().contains("Starting over"));
        assertEquals("batch:" + BATCH, prompt.keyboard().buttons().get(0).callbackData());
    }

    @Test
    void shouldRejectPhotoWhileAwaitingBatch() {
        service.start(command(USER_ID, "start"));
        messenger.clear();

        ConversationResult result = service.handle(photo(USER_ID, fullSize("early")));

        assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
        assertEquals(ConversationStep.AWAITING_BATCH, service.currentStep(USER_ID));
        assertNull(draft(USER_ID).getBatch());
        assertEquals(0, fixture.complaintStore.count());
        assertTrue(messenger.lastTextTo(USER_ID).html().contains("use the buttons"));
    }

    // ===== subject step =====

    @Test
    void shouldStoreSubjectAndAskForLectureName() {
        service.start(command(USER_ID, "start"));
        service.handle(button(USER_ID, "batch:" + BATCH));

        ConversationResult result = service.handle(button(USER_ID, "subject:" + SUBJECT));

        assertEquals(ConversationStep.AWAITING_LECTURE_NAME, result.step());
        assertEquals(SUBJECT, draft(USER_ID).getSubject());
        String prompt = messenger.lastTextTo(USER_ID).html();
        assertTrue(prompt.contains("Subject selected: <b>Quant</b>"));
        assertTrue(prompt.contains("Batch: " + BATCH));
    }

    @Test
    void shouldIgnoreBatchButtonWhileAwaitingSubject() {
        service.start(command(USER_ID, "start"));
        service.handle(button(USER_ID, "batch:" + BATCH));

        ConversationResult result = service.handle(button(USER_ID, "batch:master quest 2026"));

        assertEquals(ConversationOutcome.IGNORED, result.outcome());
        assertEquals(BATCH, draft(USER_ID).getBatch());
        assertEquals(ConversationStep.AWAITING_SUBJECT, service.currentStep(USER_ID));
    }

    @Test
    void shouldRejectTextWhileAwaitingSubject() {
        service.start(command(USER_ID, "start"));
        service.handle(button(USER_ID, "batch:" + BATCH));

        ConversationResult result = service.handle(text(USER_ID, "Quant"));

        assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
        assertNull(draft(USER_ID).getSubject());
    }

    // ===== lecture name step =====

    @Test
    void shouldStoreTrimmedLectureName() {
        advanceToLectureName(USER_ID);

        ConversationResult result = service.handle(text(USER_ID, "   " + LECTURE + "  \n"));

        assertEquals(ConversationStep.AWAITING_PHOTO, result.step());
        assertEquals(LECTURE, draft(USER_ID).getLectureName());
        String summary = messenger.lastTextTo(USER_ID).html();
        assertTrue(summary.contains("Lecture: " + LECTURE));
        assertTrue(summary.contains("screenshot"));
    }

    @Test
    void shouldRejectBlankLectureNameWithoutChangingDraft() {
        advanceToLectureName(USER_ID);

        for (String blank : List.of("", "   ", "\t\n")) {
            ConversationResult result = service.handle(text(USER_ID, blank));

            assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
            assertEquals(ConversationStep.AWAITING_LECTURE_NAME, result.step());
            assertNull(draft(USER_ID).getLectureName());
            assertTrue(messenger.lastTextTo(USER_ID).html().contains("valid lecture name"));
        }
    }

    @Test
    void shouldRejectPhotoWhileAwaitingLectureName() {
        advanceToLectureName(USER_ID);

        ConversationResult result = service.handle(photo(USER_ID, fullSize("too-early")));

        assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
        assertNull(draft(USER_ID).getLectureName());
        assertEquals(0, fixture.complaintStore.count());
    }

    @Test
    void shouldEscapeHtmlInLectureNameEcho() {
        advanceToLectureName(USER_ID);

        service.handle(text(USER_ID, "Ratios <b>&</b> Proportions"));

        assertEquals("Ratios <b>&</b> Proportions", draft(USER_ID).getLectureName());
        assertTrue(messenger.lastTextTo(USER_ID).html().contains("Ratios &lt;b&gt;&amp;&lt;/b&gt; Proportions"));
    }

    // ===== photo step =====

    @Test
    void shouldRejectTextWhileAwaitingPhoto() {
        advanceToLectureName(USER_ID);
        service.handle(text(USER_ID, LECTURE));

        ConversationResult result = service.handle(text(USER_ID, "here is my screenshot"));

        assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
        assertEquals(ConversationStep.AWAITING_PHOTO, service.currentStep(USER_ID));
        assertTrue(messenger.lastTextTo(USER_ID).html().contains("Please send an image file"));
    }

    @Test
    void shouldRejectDocumentWhileAwaitingPhoto() {
        advanceToLectureName(USER_ID);
        service.handle(text(USER_ID, LECTURE));

        ConversationResult result = service.handle(other(USER_ID));

        assertEquals(ConversationOutcome.VALIDATION_REJECTED, result.outcome());
        assertEquals(0, fixture.complaintStore.count());
    }

    @Test
    void shouldSubmitComplaintWithLargestPhotoAndForwardToReviewer() {
        service.start(command(USER_ID, "start"));
        service.handle(button(USER_ID, "batch:" + BATCH));
        service.handle(button(USER_ID, "subject:" + SUBJECT));
        service.handle(text(USER_ID, LECTURE));

        ConversationResult result = service.handle(photo(USER_ID, fullSize("large"), thumbnail("small")));

        assertEquals(ConversationOutcome.SUBMITTED, result.outcome());
        assertEquals(ConversationStep.TERMINAL, result.step());
        assertEquals(1, fixture.complaintStore.count());
        assertTrue(fixture.draftStore.get(USER_ID).isEmpty());

        Complaint complaint = fixture.complaintStore.get(result.complaintId()).orElseThrow();
        assertEquals(USER_ID, complaint.getUserId());
        assertEquals("user" + USER_ID, complaint.getUsername());
        assertEquals(BATCH, complaint.getBatch());
        assertEquals(SUBJECT, complaint.getSubject());
        assertEquals(LECTURE, complaint.getLectureName());
        assertEquals("large", complaint.getPhotoReference());
        assertEquals(ComplaintStatus.SUBMITTED, complaint.getStatus());
        assertEquals(DomainFixture.NOW, complaint.getCreatedAt());

        assertTrue(messenger.lastTextTo(USER_ID).html().contains("complaint_" + complaint.getId()));

        assertEquals(List.of(new RecordingMessenger.SentPhoto(REVIEWER_ID, "large")), messenger.photos);
        RecordingMessenger.SentText summary = messenger.lastTextTo(REVIEWER_ID);
        assertTrue(summary.html().contains("Lecture Name: " + LECTURE));
        assertTrue(summary.html().contains("@user" + USER_ID));
        List<String> statusButtons = summary.keyboard().buttons().stream().map(KeyboardButton::callbackData).toList();
        assertEquals(List.of(
                "status:" + complaint.getId() + ":send",
                "status:" + complaint.getId() + ":seen",
                "status:" + complaint.getId() + ":approved",
                "status:" + complaint.getId() + ":resolved"), statusButtons);
        assertEquals(2, summary.keyboard().rows().size());
    }

    @Test
    void shouldKeepComplaintWhenReviewerIsUnreachable() {
        messenger.failFor(REVIEWER_ID);

        long id = fixture.submit(USER_ID, BATCH, SUBJECT, LECTURE, "shot");

        assertTrue(fixture.complaintStore.get(id).isPresent());
        assertTrue(fixture.draftStore.get(USER_ID).isEmpty());
        assertTrue(messenger.lastTextTo(USER_ID).html().contains("submitted successfully"));
    }

    @Test
    void shouldIgnorePhotoWithoutDraft() {
        ConversationResult result = service.handle(photo(USER_ID, fullSize("orphan")));

        assertEquals(ConversationOutcome.IGNORED, result.outcome());
        assertEquals(ConversationStep.TERMINAL, result.step());
        assertEquals(0, fixture.complaintStore.count());
        assertTrue(messenger.texts.isEmpty());
    }

    // ===== cancel =====

    @Test
    void shouldCancelDraftWithoutCreatingComplaint() {
        advanceToLectureName(USER_ID);

        ConversationResult result = service.cancel(command(USER_ID, "cancel"));

        assertEquals(ConversationOutcome.CANCELLED, result.outcome());
        assertEquals(ConversationStep.TERMINAL, service.currentStep(USER_ID));
        assertEquals(0, fixture.complaintStore.count());
        assertTrue(messenger.lastTextTo(USER_ID).html().contains("cancelled"));
    }

    // ===== isolation and ids =====

    @Test
    void shouldKeepUsersIsolated() {
        advanceToLectureName(USER_ID);
        service.start(command(OTHER_USER_ID, "start"));

        service.handle(text(USER_ID, LECTURE));

        assertEquals(ConversationStep.AWAITING_PHOTO, service.currentStep(USER_ID));
        assertEquals(ConversationStep.AWAITING_BATCH, service.currentStep(OTHER_USER_ID));
        assertNull(draft(OTHER_USER_ID).getLectureName());
    }

    @Test
    void shouldIssueStrictlyIncreasingIds() {
        long first = fixture.submit(USER_ID, BATCH, SUBJECT, "Lecture 1", "a");
        long second = fixture.submit(OTHER_USER_ID, "master quest 2026", "VARC",
                "Lecture 2", "b");
        long third = fixture.submit(USER_ID, BATCH, "DILR", "Lecture 3", "c");

        assertTrue(first < second);
        assertTrue(second < third);
        assertEquals(3, fixture.complaintStore.count());
        assertFalse(fixture.complaintStore.get(third + 1).isPresent());
    }
}
