package com.esplanada.api.validation;

import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.core.domain.Subject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FormatCheckStageTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String IDENTITY = "identity-abc";

    private final Map<String, Subject> subjects = Map.of(
            "S1", Subject.create("S1", "Pastelaria Aurora", NOW.minusSeconds(3600)));

    private final FormatCheckStage stage = new FormatCheckStage(id -> Optional.ofNullable(subjects.get(id)));

    private ValidationContext context(String subjectId, String identity, Integer score, String comment,
                                      List<String> photoRefs) {
        return new ValidationContext(
                new RatingSubmission(subjectId, identity, score, comment, photoRefs, null),
                ClientMeta.unknown(), NOW);
    }

    private Optional<Rejection> check(ValidationContext context) {
        return stage.check(context);
    }

    private static void assertInvalidFormat(Optional<Rejection> rejection) {
        assertThat(rejection).isPresent();
        assertThat(rejection.get().kind()).isEqualTo(ErrorKind.INVALID_FORMAT);
    }

    @Test
    void wellFormedSubmissionPassesAndResolvesSubject() {
        ValidationContext context = context("S1", IDENTITY, 4, "c".repeat(500), List.of("photos/a.jpg", "photos/b.jpg"));

        assertThat(check(context)).isEmpty();
        assertThat(context.subject().getId()).isEqualTo("S1");
    }

    @Test
    void commentOverFiveHundredCharactersIsRejected() {
        Optional<Rejection> rejection = check(context("S1", IDENTITY, 4, "c".repeat(501), null));

        assertInvalidFormat(rejection);
        assertThat(rejection.get().message()).contains("500");
    }

    @Test
    void moreThanTwoPhotosIsRejected() {
        Optional<Rejection> rejection = check(
                context("S1", IDENTITY, 4, null, List.of("photos/a.jpg", "photos/b.jpg", "photos/c.jpg")));

        assertInvalidFormat(rejection);
        assertThat(rejection.get().message()).contains("2 photos");
    }

    @Test
    void nullOrBlankPhotoReferenceIsRejected() {
        assertInvalidFormat(check(context("S1", IDENTITY, 4, null, Arrays.asList("photos/a.jpg", null))));
        assertInvalidFormat(check(context("S1", IDENTITY, 4, null, List.of(" "))));
        assertInvalidFormat(check(context("S1", IDENTITY, 4, null, List.of("p".repeat(501)))));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1, 100})
    void outOfRangeScoreIsRejected(int score) {
        assertInvalidFormat(check(context("S1", IDENTITY, score, null, null)));
    }

    @Test
    void missingScoreIsRejected() {
        assertInvalidFormat(check(context("S1", IDENTITY, null, null, null)));
    }

    @Test
    void missingIdentityIsUnavailableAndShortIdentityIsMalformed() {
        assertThat(check(context("S1", null, 4, null, null))).get()
                .extracting(Rejection::kind).isEqualTo(ErrorKind.IDENTITY_UNAVAILABLE);
        assertInvalidFormat(check(context("S1", "short", 4, null, null)));
    }

    @Test
    void unknownOrOversizedSubjectIsRejected() {
        ValidationContext unknown = context("S2", IDENTITY, 4, null, null);

        assertInvalidFormat(check(unknown));
        assertThat(unknown.subject()).isNull();
        assertInvalidFormat(check(context("s".repeat(101), IDENTITY, 4, null, null)));
        assertInvalidFormat(check(context(" ", IDENTITY, 4, null, null)));
    }
}
