package com.esplanada.api.suspicious;

import com.esplanada.api.EsplanadaApiApplication;
import com.esplanada.api.config.MutableClock;
import com.esplanada.api.config.TestClockConfiguration;
import com.esplanada.api.rating.RatingService;
import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.rating.SubmissionResult;
import com.esplanada.api.subject.SubjectService;
import com.esplanada.api.validation.ErrorKind;
import com.esplanada.core.domain.SecurityEvent;
import com.esplanada.core.domain.SecurityEvent.EventType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = EsplanadaApiApplication.class)
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class SuspiciousActivityDetectorTest {

    private static final ClientMeta BROWSER = new ClientMeta("Mozilla/5.0 (Macintosh) Safari/605.1.15", "10.0.0.7");

    @Autowired
    private RatingService ratingService;

    @Autowired
    private SubjectService subjectService;

    @Autowired
    private SecurityEventLog securityEventLog;

    @Autowired
    private SuspiciousActivityDetector detector;

    @Autowired
    private MutableClock clock;

    private String newSubject(boolean settle) {
        String id = "s-" + UUID.randomUUID();
        subjectService.register("owner-" + UUID.randomUUID(), id, "Cervejaria");
        if (settle) {
            clock.advance(Duration.ofSeconds(2));
        }
        return id;
    }

    private SubmissionResult submit(String subjectId, String identity, ClientMeta meta) {
        return ratingService.submitRating(new RatingSubmission(subjectId, identity, 4, null, null, null), meta);
    }

    @Test
    void automationUserAgentIsRejectedAndLogged() {
        String subject = newSubject(true);
        String identity = "fp-" + UUID.randomUUID();

        SubmissionResult result = submit(subject, identity,
                new ClientMeta("Mozilla/5.0 HeadlessChrome/124.0 Puppeteer", "10.0.0.8"));

        assertThat(result.accepted()).isFalse();
        assertThat(result.rejection().kind()).isEqualTo(ErrorKind.SUSPICIOUS_ACTIVITY);
        assertThat(result.rejection().message()).doesNotContain("Puppeteer");

        List<SecurityEvent> events = securityEventLog.forSubject(subject);
        assertThat(events).hasSize(1);
        SecurityEvent event = events.get(0);
        assertThat(event.getEventType()).isEqualTo(EventType.SUSPICIOUS_USER_AGENT);
        assertThat(event.getIdentityPrefix()).isEqualTo(identity.substring(0, 10));
        assertThat(event.getUserAgent()).contains("HeadlessChrome");
    }

    @Test
    void voteRightAfterRegistrationIsPreSeeded() {
        String subject = newSubject(false);

        SubmissionResult result = submit(subject, "fp-" + UUID.randomUUID(), BROWSER);

        assertThat(result.rejection().kind()).isEqualTo(ErrorKind.SUSPICIOUS_ACTIVITY);
        assertThat(securityEventLog.forSubject(subject))
                .extracting(SecurityEvent::getEventType)
                .containsExactly(EventType.PRE_SEEDED_VOTE);
    }

    @Test
    void rapidSubmissionsFromOneIdentityAreFlagged() {
        String first = newSubject(false);
        String second = newSubject(true);
        String identity = "fp-" + UUID.randomUUID();

        assertThat(submit(first, identity, BROWSER).accepted()).isTrue();
        clock.advance(Duration.ofMillis(300));
        SubmissionResult rapid = submit(second, identity, BROWSER);

        assertThat(rapid.rejection().kind()).isEqualTo(ErrorKind.SUSPICIOUS_ACTIVITY);
        assertThat(securityEventLog.forSubject(second))
                .extracting(SecurityEvent::getEventType)
                .containsExactly(EventType.RAPID_SUBMISSION);

        clock.advance(Duration.ofSeconds(2));
        String third = newSubject(true);
        assertThat(submit(third, identity, BROWSER).accepted()).isTrue();
    }

    @Test
    void assessOnlyClassifiesWhileEvaluateRecords() {
        String subject = newSubject(true);
        RatingSubmission submission = new RatingSubmission(subject, "fp-" + UUID.randomUUID(), 4, null, null, null);
        ClientMeta crawler = new ClientMeta("Googlebot/2.1 (+http://www.google.com/bot.html)", "10.0.0.9");

        SuspicionVerdict assessed = detector.assess(submission, crawler, null);
        assertThat(assessed.flagged()).isTrue();
        assertThat(securityEventLog.forSubject(subject)).isEmpty();

        SuspicionVerdict evaluated = detector.evaluate(submission, crawler);
        assertThat(evaluated.eventType()).isEqualTo(EventType.SUSPICIOUS_USER_AGENT);
        assertThat(securityEventLog.forSubject(subject))
                .extracting(SecurityEvent::getEventType)
                .containsExactly(EventType.SUSPICIOUS_USER_AGENT);
    }

    @Test
    void eventChainVerifies() {
        for (int i = 0; i < 3; i++) {
            securityEventLog.record(EventType.VALIDATION_ERROR, "tamper check " + i, "chain-subject",
                    "fp-" + UUID.randomUUID(), ClientMeta.unknown());
            clock.advance(Duration.ofMillis(5));
        }

        SecurityEventLog.ChainVerificationResult result = securityEventLog.verifyChain();

        assertThat(result.valid()).isTrue();
        assertThat(result.eventCount()).isGreaterThanOrEqualTo(3);
        assertThat(securityEventLog.forSubject("chain-subject")).hasSize(3);
    }

    @Test
    void shortIdentitiesAreNotPadded() {
        assertThat(SecurityEventLog.maskIdentity(null)).isNull();
        assertThat(SecurityEventLog.maskIdentity("abc")).isEqualTo("abc");
        assertThat(SecurityEventLog.maskIdentity("0123456789abcdef")).isEqualTo("0123456789");
    }
}
