package com.esplanada.api.validation;

import com.esplanada.api.rating.RatingSubmission;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Temporal bounds of the submission and spam patterns in the comment.
 */
public class BusinessRulesStage implements ValidationStage {

    static final Duration CLOCK_SKEW = Duration.ofMinutes(1);
    static final Duration MAX_AGE = Duration.ofDays(30);
    private static final int SHOUTING_MIN_LETTERS = 10;

    private static final List<Pattern> SPAM_PATTERNS = List.of(
            Pattern.compile("(.)\\1{5,}"),
            Pattern.compile("(?:http|www)\\S+", Pattern.CASE_INSENSITIVE));

    @Override
    public String name() {
        return "BusinessRules";
    }

    @Override
    public Optional<Rejection> check(ValidationContext context) {
        RatingSubmission submission = context.submission();
        Instant now = context.now();
        Instant submittedAt = submission.submittedAt() != null ? submission.submittedAt() : now;

        if (submittedAt.isAfter(now.plus(CLOCK_SKEW))) {
            return Optional.of(Rejection.invalidFormat("Rating date cannot be in the future"));
        }
        if (submittedAt.isBefore(now.minus(MAX_AGE))) {
            return Optional.of(Rejection.invalidFormat("Rating date is too old (more than 30 days)"));
        }

        String comment = submission.comment();
        if (comment != null && isSpam(comment)) {
            return Optional.of(Rejection.invalidFormat("Comment contains suspicious patterns"));
        }
        return Optional.empty();
    }

    static boolean isSpam(String comment) {
        for (Pattern pattern : SPAM_PATTERNS) {
            if (pattern.matcher(comment).find()) {
                return true;
            }
        }
        return isShouting(comment);
    }

    private static boolean isShouting(String comment) {
        int letters = 0;
        for (int i = 0; i < comment.length(); i++) {
            char c = comment.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                letters++;
            }
        }
        return letters >= SHOUTING_MIN_LETTERS;
    }
}
