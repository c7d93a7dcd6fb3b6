package com.esplanada.api.duplicate;

import com.esplanada.core.domain.RatingRecord;
import com.esplanada.core.repository.RatingRecordRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Looks up active ratings through the unique active key.
 */
@Component
public class RepositoryActiveRatingLookup implements ActiveRatingLookup {

    private final RatingRecordRepository ratingRecordRepository;

    public RepositoryActiveRatingLookup(RatingRecordRepository ratingRecordRepository) {
        this.ratingRecordRepository = ratingRecordRepository;
    }

    @Override
    public Optional<ActiveRating> findActive(String identityDigest, String subjectId) {
        return ratingRecordRepository.findByActiveKey(RatingRecord.activeKeyOf(identityDigest, subjectId))
                .map(r -> new ActiveRating(r.getId(), r.getScore(), r.getAcceptedAt()));
    }
}
