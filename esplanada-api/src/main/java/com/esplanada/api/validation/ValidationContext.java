package com.esplanada.api.validation;

import com.esplanada.api.duplicate.DuplicateResolution;
import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.api.suspicious.SuspicionVerdict;
import com.esplanada.core.domain.Subject;

import java.time.Instant;

/**
 * State carried through the stages of one validation run.
 */
public class ValidationContext {

    private final RatingSubmission submission;
    private final ClientMeta meta;
    private final Instant now;
    private Subject subject;
    private DuplicateResolution resolution;
    private SuspicionVerdict suspicion;

    public ValidationContext(RatingSubmission submission, ClientMeta meta, Instant now) {
        this.submission = submission;
        this.meta = meta != null ? meta : ClientMeta.unknown();
        this.now = now;
    }

    public RatingSubmission submission() { return submission; }
    public ClientMeta meta() { return meta; }
    public Instant now() { return now; }
    public Subject subject() { return subject; }
    public DuplicateResolution resolution() { return resolution; }
    public SuspicionVerdict suspicion() { return suspicion; }

    void setSubject(Subject subject) { this.subject = subject; }
    void setResolution(DuplicateResolution resolution) { this.resolution = resolution; }
    void setSuspicion(SuspicionVerdict suspicion) { this.suspicion = suspicion; }
}
