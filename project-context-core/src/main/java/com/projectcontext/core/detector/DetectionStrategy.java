package com.projectcontext.core.detector;

import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionMethod;
import com.projectcontext.core.model.Registry;

import java.io.IOException;
import java.util.List;

/**
 * One independent way of guessing which project an operation belongs to.
 *
 * <p>Strategies are stateless and read-only: they inspect the context and the
 * registry snapshot, and may read the filesystem, but never write anything.
 * A strategy that finds nothing returns an empty list. A strategy that throws is
 * treated by the {@link Detector} as having abstained.
 */
public interface DetectionStrategy {

    /**
     * Returns the method tag attached to every candidate this strategy emits.
     *
     * @return detection method
     */
    DetectionMethod getMethod();

    /**
     * Produces candidates for the given context.
     *
     * @param context operation signals
     * @param registry registry snapshot
     * @return candidates, possibly empty
     * @throws IOException if the filesystem cannot be inspected
     */
    List<DetectionCandidate> detect(DetectionContext context, Registry registry) throws IOException;
}
