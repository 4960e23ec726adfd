package com.projectcontext.core.safeguard;

import com.projectcontext.core.model.ConfirmationResponse;

/**
 * Caller-supplied confirmation, typically a human yes/no prompt.
 *
 * <p>The safeguard runs the callback on a worker thread and bounds it with its
 * own timeout, so implementations may block. Returning {@code null} or throwing
 * counts as a refusal.
 */
@FunctionalInterface
public interface ConfirmationCallback {

    /**
     * Asks for confirmation.
     *
     * @param request what to confirm
     * @return YES to proceed, NO or TIMEOUT to block
     * @throws Exception if the answer cannot be obtained
     */
    ConfirmationResponse confirm(ConfirmationRequest request) throws Exception;

    /**
     * Callback that always answers {@code response}.
     *
     * @param response fixed answer
     * @return callback
     */
    static ConfirmationCallback always(ConfirmationResponse response) {
        return request -> response;
    }
}
