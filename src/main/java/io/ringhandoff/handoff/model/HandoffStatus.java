package io.ringhandoff.handoff.model;

import java.util.Map;

/**
 * Point-in-time view of one tracked handoff session.
 *
 * @param status progress reported by the transfer unit; opaque to the manager
 */
public record HandoffStatus(HandoffId id,
                            Direction direction,
                            SessionState state,
                            Map<String, Object> status) {
}
