package com.esmp.message;

import com.esmp.envelope.Address;

import java.util.List;
import java.util.Set;

/**
 * Outcome of an accepted envelope.
 *
 * @param positions  one entry per thread the envelope was appended to; empty for profile updates
 * @param recipients addresses the envelope is meant for (members of the group for group threads)
 */
public record Acceptance(List<LogPosition> positions, Set<Address> recipients) {

    public Acceptance {
        positions = List.copyOf(positions);
        recipients = Set.copyOf(recipients);
    }
}
