package com.regatta.progression;

import java.util.UUID;

/**
 * A registered single or crew as it sits in a lane: the entry plus the primary
 * athlete and club the result is credited to.
 */
public record Entrant(
        UUID entryId,
        UUID athleteId,
        UUID clubId
) {
}
