package io.stsguard.model;

import java.time.Instant;

public record PhaseMark(
        Phase phase,
        Instant at,
        String detail
) {
}
