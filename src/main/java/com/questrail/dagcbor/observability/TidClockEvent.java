package com.questrail.dagcbor.observability;

/**
 * Record representing a TID clock reading that had to be moved forward to keep
 * issued identifiers strictly increasing.
 *
 * @param clockId         the clock's 10-bit identifier
 * @param observedMicros  what the time source reported
 * @param issuedMicros    what the clock issued instead (last issued + 1)
 */
public record TidClockEvent(
    int clockId,
    long observedMicros,
    long issuedMicros
) {
    /**
     * Microseconds the issued value runs ahead of the time source.
     */
    public long skewMicros() {
        return issuedMicros - observedMicros;
    }
}
