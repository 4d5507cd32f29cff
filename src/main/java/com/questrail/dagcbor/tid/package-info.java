/**
 * Timestamp identifiers used as record keys.
 *
 * <p>{@link com.questrail.dagcbor.tid.Tid} is the value type;
 * {@link com.questrail.dagcbor.tid.TidClock} issues them in strictly
 * increasing order.</p>
 */
package com.questrail.dagcbor.tid;
