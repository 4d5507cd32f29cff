package com.questrail.dagcbor.model;

import com.questrail.dagcbor.cid.Cid;

import java.util.Objects;

/**
 * Link to another stored value, encoded as tag 42 over the CID bytes.
 *
 * <p>On the wire the tagged byte string is the reserved {@code 0x00} multibase
 * prefix followed by {@link Cid#bytes()}.</p>
 */
public record DagLink(Cid cid) implements DagValue
{
    public DagLink {
        Objects.requireNonNull(cid, "cid");
    }

    public static DagLink to(Cid cid) {
        return new DagLink(cid);
    }

    @Override
    public String kind() {
        return "link";
    }

    @Override
    public String toString() {
        return "link(" + cid + ")";
    }
}
