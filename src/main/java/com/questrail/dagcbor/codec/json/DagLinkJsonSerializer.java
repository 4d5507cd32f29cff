package com.questrail.dagcbor.codec.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.questrail.dagcbor.model.DagLink;

import java.io.IOException;

/**
 * Writes a {@link DagLink} as {@code {"$link": "<cid text>"}}.
 */
final class DagLinkJsonSerializer extends StdSerializer<DagLink>
{
    private static final long serialVersionUID = 3471207761035584016L;

    DagLinkJsonSerializer() {
        super(DagLink.class);
    }

    @Override
    public void serialize(DagLink value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(DagCborJsonModule.LINK_FIELD, value.cid().toString());
        gen.writeEndObject();
    }
}
