package com.questrail.dagcbor.codec.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.questrail.dagcbor.cid.Cid;
import com.questrail.dagcbor.cid.CidFormatException;
import com.questrail.dagcbor.model.DagLink;

import java.io.IOException;

/**
 * Reads a {@link DagLink} from {@code {"$link": "<cid text>"}}.
 *
 * <p>The CID text is parsed, so a link that deserializes is always a valid CID.
 * Other members of the object are ignored.</p>
 */
final class DagLinkJsonDeserializer extends StdDeserializer<DagLink>
{
    private static final long serialVersionUID = -6185392047721180533L;

    DagLinkJsonDeserializer() {
        super(DagLink.class);
    }

    @Override
    public DagLink deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonNode node = p.readValueAsTree();
        final JsonNode link = (node != null && node.isObject()) ? node.get(DagCborJsonModule.LINK_FIELD) : null;
        if (link == null || !link.isTextual()) {
            throw MismatchedInputException.from(p, DagLink.class,
                    "Expecting an object with a text \"" + DagCborJsonModule.LINK_FIELD + "\" member");
        }

        final String text = link.textValue();
        try {
            return new DagLink(Cid.parse(text));
        } catch (CidFormatException e) {
            InvalidFormatException ex = new InvalidFormatException(p,
                    "Invalid CID in link (" + e.failure() + "): " + e.getMessage(), text, DagLink.class);
            ex.initCause(e);
            throw ex;
        }
    }
}
