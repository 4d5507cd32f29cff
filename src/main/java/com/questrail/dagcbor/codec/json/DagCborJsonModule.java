package com.questrail.dagcbor.codec.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.questrail.dagcbor.model.DagLink;

/**
 * Jackson module mapping {@link DagLink} to and from its JSON form,
 * {@code {"$link": "<cid text>"}}.
 *
 * <pre>{@code
 * ObjectMapper mapper = DagCborJsonModule.newMapper();
 * String json = mapper.writeValueAsString(DagCbor.link(document));
 * }</pre>
 */
public final class DagCborJsonModule extends SimpleModule
{
    private static final long serialVersionUID = 8830551290366715042L;

    public static final String LINK_FIELD = "$link";

    public DagCborJsonModule() {
        super("dag-cbor-json");
        addSerializer(DagLink.class, new DagLinkJsonSerializer());
        addDeserializer(DagLink.class, new DagLinkJsonDeserializer());
    }

    /**
     * Returns a plain {@link ObjectMapper} with this module registered.
     */
    public static ObjectMapper newMapper() {
        return new ObjectMapper().registerModule(new DagCborJsonModule());
    }
}
