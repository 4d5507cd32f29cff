package com.questrail.dagcbor.codec.netty;

import com.questrail.dagcbor.codec.DagCborConfig;
import com.questrail.dagcbor.codec.DagCborDecodeException;
import com.questrail.dagcbor.codec.DagCborDecoder;
import com.questrail.dagcbor.codec.DagCborEncoder;
import com.questrail.dagcbor.codec.impl.DefaultDagCborDecoder;
import com.questrail.dagcbor.codec.impl.DefaultDagCborEncoder;
import com.questrail.dagcbor.model.DagMap;
import com.questrail.dagcbor.model.DagValue;
import com.questrail.dagcbor.observability.DecodeRejectedEvent;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;
import java.util.Objects;

/**
 * DagCborMessageCodec
 * =============================================================================
 * Netty pipeline adapter between {@link ByteBuf}s and {@link DagMap} documents.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. Each inbound
 * {@code ByteBuf} must hold exactly one complete document: buffers are not
 * accumulated across reads, so place a framing decoder (for example
 * {@code LengthFieldBasedFrameDecoder}) ahead of this handler on stream
 * transports.
 *
 * <ul>
 *   <li>Inbound: the buffer is copied and decoded; the root must be a map and
 *       no bytes may follow it. Failures propagate down the pipeline as a
 *       {@link io.netty.handler.codec.DecoderException} whose cause is the
 *       {@link DagCborDecodeException}.</li>
 *   <li>Outbound: a {@code DagMap} is encoded into a new unpooled buffer.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. The codec ports underneath work on
 * {@code byte[]} only.
 *
 * <p>Inbound buffers are released by the superclass.</p>
 */
@ChannelHandler.Sharable
public final class DagCborMessageCodec extends MessageToMessageCodec<ByteBuf, DagMap>
{
    private final DagCborConfig config;
    private final DagCborEncoder encoder;
    private final DagCborDecoder decoder;

    public DagCborMessageCodec()
    {
        this(DagCborConfig.defaults());
    }

    public DagCborMessageCodec(DagCborConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = new DefaultDagCborEncoder(config);
        this.decoder = new DefaultDagCborDecoder(config);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, DagMap msg, List<Object> out)
    {
        out.add(Unpooled.wrappedBuffer(encoder.encode(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out)
    {
        final byte[] bytes = ByteBufUtil.getBytes(msg);
        final DagValue value = decoder.decode(bytes);

        if (!(value instanceof DagMap map)) {
            DagCborDecodeException e = new DagCborDecodeException(
                    DagCborDecodeException.Kind.SEMANTIC,
                    "Document root must be a map, found " + value.kind(),
                    0, "$", new byte[0]);
            config.observabilitySink().onDecodeRejected(DecodeRejectedEvent.of(config.wallClock().now(), e));
            throw e;
        }
        out.add(map);
    }
}
