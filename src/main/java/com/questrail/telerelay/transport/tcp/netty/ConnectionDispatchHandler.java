package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.protocol.model.RelayMessage;
import com.questrail.telerelay.transport.ConnectionListener;
import com.questrail.telerelay.transport.PeerAcceptorListener;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;

import java.util.Objects;

/**
 * ConnectionDispatchHandler
 * -------------------------------------------------------------------------
 * Last handler of every peer pipeline. Delivers decoded messages and the
 * close notification to the {@link ConnectionListener}.
 *
 * <p>The first exception seen on the channel is kept and reported as the
 * close cause; the channel is closed immediately. Codec failures are
 * unwrapped from Netty's {@link DecoderException} so listeners only see
 * relay exception types.</p>
 */
final class ConnectionDispatchHandler extends SimpleChannelInboundHandler<RelayMessage>
{
    private final NettyPeerConnection connection;
    private final ConnectionListener listener;

    private Throwable closeCause;

    ConnectionDispatchHandler(NettyPeerConnection connection, ConnectionListener listener)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    NettyPeerConnection connection()
    {
        return connection;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        if (listener instanceof PeerAcceptorListener acceptorListener) {
            acceptorListener.onAccepted(connection);
        }
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RelayMessage message)
    {
        if (closeCause != null) {
            return;
        }
        listener.onMessage(connection, message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        listener.onClosed(connection, closeCause);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        if (closeCause == null) {
            closeCause = unwrap(cause);
        }
        ctx.close();
    }

    static Throwable unwrap(Throwable cause)
    {
        if (cause instanceof DecoderException && cause.getCause() != null) {
            return cause.getCause();
        }
        return cause;
    }
}
