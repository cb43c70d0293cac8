package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.codec.MessageCodec;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.ConnectionListener;
import com.questrail.telerelay.transport.PeerConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyPeerConnector
 * =============================================================================
 * Netty-backed implementation of the agent-side {@link PeerConnector} port.
 *
 * <p>Uses the same framing pipeline as the relay. Listener callbacks run on
 * the channel's event loop; agent listeners must not block.</p>
 *
 * <p>One connector may open any number of successive connections; the event
 * loop group lives until {@link #shutdown()}.</p>
 */
public final class NettyPeerConnector implements PeerConnector
{
    private final Role role;
    private final InetSocketAddress remoteAddress;
    private final MessageCodec codec;
    private final int maxFrameLength;
    private final Duration connectTimeout;
    private final WallClock clock;

    private final EventLoopGroup group;

    public NettyPeerConnector(Role role,
                              InetSocketAddress remoteAddress,
                              MessageCodec codec,
                              int maxFrameLength,
                              Duration connectTimeout,
                              WallClock clock)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        this.maxFrameLength = maxFrameLength;
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public PeerConnection connect(ConnectionListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyPeerConnection connection = new NettyPeerConnection(ch, role, clock.now());
                        PeerPipeline.install(ch.pipeline(), codec, maxFrameLength, null,
                                new ConnectionDispatchHandler(connection, listener));
                    }
                });

        ChannelFuture f = bootstrap.connect(remoteAddress);
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            throw new ConnectionLostException("Interrupted while connecting to " + remoteAddress, e);
        }
        if (!f.isSuccess()) {
            throw new ConnectionLostException("Could not connect to relay at " + remoteAddress, f.cause());
        }

        ConnectionDispatchHandler dispatcher = f.channel().pipeline().get(ConnectionDispatchHandler.class);
        if (dispatcher == null) {
            // Closed between connect and lookup; the pipeline is already torn down.
            throw new ConnectionLostException("Connection to " + remoteAddress + " closed during setup");
        }
        return dispatcher.connection();
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully();
    }
}
