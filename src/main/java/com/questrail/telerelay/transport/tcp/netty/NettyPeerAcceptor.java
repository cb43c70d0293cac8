package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.protocol.codec.MessageCodec;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.PeerAcceptor;
import com.questrail.telerelay.transport.PeerAcceptorListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyPeerAcceptor
 * =============================================================================
 * Netty-backed implementation of the {@link PeerAcceptor} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Interpret the handshake or any other message</li>
 *   <li>Decide which connection is current for its role</li>
 *   <li>Schedule timeouts or session actions</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Listeners only see
 * {@link com.questrail.telerelay.core.peer.PeerConnection} handles and decoded
 * messages.
 *
 * <h2>Threading</h2>
 * Socket I/O runs on a dedicated {@link NioEventLoopGroup}. Listener callbacks
 * run on a separate {@link DefaultEventExecutorGroup}: a listener that blocks
 * (the relay cycle waits for an acknowledgement) stalls only its own
 * connection, never the I/O loop that carries the acknowledgement. Each
 * channel is pinned to one dispatch thread, so its callbacks stay ordered.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket, blocking until bound.
 * - {@link #stop()} closes the listening socket and every accepted channel,
 *   then shuts the groups down.
 */
public final class NettyPeerAcceptor implements PeerAcceptor
{
    private static final Logger log = LoggerFactory.getLogger(NettyPeerAcceptor.class);

    private final Role role;
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutorGroup dispatchGroup;
    private final ChannelGroup acceptedChannels;
    private final ServerBootstrap bootstrap;

    private volatile PeerAcceptorListener listener;
    private volatile Channel serverChannel;

    public NettyPeerAcceptor(Role role,
                             InetSocketAddress bindAddress,
                             MessageCodec codec,
                             int maxFrameLength,
                             int dispatchThreads,
                             WallClock clock)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(clock, "clock");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        if (dispatchThreads <= 0) {
            throw new IllegalArgumentException("dispatchThreads must be > 0");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.dispatchGroup = new DefaultEventExecutorGroup(dispatchThreads);
        this.acceptedChannels = new DefaultChannelGroup(role.wireName() + "-peers", GlobalEventExecutor.INSTANCE);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        acceptedChannels.add(ch);
                        NettyPeerConnection connection = new NettyPeerConnection(ch, role, clock.now());
                        PeerPipeline.install(ch.pipeline(), codec, maxFrameLength, dispatchGroup,
                                new ConnectionDispatchHandler(connection, requireListener()));
                    }
                });
    }

    @Override
    public Role role()
    {
        return role;
    }

    @Override
    public void setListener(PeerAcceptorListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            throw new IllegalStateException("Interrupted while binding " + role.wireName() + " listener", e);
        }
        if (!f.isSuccess()) {
            throw new IllegalStateException(
                    "Could not bind " + role.wireName() + " listener to " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Listening for {} agents on {}", role.wireName(), serverChannel.localAddress());
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        acceptedChannels.close().awaitUninterruptibly();

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        dispatchGroup.shutdownGracefully();
    }

    @Override
    public Optional<SocketAddress> localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    private PeerAcceptorListener requireListener()
    {
        PeerAcceptorListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PeerAcceptorListener must be set before start()");
        }
        return l;
    }
}
