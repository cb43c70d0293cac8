package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.model.RelayMessage;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PeerConnection} backed by a Netty {@link Channel}.
 *
 * <p>Outbound messages are handed to the pipeline, which frames and encodes
 * them. A failed write closes the channel, so the failure surfaces as a
 * close notification on the connection listener.</p>
 */
final class NettyPeerConnection implements PeerConnection
{
    private final Channel channel;
    private final Role role;
    private final Instant connectedAt;

    private volatile String agentId;

    NettyPeerConnection(Channel channel, Role role, Instant connectedAt)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.role = Objects.requireNonNull(role, "role");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
    }

    @Override
    public Role role()
    {
        return role;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public Instant connectedAt()
    {
        return connectedAt;
    }

    @Override
    public Optional<String> agentId()
    {
        return Optional.ofNullable(agentId);
    }

    @Override
    public void identify(String agentId)
    {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
    }

    @Override
    public boolean isAlive()
    {
        return channel.isActive();
    }

    @Override
    public void send(RelayMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!channel.isActive()) {
            throw new ConnectionLostException(role.wireName() + " connection to " + channel.remoteAddress() + " is closed");
        }
        channel.writeAndFlush(message).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return role.wireName() + "@" + channel.remoteAddress()
                + (agentId == null ? "" : "(" + agentId + ")");
    }
}
