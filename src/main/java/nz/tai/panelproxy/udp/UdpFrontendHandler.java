package nz.tai.panelproxy.udp;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import nz.tai.panelproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * UDP frontend handler that receives datagrams from clients and forwards them to the backend.
 *
 * <p>For each unique client address, a dedicated backend {@link DatagramChannel} is created
 * lazily and tracked by {@link UdpSessionManager}, so that backend replies can be sent back to
 * the right client.
 *
 * <p>Thread safety: runs on the listening channel's event loop. Session lookups and
 * registrations go through the thread-safe {@link UdpSessionManager}.
 */
public final class UdpFrontendHandler extends SimpleChannelInboundHandler<DatagramPacket> {
    private static final Logger logger = LoggerFactory.getLogger(UdpFrontendHandler.class);

    private final RouteTable routes;
    private final UdpSessionManager sessionManager;

    public UdpFrontendHandler(RouteTable routes, UdpSessionManager sessionManager) {
        this.routes = routes;
        this.sessionManager = sessionManager;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        var clientAddr = packet.sender();

        var session = sessionManager.getSession(clientAddr);
        if (session == null) {
            session = createSession(ctx.channel(), clientAddr);
            if (session == null) {
                return;
            }
        }

        sessionManager.touch(session);
        forwardToBackend(session, packet.content());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("[UDP Frontend] Exception: {}", cause.getMessage(), cause);
    }

    /**
     * Binds a fresh backend socket for {@code clientAddr}. Returns null when no backend is
     * configured.
     */
    private UdpSession createSession(Channel proxyChannel, InetSocketAddress clientAddr) {
        var route = routes.backend();
        if (route.isEmpty()) {
            logger.debug("[UDP] No backend configured, dropping datagram from {}", clientAddr);
            return null;
        }

        var backendAddr = new InetSocketAddress(route.get().backendHost(), route.get().backendPort());
        if (backendAddr.isUnresolved()) {
            logger.error("[UDP] Failed to resolve backend {} for client {}",
                    route.get().backendAddress(), clientAddr);
            return null;
        }

        var bootstrap = new Bootstrap();
        bootstrap.group(proxyChannel.eventLoop())
                .channel(NioDatagramChannel.class)
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch) {
                        ch.pipeline().addLast("udpBackend",
                                new UdpBackendHandler(proxyChannel, sessionManager));
                    }
                });

        var bindFuture = bootstrap.bind(0);
        var session = sessionManager.register(clientAddr, bindFuture, backendAddr);

        bindFuture.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                logger.debug("[UDP] Session created: {} -> {}", clientAddr, backendAddr);
            } else {
                logger.error("[UDP] Failed to create backend socket for client {}: {}",
                        clientAddr, future.cause().getMessage());
                sessionManager.removeSession(session);
            }
        });
        return session;
    }

    /**
     * Sends a datagram through the session's backend socket once it is bound.
     */
    private void forwardToBackend(UdpSession session, ByteBuf content) {
        ByteBuf contentCopy = content.retainedDuplicate();
        session.bindFuture().addListener((ChannelFutureListener) bound -> {
            if (!bound.isSuccess()) {
                contentCopy.release();
                return;
            }
            bound.channel().writeAndFlush(new DatagramPacket(contentCopy, session.backendAddress()))
                    .addListener((ChannelFutureListener) future -> {
                        if (!future.isSuccess()) {
                            logger.error("[UDP] Failed to forward datagram from {} to backend: {}",
                                    session.clientAddress(), future.cause().getMessage());
                            sessionManager.removeSession(session);
                        }
                    });
        });
    }
}
