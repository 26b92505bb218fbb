package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.transport.DriverChannelException;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * NettyDriverServer
 * =============================================================================
 * Serves a {@link DriverService} on a loopback TCP endpoint.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It decodes
 * {@link DriverRequest}s, hands each one to the service and writes the
 * {@link DriverReply}. It MUST NOT interpret payment results.
 *
 * <h2>Dispatch</h2>
 * Every request runs as its own task on the worker executor. A pay call
 * blocks for as long as the customer takes at the terminal; the event loop
 * never waits for it.
 *
 * <h2>Endpoint scoping</h2>
 * Requests addressed to another endpoint name are answered with a failure
 * reply and never reach the service.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 */
public final class NettyDriverServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyDriverServer.class);

    private final DriverEndpoint endpoint;
    private final DriverService service;
    private final ExecutorService workers;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup ioGroup;
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;

    public NettyDriverServer(DriverEndpoint endpoint, DriverService service, ExecutorService workers)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.service = Objects.requireNonNull(service, "service");
        this.workers = Objects.requireNonNull(workers, "workers");

        this.bossGroup = new NioEventLoopGroup(1);
        this.ioGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        DriverPipeline.install(ch.pipeline(), DriverRequest.class, DriverReply.class);
                        ch.pipeline().addLast(new RequestHandler());
                    }
                });
    }

    /**
     * Binds the endpoint. Blocks until the socket is bound.
     *
     * @throws DriverChannelException if the endpoint cannot be bound
     */
    public void start()
    {
        ChannelFuture f = bootstrap.bind(endpoint.socketAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new DriverChannelException("Could not bind driver endpoint " + endpoint, f.cause());
        }
        serverChannel = f.channel();
        log.info("Driver endpoint {} listening on {}", endpoint.name(), serverChannel.localAddress());
    }

    /**
     * The address actually bound; differs from the configured one when port
     * {@code 0} was requested.
     */
    public InetSocketAddress boundAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Server is not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    public DriverEndpoint endpoint()
    {
        return endpoint;
    }

    @Override
    public void close()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            log.info("Driver endpoint {} closed", endpoint.name());
        }
        shutdownGroups();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully();
        ioGroup.shutdownGracefully();
    }

    DriverReply dispatch(DriverRequest request)
    {
        if (!endpoint.name().equals(request.endpoint())) {
            log.warn("Rejecting request {} addressed to endpoint '{}'", request.id(), request.endpoint());
            return DriverReply.failure(request.id(),
                    "Endpoint '" + request.endpoint() + "' is not served here (this is '" + endpoint.name() + "')");
        }
        try {
            return switch (request.operation()) {
                case INIT -> DriverReply.of(request.id(), service.init(request.configuration()));
                case TEST -> DriverReply.of(request.id(), service.test());
                case PAY -> DriverReply.of(request.id(), service.pay(request.amount()));
                case SHUTDOWN -> DriverReply.of(request.id(), service.shutdown());
            };
        } catch (RuntimeException e) {
            log.error("Driver call {} {} failed", request.operation(), request.id(), e);
            return DriverReply.failure(request.id(), e.getMessage());
        }
    }

    /**
     * RequestHandler
     * -------------------------------------------------------------------------
     * Moves each decoded request onto the worker executor and writes the reply
     * back on the connection it arrived on.
     */
    private final class RequestHandler extends SimpleChannelInboundHandler<DriverRequest>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DriverRequest request)
        {
            log.debug("Driver call {} {} received", request.operation(), request.id());
            try {
                workers.execute(() -> ctx.writeAndFlush(dispatch(request)));
            } catch (RejectedExecutionException e) {
                log.warn("Driver call {} {} rejected: worker pool is shut down", request.operation(), request.id());
                ctx.writeAndFlush(DriverReply.failure(request.id(), "Driver is shutting down"));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing driver connection from {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
