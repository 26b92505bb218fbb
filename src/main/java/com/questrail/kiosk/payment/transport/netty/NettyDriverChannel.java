package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannel;
import com.questrail.kiosk.payment.transport.DriverChannelException;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverSession;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyDriverChannel
 * =============================================================================
 * Netty-backed client side of the driver channel.
 *
 * <p>The channel owns one event loop for its whole lifetime. Each
 * {@link #openSession()} opens a fresh TCP connection to the endpoint; the
 * session carries one or more calls, one at a time, and is closed by the
 * caller.</p>
 *
 * <h2>Timeouts</h2>
 * Every blocking step is bounded by the {@link ChannelTimeoutPolicy}: connect
 * by the open timeout, the write by the send timeout, the wait for the reply
 * by the receive timeout and the connection close by the close timeout.
 * Expiry surfaces as {@link DriverChannelException}.
 */
public final class NettyDriverChannel implements DriverChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyDriverChannel.class);

    private final DriverEndpoint endpoint;
    private final ChannelTimeoutPolicy timeouts;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile boolean closed;

    public NettyDriverChannel(DriverEndpoint endpoint, ChannelTimeoutPolicy timeouts)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, millis(timeouts.openTimeout()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        DriverPipeline.install(ch.pipeline(), DriverReply.class, DriverRequest.class);
                        ch.pipeline().addLast(new ReplyHandler());
                    }
                });
    }

    @Override
    public DriverEndpoint endpoint()
    {
        return endpoint;
    }

    @Override
    public ChannelTimeoutPolicy timeouts()
    {
        return timeouts;
    }

    @Override
    public DriverSession openSession()
    {
        return new NettySession(connect());
    }

    @Override
    public boolean probe()
    {
        if (closed) {
            return false;
        }
        try {
            Channel ch = connect();
            ch.close().awaitUninterruptibly(millis(timeouts.closeTimeout()));
            return true;
        } catch (DriverChannelException e) {
            log.debug("Probe of {} failed: {}", endpoint, e.getMessage());
            return false;
        }
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        long closeMillis = millis(timeouts.closeTimeout());
        group.shutdownGracefully(0, closeMillis, TimeUnit.MILLISECONDS).awaitUninterruptibly(closeMillis);
        log.debug("Driver channel to {} closed", endpoint);
    }

    private Channel connect()
    {
        if (closed) {
            throw new DriverChannelException("Driver channel to " + endpoint + " is closed");
        }
        ChannelFuture f = bootstrap.connect(endpoint.socketAddress());
        if (!f.awaitUninterruptibly(millis(timeouts.openTimeout()))) {
            f.cancel(false);
            throw new DriverChannelException("Timed out opening a session to " + endpoint);
        }
        if (!f.isSuccess()) {
            throw new DriverChannelException("Could not open a session to " + endpoint, f.cause());
        }
        return f.channel();
    }

    private static int millis(Duration d)
    {
        return (int) Math.min(Integer.MAX_VALUE, d.toMillis());
    }

    /**
     * One connection to the driver. Calls are sequential.
     */
    private final class NettySession implements DriverSession
    {
        private final Channel channel;
        private final ReplyHandler replies;

        NettySession(Channel channel)
        {
            this.channel = channel;
            this.replies = channel.pipeline().get(ReplyHandler.class);
        }

        @Override
        public DriverResult init(RuntimeConfiguration configuration)
        {
            return requireResult(call(DriverRequest.init(endpoint.name(), requestIds.incrementAndGet(), configuration)));
        }

        @Override
        public DriverResult test()
        {
            return requireResult(call(DriverRequest.test(endpoint.name(), requestIds.incrementAndGet())));
        }

        @Override
        public PaymentOutcome pay(int amount)
        {
            DriverReply reply = call(DriverRequest.pay(endpoint.name(), requestIds.incrementAndGet(), amount));
            if (reply.outcome() == null) {
                throw new DriverChannelException("Pay reply " + reply.id() + " carried no outcome");
            }
            return reply.outcome();
        }

        @Override
        public DriverResult shutdown()
        {
            return requireResult(call(DriverRequest.shutdown(endpoint.name(), requestIds.incrementAndGet())));
        }

        @Override
        public void close()
        {
            channel.close().awaitUninterruptibly(millis(timeouts.closeTimeout()));
        }

        private DriverResult requireResult(DriverReply reply)
        {
            if (reply.result() == null) {
                throw new DriverChannelException("Reply " + reply.id() + " carried no result");
            }
            return reply.result();
        }

        private DriverReply call(DriverRequest request)
        {
            CompletableFuture<DriverReply> pending = replies.expect();

            ChannelFuture written = channel.writeAndFlush(request);
            if (!written.awaitUninterruptibly(millis(timeouts.sendTimeout()))) {
                throw new DriverChannelException("Timed out sending " + request.operation() + " to " + endpoint);
            }
            if (!written.isSuccess()) {
                throw new DriverChannelException("Could not send " + request.operation() + " to " + endpoint,
                        written.cause());
            }

            final DriverReply reply;
            try {
                reply = pending.get(timeouts.receiveTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new DriverChannelException("Timed out waiting for the " + request.operation()
                        + " reply from " + endpoint, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof DriverChannelException dce) {
                    throw dce;
                }
                throw new DriverChannelException("Call " + request.operation() + " to " + endpoint + " failed", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverChannelException("Interrupted waiting for the " + request.operation() + " reply", e);
            }

            if (reply.id() != request.id()) {
                throw new DriverChannelException("Reply id " + reply.id() + " does not match request " + request.id());
            }
            if (reply.failed()) {
                throw new DriverChannelException("Driver rejected " + request.operation() + ": " + reply.error());
            }
            return reply;
        }
    }

    /**
     * ReplyHandler
     * -------------------------------------------------------------------------
     * Completes the pending call with the next decoded reply, or fails it when
     * the connection goes away.
     */
    private static final class ReplyHandler extends SimpleChannelInboundHandler<DriverReply>
    {
        private volatile CompletableFuture<DriverReply> pending;

        CompletableFuture<DriverReply> expect()
        {
            CompletableFuture<DriverReply> f = new CompletableFuture<>();
            pending = f;
            return f;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DriverReply reply)
        {
            CompletableFuture<DriverReply> f = pending;
            if (f == null) {
                log.warn("Discarding unsolicited driver reply {}", reply.id());
                return;
            }
            f.complete(reply);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            CompletableFuture<DriverReply> f = pending;
            if (f != null) {
                f.completeExceptionally(new DriverChannelException("Connection closed by the driver"));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            CompletableFuture<DriverReply> f = pending;
            if (f != null) {
                f.completeExceptionally(new DriverChannelException("Driver connection failed", cause));
            }
            ctx.close();
        }
    }
}
