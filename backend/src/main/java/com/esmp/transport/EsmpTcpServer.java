package com.esmp.transport;

import com.esmp.config.EsmpProperties;
import com.esmp.envelope.WireFormat;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.esmp.message.MessageService;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.NettyInbound;
import reactor.netty.tcp.TcpServer;

import java.nio.charset.StandardCharsets;

/**
 * Newline-delimited JSON listener. Each line is one envelope and gets exactly one reply line, in
 * input order. A line over the size limit is answered with a rejection and the connection is closed;
 * every other failure leaves the connection open.
 */
@Component
@ConditionalOnProperty(prefix = "esmp.tcp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EsmpTcpServer implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(EsmpTcpServer.class);

    private final MessageService messageService;
    private final WireFormat wireFormat;
    private final EsmpProperties.Tcp settings;

    private volatile DisposableServer server;

    public EsmpTcpServer(MessageService messageService, WireFormat wireFormat, EsmpProperties properties) {
        this.messageService = messageService;
        this.wireFormat = wireFormat;
        this.settings = properties.tcp();
    }

    @Override
    public void start() {
        server = TcpServer.create()
                .host(settings.host())
                .port(settings.port())
                .doOnConnection(connection -> connection.addHandlerLast("esmp-line",
                        new LineBasedFrameDecoder(settings.maxLineBytes())))
                .handle((inbound, outbound) -> outbound.sendString(replies(inbound), StandardCharsets.UTF_8))
                .bindNow();
        logger.info("ESMP listener bound to {}:{}", settings.host(), server.port());
    }

    @Override
    public void stop() {
        DisposableServer current = server;
        if (current != null) {
            current.disposeNow();
            server = null;
            logger.info("ESMP listener stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int port() {
        DisposableServer current = server;
        if (current == null) {
            throw new IllegalStateException("Listener is not running");
        }
        return current.port();
    }

    private Flux<String> replies(NettyInbound inbound) {
        return inbound.receive()
                .asByteArray()
                .filter(line -> !isBlank(line))
                .concatMap(this::handleLine)
                .map(reply -> wireFormat.write(reply) + "\n")
                .onErrorResume(TooLongFrameException.class, e -> {
                    logger.info("Closing connection after oversized line: {}", e.getMessage());
                    LineReply reply = LineReply.rejected(ErrorKind.MALFORMED_INPUT.name(),
                            "line exceeds " + settings.maxLineBytes() + " bytes");
                    return Mono.just(wireFormat.write(reply) + "\n");
                });
    }

    private Mono<LineReply> handleLine(byte[] line) {
        return messageService.submit(line)
                .map(LineReply::accepted)
                .onErrorResume(EsmpException.class, e -> Mono.just(LineReply.rejected(e)))
                .onErrorResume(e -> !(e instanceof EsmpException), e -> {
                    logger.error("Envelope processing failed", e);
                    return Mono.just(LineReply.rejected(LineReply.INTERNAL, "internal server error"));
                });
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
