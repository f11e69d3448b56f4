package org.sensepitch.ipgeo;

import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.concurrent.Ticker;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes one access log line per request when the last content of its response is written and
 * records the request metrics. Responses arrive in request order, so pipelined requests are
 * matched in a queue.
 *
 * <p>Note on concurrency: all methods are called from the channel event loop.
 *
 * @author Jens Wilke
 */
@Slf4j(topic = "org.sensepitch.ipgeo.access")
public class AccessLogHandler extends ChannelDuplexHandler {

  /** Status logged for requests the client did not wait for. */
  static final int ABORTED_STATUS = 499;

  private final GeoMetrics metrics;
  private final Deque<PendingRequest> pending = new ArrayDeque<>();
  private Ticker ticker;
  private int status;
  private long contentBytes;

  public AccessLogHandler(GeoMetrics metrics) {
    this.metrics = metrics;
  }

  @Override
  public void handlerAdded(ChannelHandlerContext ctx) {
    ticker = ctx.executor().ticker();
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    if (msg instanceof HttpRequest request) {
      pending.add(new PendingRequest(request.method().name(), request.uri(), ticker.nanoTime()));
    }
    super.channelRead(ctx, msg);
  }

  @Override
  public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise)
      throws Exception {
    if (msg instanceof HttpResponse response) {
      status = response.status().code();
      contentBytes = 0;
    }
    // HttpResponse may have content as well
    if (msg instanceof HttpContent httpContent) {
      contentBytes += httpContent.content().readableBytes();
    }
    if (msg instanceof LastHttpContent) {
      PendingRequest request = pending.poll();
      if (request != null) {
        int loggedStatus = status;
        long loggedBytes = contentBytes;
        promise = promise.unvoid();
        promise.addListener(
            future ->
                log(
                    ctx.channel().remoteAddress(),
                    request,
                    future.isSuccess() ? loggedStatus : ABORTED_STATUS,
                    loggedBytes));
      }
    }
    super.write(ctx, msg, promise);
  }

  /** Log requests that never got a response, e.g. when the client closed the connection. */
  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    PendingRequest request;
    while ((request = pending.poll()) != null) {
      log(ctx.channel().remoteAddress(), request, ABORTED_STATUS, 0);
    }
    super.channelInactive(ctx);
  }

  private void log(SocketAddress remote, PendingRequest request, int status, long bytes) {
    long durationNanos = ticker.nanoTime() - request.startNanos();
    metrics.requestCompleted(
        ApiRoute.parse(request.uri()).endpoint().label(), status, durationNanos);
    if (log.isInfoEnabled()) {
      log.info(
          remoteHost(remote)
              + " \""
              + request.method()
              + " "
              + sanitize(request.uri())
              + "\" "
              + status
              + " "
              + bytes
              + " "
              + formatDeltaTime(durationNanos));
    }
  }

  static String remoteHost(SocketAddress remote) {
    if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
      return inet.getAddress().getHostAddress();
    }
    return "-";
  }

  static String formatDeltaTime(long nanoDelta) {
    // seconds with millisecond precision
    DecimalFormat df = new DecimalFormat("0.000", DecimalFormatSymbols.getInstance(Locale.ROOT));
    return df.format(nanoDelta / 1_000_000_000.0);
  }

  static String sanitize(String s) {
    if (s.indexOf('"') >= 0) {
      return s.replace("\"", "\\\"");
    }
    return s;
  }

  record PendingRequest(String method, String uri, long startNanos) {}
}
