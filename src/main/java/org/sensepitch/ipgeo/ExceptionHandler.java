package org.sensepitch.ipgeo;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import java.io.IOException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import lombok.extern.slf4j.Slf4j;

/**
 * Last handler in the pipeline, handles exceptions not handled by the API handler. Connection
 * resets are counted only, decoding failures get a 400 and everything else a 500 response. The
 * connection is closed in any case.
 *
 * @author Jens Wilke
 */
@Slf4j
public class ExceptionHandler extends ChannelInboundHandlerAdapter {

  static final String TYPE_RESET = "reset";
  static final String TYPE_DECODER = "decoder";
  static final String TYPE_OTHER = "other";

  private final GeoMetrics metrics;
  private final ResponseAssembler assembler;

  public ExceptionHandler(GeoMetrics metrics, ResponseAssembler assembler) {
    this.metrics = metrics;
    this.assembler = assembler;
  }

  // java.net.SocketException: Connection reset
  // java.io.IOException: Connection reset by peer
  // java.nio.channels.ClosedChannelException

  /** True for the known variants of a connection reset by the client. */
  boolean isConnectionReset(Throwable cause) {
    return cause instanceof ClosedChannelException
        || (cause instanceof IOException
            && cause.getMessage() != null
            && cause.getMessage().startsWith("Connection reset"))
        || (cause instanceof SocketException
            && cause.getMessage() != null
            && cause.getMessage().startsWith("Connection reset"));
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
    if (isConnectionReset(cause)) {
      metrics.ingressError(TYPE_RESET);
      ctx.channel().close();
      return;
    }
    if (cause instanceof DecoderException) {
      metrics.ingressError(TYPE_DECODER);
      log.debug("Decoding error, remote=" + ctx.channel().remoteAddress() + ": " + cause);
      completeWithError(
          ctx, HttpResponseStatus.BAD_REQUEST, GeoApiHandler.BAD_REQUEST, "Malformed HTTP request");
      return;
    }
    metrics.ingressError(TYPE_OTHER);
    log.error("Unhandled exception, remote=" + ctx.channel().remoteAddress(), cause);
    completeWithError(
        ctx,
        HttpResponseStatus.INTERNAL_SERVER_ERROR,
        GeoApiHandler.INTERNAL_ERROR,
        "Internal error");
  }

  private void completeWithError(
      ChannelHandlerContext ctx, HttpResponseStatus status, String code, String message) {
    byte[] body = assembler.error(status.code(), code, message);
    FullHttpResponse response =
        new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, GeoApiHandler.CONTENT_TYPE_JSON);
    response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    HttpUtil.setContentLength(response, body.length);
    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }
}
