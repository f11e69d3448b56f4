package org.sensepitch.ipgeo;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves the query API. Requests are answered asynchronously since hostnames need resolving,
 * responses of one connection are chained so they are written in request order.
 *
 * @author Jens Wilke
 */
@Slf4j
public class GeoApiHandler extends SkippingChannelInboundHandlerAdapter {

  public static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
  public static final String BAD_REQUEST = "BAD_REQUEST";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private final GeoQueryService queryService;
  private final ClientAddressResolver clientAddressResolver;
  private final ResponseAssembler assembler;

  private CompletableFuture<Void> responseChain = CompletableFuture.completedFuture(null);

  public GeoApiHandler(
      GeoQueryService queryService,
      ClientAddressResolver clientAddressResolver,
      ResponseAssembler assembler) {
    this.queryService = queryService;
    this.clientAddressResolver = clientAddressResolver;
    this.assembler = assembler;
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    if (msg instanceof HttpRequest request) {
      try {
        handleRequest(ctx, request);
      } finally {
        ReferenceCountUtil.release(msg);
      }
      if (!(msg instanceof LastHttpContent)) {
        skipFollowingContent(ctx);
      }
      return;
    }
    super.channelRead(ctx, msg);
  }

  private void handleRequest(ChannelHandlerContext ctx, HttpRequest request) {
    if (request.decoderResult().isFailure()) {
      rejectRequest(
          ctx,
          errorResponse(
              request.protocolVersion(),
              HttpResponseStatus.BAD_REQUEST,
              BAD_REQUEST,
              "Malformed HTTP request"));
      return;
    }
    enqueue(ctx, respond(ctx, request));
  }

  private CompletableFuture<FullHttpResponse> respond(
      ChannelHandlerContext ctx, HttpRequest request) {
    HttpVersion version = request.protocolVersion();
    if (!HttpMethod.GET.equals(request.method())) {
      FullHttpResponse response =
          errorResponse(
              version,
              HttpResponseStatus.METHOD_NOT_ALLOWED,
              METHOD_NOT_ALLOWED,
              "Method " + request.method() + " not allowed");
      response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.GET.name());
      return CompletableFuture.completedFuture(response);
    }
    ApiRoute route = ApiRoute.parse(request.uri());
    CompletableFuture<ResolutionResult> result;
    switch (route.endpoint()) {
      case UNKNOWN:
        return CompletableFuture.completedFuture(
            errorResponse(version, HttpResponseStatus.NOT_FOUND, NOT_FOUND, "No such resource"));
      case MALFORMED:
        return CompletableFuture.completedFuture(
            errorResponse(
                version,
                HttpResponseStatus.BAD_REQUEST,
                InvalidHostException.CODE,
                "Malformed percent encoding"));
      default:
        result =
            route.queriesClient()
                ? queryClient(ctx, request)
                : queryService.query(route.host());
    }
    return result.handle(
        (resolution, ex) -> {
          if (ex != null) {
            return toErrorResponse(version, request, ex);
          }
          return jsonResponse(version, HttpResponseStatus.OK, assembler.assemble(resolution));
        });
  }

  private CompletableFuture<ResolutionResult> queryClient(
      ChannelHandlerContext ctx, HttpRequest request) {
    try {
      Address client =
          clientAddressResolver.resolve(request.headers(), ctx.channel().remoteAddress());
      if (client == null) {
        throw new IllegalStateException(
            "Client address unknown, remote=" + ctx.channel().remoteAddress());
      }
      return CompletableFuture.completedFuture(queryService.queryAddress(client));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Write the response after all responses of previous requests are written. Writes always go
   * through the event loop task queue, so they keep their order.
   */
  private void enqueue(ChannelHandlerContext ctx, CompletableFuture<FullHttpResponse> response) {
    responseChain =
        responseChain
            .thenCombine(response, (previous, current) -> current)
            .thenAccept(current -> ctx.executor().execute(() -> ctx.writeAndFlush(current)));
  }

  private FullHttpResponse toErrorResponse(
      HttpVersion version, HttpRequest request, Throwable ex) {
    Throwable cause = unwrap(ex);
    if (cause instanceof GeoServiceException geo) {
      HttpResponseStatus status = statusOf(geo);
      if (status.code() >= 500) {
        log.warn(request.uri() + ": " + geo.getMessage());
      }
      return errorResponse(version, status, geo.code(), geo.getMessage());
    }
    log.error("Internal error processing " + request.uri(), cause);
    return errorResponse(
        version, HttpResponseStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal error");
  }

  static HttpResponseStatus statusOf(GeoServiceException ex) {
    if (ex instanceof InvalidHostException) {
      return HttpResponseStatus.BAD_REQUEST;
    } else if (ex instanceof NoSuchHostException) {
      return HttpResponseStatus.NOT_FOUND;
    } else if (ex instanceof DatabaseUnavailableException) {
      return HttpResponseStatus.SERVICE_UNAVAILABLE;
    }
    return HttpResponseStatus.INTERNAL_SERVER_ERROR;
  }

  static Throwable unwrap(Throwable ex) {
    Throwable cause = ex;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  FullHttpResponse errorResponse(
      HttpVersion version, HttpResponseStatus status, String code, String message) {
    return jsonResponse(version, status, assembler.error(status.code(), code, message));
  }

  static FullHttpResponse jsonResponse(
      HttpVersion version, HttpResponseStatus status, byte[] body) {
    FullHttpResponse response =
        new DefaultFullHttpResponse(version, status, Unpooled.wrappedBuffer(body));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE_JSON);
    HttpUtil.setContentLength(response, body.length);
    return response;
  }
}
