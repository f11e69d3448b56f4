package org.sensepitch.ipgeo;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerKeepAliveHandler;
import java.io.IOException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP server for the query API. Wires the database snapshots, the resolver and the query service
 * and serves them with Netty, HTTP/1.1 with keep-alive and without aggregation.
 *
 * @author Jens Wilke
 */
@Slf4j
public class GeoServer {

  private final GeoServiceConfig config;
  private final GeoMetrics metrics;
  private final SnapshotManager snapshots;
  private final EventLoopGroup eventLoopGroup;
  private final AddressQuery addressQuery;
  private final GeoQueryService queryService;
  private final ClientAddressResolver clientAddressResolver;
  private final ResponseAssembler assembler = new ResponseAssembler();
  private MetricsExporter metricsExporter;

  public GeoServer(GeoServiceConfig config) {
    this(config, new GeoMetrics(), null, null);
  }

  /**
   * @param snapshots snapshot manager or {@code null} to load the configured database files
   * @param addressQuery DNS queries or {@code null} to use the platform resolver configuration
   */
  GeoServer(
      GeoServiceConfig config,
      GeoMetrics metrics,
      SnapshotManager snapshots,
      AddressQuery addressQuery) {
    this.config = config;
    this.metrics = metrics;
    eventLoopGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
    this.snapshots =
        snapshots != null
            ? snapshots
            : new SnapshotManager(new MaxMindSnapshotLoader(config.database()), metrics);
    this.addressQuery =
        addressQuery != null
            ? addressQuery
            : new NettyAddressQuery(eventLoopGroup.next(), config.resolver().timeoutMillis());
    HostnameResolver resolver =
        new HostnameResolver(
            this.addressQuery, Duration.ofMillis(config.resolver().timeoutMillis()));
    queryService =
        new GeoQueryService(
            new HostClassifier(), resolver, this.snapshots, new GeoLookup(metrics));
    clientAddressResolver = new ClientAddressResolver(config.listen().trustProxyHeaders());
  }

  /**
   * Load the databases, bind the port and serve until the server channel is closed.
   *
   * @throws DatabaseLoadException if the databases cannot be loaded
   */
  public void start() throws InterruptedException, IOException {
    if (!snapshots.isLoaded()) {
      snapshots.start();
    }
    snapshots.scheduleRefresh(config.database().reloadIntervalSeconds());
    if (config.metrics().enable()) {
      metricsExporter = new MetricsExporter().expose(metrics);
      metricsExporter.start(config.metrics().port());
    }
    EventLoopGroup bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    try {
      ServerBootstrap sb = new ServerBootstrap();
      sb.group(bossGroup, eventLoopGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(
              new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                  ChannelPipeline pipeline = ch.pipeline();
                  pipeline.addLast(new HttpServerCodec());
                  addHttpHandlers(pipeline);
                }
              });
      int port = config.listen().port();
      ChannelFuture f = sb.bind(port).sync();
      log.info("IP geo service listening on port " + port);
      f.channel().closeFuture().sync();
    } finally {
      bossGroup.shutdownGracefully();
      shutdown();
    }
  }

  void shutdown() {
    snapshots.close();
    if (metricsExporter != null) {
      metricsExporter.close();
    }
    if (addressQuery instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Closing DNS resolver failed: " + e);
      }
    }
    eventLoopGroup.shutdownGracefully();
  }

  void addHttpHandlers(ChannelPipeline pipeline) {
    // access log sits between codec and keep alive handler so it sees the final headers
    pipeline.addLast(new AccessLogHandler(metrics));
    pipeline.addLast(new HttpServerKeepAliveHandler());
    pipeline.addLast("api", new GeoApiHandler(queryService, clientAddressResolver, assembler));
    pipeline.addLast("exception", new ExceptionHandler(metrics, assembler));
  }

  GeoMetrics metrics() {
    return metrics;
  }

  SnapshotManager snapshots() {
    return snapshots;
  }
}
