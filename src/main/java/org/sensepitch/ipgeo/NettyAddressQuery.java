package org.sensepitch.ipgeo;

import io.netty.channel.EventLoop;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.resolver.ResolvedAddressTypes;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.DnsServerAddressStreamProviders;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Address queries with the Netty DNS resolver, using the platform resolver configuration and the
 * hosts file. Separate resolvers for IPv4 and IPv6 keep the A and AAAA answers apart.
 *
 * @author Jens Wilke
 */
public class NettyAddressQuery implements AddressQuery, AutoCloseable {

  private final DnsNameResolver ipv4Resolver;
  private final DnsNameResolver ipv6Resolver;

  public NettyAddressQuery(EventLoop eventLoop, long queryTimeoutMillis) {
    ipv4Resolver = build(eventLoop, ResolvedAddressTypes.IPV4_ONLY, queryTimeoutMillis);
    ipv6Resolver = build(eventLoop, ResolvedAddressTypes.IPV6_ONLY, queryTimeoutMillis);
  }

  private static DnsNameResolver build(
      EventLoop eventLoop, ResolvedAddressTypes types, long queryTimeoutMillis) {
    return new DnsNameResolverBuilder(eventLoop)
        .resolvedAddressTypes(types)
        .channelType(NioDatagramChannel.class)
        .socketChannelType(NioSocketChannel.class)
        .nameServerProvider(DnsServerAddressStreamProviders.platformDefault())
        .queryTimeoutMillis(queryTimeoutMillis)
        .build();
  }

  @Override
  public CompletableFuture<List<Address>> lookup(Hostname hostname, RecordType type) {
    DnsNameResolver resolver = type == RecordType.A ? ipv4Resolver : ipv6Resolver;
    CompletableFuture<List<Address>> result = new CompletableFuture<>();
    resolver
        .resolveAll(hostname.name())
        .addListener(
            future -> {
              if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
                return;
              }
              @SuppressWarnings("unchecked")
              List<InetAddress> answers = (List<InetAddress>) future.getNow();
              List<Address> addresses = new ArrayList<>();
              for (InetAddress answer : answers) {
                addresses.add(Address.of(answer));
              }
              result.complete(addresses);
            });
    return result;
  }

  @Override
  public void close() {
    ipv4Resolver.close();
    ipv6Resolver.close();
  }
}
