package nz.tai.panelproxy.http;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.flow.FlowControlHandler;
import nz.tai.panelproxy.proxy.ProxyEventLoops;
import nz.tai.panelproxy.proxy.ProxyException;
import nz.tai.panelproxy.proxy.ProxyInstance;
import nz.tai.panelproxy.proxy.ProxyProtocol;
import nz.tai.panelproxy.proxy.TcpListener;
import nz.tai.panelproxy.route.Route;
import nz.tai.panelproxy.route.RouteTable;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * HTTP reverse proxy that virtual-hosts backends by the request's Host header, with WebSocket
 * upgrade pass-through.
 */
public final class HttpProxy implements ProxyInstance {
  public static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024; // 10 MB

  static final String CODEC_HANDLER = "httpCodec";
  static final String AGGREGATOR_HANDLER = "httpAggregator";
  static final String FLOW_CONTROL_HANDLER = "httpFlowControl";

  private final RouteTable routes = RouteTable.virtualHosted("HTTP");
  private final TcpListener listener;

  public HttpProxy(int port, ProxyEventLoops eventLoops) {
    this.listener = new TcpListener("HTTP", port, eventLoops,
        new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            // requests are pulled one at a time by HttpFrontendHandler
            ch.config().setAutoRead(false);
            ChannelPipeline pipeline = ch.pipeline();
            pipeline.addLast(CODEC_HANDLER, new HttpServerCodec());
            pipeline.addLast(AGGREGATOR_HANDLER, new HttpObjectAggregator(MAX_CONTENT_LENGTH));
            pipeline.addLast(FLOW_CONTROL_HANDLER, new FlowControlHandler());
            pipeline.addLast("httpFrontend", new HttpFrontendHandler(routes));
          }
        });
  }

  @Override
  public ProxyProtocol protocol() {
    return ProxyProtocol.HTTP;
  }

  @Override
  public int port() {
    return listener.port();
  }

  @Override
  public void start() throws ProxyException {
    listener.start();
  }

  @Override
  public void stop() {
    listener.stop();
  }

  @Override
  public boolean isRunning() {
    return listener.isRunning();
  }

  @Override
  public InetSocketAddress localAddress() {
    return listener.localAddress();
  }

  @Override
  public void addRoute(String ownerId, String routingKey, String backendHost, int backendPort) {
    routes.add(ownerId, routingKey, backendHost, backendPort);
  }

  @Override
  public void removeRoute(String routingKey) {
    routes.remove(routingKey);
  }

  @Override
  public void updateRoute(String routingKey, String backendHost, int backendPort) {
    routes.update(routingKey, backendHost, backendPort);
  }

  @Override
  public void setRouteActive(String routingKey, boolean active) {
    routes.setActive(routingKey, active);
  }

  @Override
  public Map<String, Route> getRoutes() {
    return routes.snapshot();
  }
}
