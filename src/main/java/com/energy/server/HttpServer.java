package com.energy.server;

import com.energy.config.Config;
import com.energy.db.DatabaseConnection;
import com.energy.db.TelemetryDao;
import com.energy.service.AnalyticsService;
import com.energy.service.AnalyticsServiceImpl;
import com.energy.service.IngestService;
import com.energy.service.IngestServiceImpl;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * HTTP-сервер на Netty и точка входа приложения.
 * <p>
 * Обработчики запросов работают на отдельной группе потоков: запись в БД блокирующая
 * и не должна занимать IO-потоки.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024;

  private final int port;
  private final int workerThreads;
  private final IngestService ingestService;
  private final AnalyticsService analyticsService;
  private final ObjectMapper objectMapper;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private EventExecutorGroup handlerGroup;
  private Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   *
   * @param port Порт, на котором будет работать сервер (0 — любой свободный).
   * @param workerThreads Число потоков для обработчиков запросов.
   * @param ingestService Сервис приёма телеметрии.
   * @param analyticsService Сервис аналитики.
   */
  public HttpServer(int port, int workerThreads, IngestService ingestService, AnalyticsService analyticsService) {
    this.port = port;
    this.workerThreads = workerThreads;
    this.ingestService = ingestService;
    this.analyticsService = analyticsService;
    this.objectMapper = JsonMapperFactory.create();
  }

  /**
   * Привязывает сервер к порту и возвращает управление.
   *
   * @throws InterruptedException если поток прерван во время привязки.
   */
  public void start() throws InterruptedException {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    handlerGroup = new DefaultEventExecutorGroup(workerThreads);

    ServerBootstrap b = new ServerBootstrap();
    b.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                .addLast(handlerGroup, new HttpServerHandler(ingestService, analyticsService, objectMapper));
          }
        })
        .option(ChannelOption.SO_BACKLOG, 128)
        .childOption(ChannelOption.SO_KEEPALIVE, true);

    try {
      serverChannel = b.bind(port).sync().channel();
    } catch (InterruptedException | RuntimeException e) {
      stop();
      throw e;
    }
    logger.info("🚀 Сервер запущен на http://localhost:{}", getPort());
  }

  /**
   * @return Фактический порт сервера; полезно, если он запускался на порту 0.
   */
  public int getPort() {
    return ((InetSocketAddress) serverChannel.localAddress()).getPort();
  }

  /**
   * Блокирует поток до закрытия серверного канала.
   */
  public void awaitTermination() throws InterruptedException {
    serverChannel.closeFuture().sync();
  }

  /**
   * Закрывает серверный канал и останавливает группы потоков.
   */
  public void stop() {
    if (serverChannel != null) {
      serverChannel.close().syncUninterruptibly();
    }
    if (handlerGroup != null) {
      handlerGroup.shutdownGracefully();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully();
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Точка входа в приложение.
   * Инициализирует схему БД, собирает сервисы и запускает сервер.
   *
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    DatabaseConnection database = DatabaseConnection.fromConfig();
    database.initializeDatabase();

    TelemetryDao telemetryDao = new TelemetryDao(database);
    IngestServiceImpl ingestService = new IngestServiceImpl(telemetryDao, Config.getIntProperty("ingest.batch.concurrency", 16));
    AnalyticsService analyticsService = new AnalyticsServiceImpl(telemetryDao);

    HttpServer server = new HttpServer(
        Config.getIntProperty("server.port", 8081),
        Config.getIntProperty("server.worker.threads", 16),
        ingestService,
        analyticsService
    );

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Остановка сервера");
      server.stop();
      ingestService.close();
    }, "shutdown"));

    server.start();
    server.awaitTermination();
  }
}
