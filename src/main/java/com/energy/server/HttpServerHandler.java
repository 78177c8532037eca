package com.energy.server;

import com.energy.db.StorageException;
import com.energy.model.MeterReading;
import com.energy.model.VehicleReading;
import com.energy.service.AnalyticsService;
import com.energy.service.IngestService;
import com.energy.service.NotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Обработчик HTTP-запросов приёма телеметрии и аналитики.
 * <p>
 * Проверяет входные данные, делегирует работу {@link IngestService} и {@link AnalyticsService}
 * и переводит их исключения в HTTP-статусы: проверка → 400, неизвестное устройство → 404,
 * ошибка хранилища → 500.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  private final IngestService ingestService;
  private final AnalyticsService analyticsService;
  private final ObjectMapper objectMapper;
  private final RequestValidator validator;

  /**
   * Конструктор обработчика.
   *
   * @param ingestService Сервис приёма телеметрии.
   * @param analyticsService Сервис аналитики.
   * @param objectMapper Настроенный Jackson (см. {@link JsonMapperFactory}).
   */
  public HttpServerHandler(IngestService ingestService, AnalyticsService analyticsService, ObjectMapper objectMapper) {
    this.ingestService = ingestService;
    this.analyticsService = analyticsService;
    this.objectMapper = objectMapper;
    this.validator = new RequestValidator();
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    HttpMethod method = request.method();
    String path = new QueryStringDecoder(request.uri()).rawPath();
    logger.debug("📥 {} {}", method, path);

    FullHttpResponse response;
    try {
      response = route(method, path, request);
    } catch (ValidationException e) {
      response = createErrorResponse(HttpResponseStatus.BAD_REQUEST, e.getMessage());
    } catch (JsonProcessingException e) {
      response = createErrorResponse(HttpResponseStatus.BAD_REQUEST, "Invalid JSON");
    } catch (NotFoundException e) {
      response = createErrorResponse(HttpResponseStatus.NOT_FOUND, e.getMessage());
    } catch (StorageException e) {
      logger.error("❌ Ошибка хранилища при обработке {} {}", method, path, e);
      response = createErrorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Storage failure");
    } catch (IOException | RuntimeException e) {
      logger.error("❌ Необработанная ошибка при обработке {} {}", method, path, e);
      response = createErrorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse route(HttpMethod method, String path, FullHttpRequest request) throws IOException {
    String[] segments = path.replaceAll("^/+|/+$", "").split("/");

    if (method == HttpMethod.POST && segments.length >= 3 && "v1".equals(segments[0]) && "ingest".equals(segments[1])) {
      String kind = segments[2];
      boolean batch = segments.length == 4 && "batch".equals(segments[3]);
      if (segments.length == 3 || batch) {
        if ("meter".equals(kind)) {
          return batch ? ingestMeterBatch(request) : ingestMeter(request);
        }
        if ("vehicle".equals(kind)) {
          return batch ? ingestVehicleBatch(request) : ingestVehicle(request);
        }
      }
    }

    if (method == HttpMethod.GET && segments.length >= 4 && "v1".equals(segments[0]) && "analytics".equals(segments[1])) {
      String id = QueryStringDecoder.decodeComponent(segments[3]);
      if (segments.length == 4 && "performance".equals(segments[2])) {
        return createJsonResponse(HttpResponseStatus.OK, analyticsService.getVehiclePerformance(id));
      }
      if (segments.length == 5 && "live".equals(segments[4])) {
        if ("vehicle".equals(segments[2])) {
          return createJsonResponse(HttpResponseStatus.OK, analyticsService.getVehicleLiveState(id));
        }
        if ("meter".equals(segments[2])) {
          return createJsonResponse(HttpResponseStatus.OK, analyticsService.getMeterLiveState(id));
        }
      }
    }

    return createErrorResponse(HttpResponseStatus.NOT_FOUND, "404");
  }

  private FullHttpResponse ingestMeter(FullHttpRequest request) throws IOException {
    JsonNode body = readBody(request);
    validator.validateMeter(body);
    MeterReading reading = objectMapper.treeToValue(body, MeterReading.class);
    return createJsonResponse(HttpResponseStatus.CREATED, ingestService.ingestMeter(reading));
  }

  private FullHttpResponse ingestVehicle(FullHttpRequest request) throws IOException {
    JsonNode body = readBody(request);
    validator.validateVehicle(body);
    VehicleReading reading = objectMapper.treeToValue(body, VehicleReading.class);
    return createJsonResponse(HttpResponseStatus.CREATED, ingestService.ingestVehicle(reading));
  }

  private FullHttpResponse ingestMeterBatch(FullHttpRequest request) throws IOException {
    JsonNode body = readBody(request);
    validator.validateBatch(body);
    List<MeterReading> readings = readBatchItems(body, validator::validateMeter, MeterReading.class);
    return createJsonResponse(HttpResponseStatus.CREATED, ingestService.ingestMeterBatch(readings));
  }

  private FullHttpResponse ingestVehicleBatch(FullHttpRequest request) throws IOException {
    JsonNode body = readBody(request);
    validator.validateBatch(body);
    List<VehicleReading> readings = readBatchItems(body, validator::validateVehicle, VehicleReading.class);
    return createJsonResponse(HttpResponseStatus.CREATED, ingestService.ingestVehicleBatch(readings));
  }

  /**
   * Проверяет и преобразует каждый элемент пакета отдельно. Элемент, не прошедший
   * проверку, передаётся в сервис как {@code null} и учитывается как неудачный,
   * не мешая остальным.
   */
  private <T> List<T> readBatchItems(JsonNode body, Consumer<JsonNode> validate, Class<T> type) {
    List<T> readings = new ArrayList<>(body.size());
    for (int i = 0; i < body.size(); i++) {
      readings.add(readBatchItem(body.get(i), i, validate, type));
    }
    return readings;
  }

  private <T> T readBatchItem(JsonNode item, int index, Consumer<JsonNode> validate, Class<T> type) {
    try {
      validate.accept(item);
      return objectMapper.treeToValue(item, type);
    } catch (ValidationException | JsonProcessingException e) {
      logger.warn("Элемент пакета #{} отклонён: {}", index, e.getMessage());
      return null;
    }
  }

  private JsonNode readBody(FullHttpRequest request) throws JsonProcessingException {
    String body = request.content().toString(CharsetUtil.UTF_8);
    if (body.isBlank()) {
      throw new ValidationException("request body is empty");
    }
    return objectMapper.readTree(body);
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, Object payload) throws JsonProcessingException {
    return createResponse(status, objectMapper.writeValueAsString(payload));
  }

  private FullHttpResponse createErrorResponse(HttpResponseStatus status, String message) {
    String body = objectMapper.createObjectNode().put("error", message).toString();
    return createResponse(status, body);
  }

  private FullHttpResponse createResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("Ошибка канала, соединение закрывается", cause);
    ctx.close();
  }
}
