package io.github.themoah.txwatch.http;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;

/**
 * Request body decoding and JSON replies shared by the handlers.
 */
final class JsonBodies {

  private static final String CONTENT_TYPE_JSON = "application/json";

  private JsonBodies() {}

  /**
   * @throws IllegalArgumentException when the body is missing, not JSON, or not an array
   */
  static JsonArray requireArray(RoutingContext ctx) {
    Object value = decode(ctx);
    if (!(value instanceof JsonArray array)) {
      throw new IllegalArgumentException("Request body must be a JSON array");
    }
    return array;
  }

  /**
   * An empty body reads as an empty object.
   *
   * @throws IllegalArgumentException when the body is not a JSON object
   */
  static JsonObject optionalObject(RoutingContext ctx) {
    Buffer body = ctx.body().buffer();
    if (body == null || body.length() == 0) {
      return new JsonObject();
    }
    Object value = decode(ctx);
    if (!(value instanceof JsonObject object)) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    return object;
  }

  private static Object decode(RoutingContext ctx) {
    Buffer body = ctx.body().buffer();
    if (body == null || body.length() == 0) {
      throw new IllegalArgumentException("Request body is required");
    }
    try {
      return Json.decodeValue(body);
    } catch (DecodeException e) {
      throw new IllegalArgumentException("Malformed JSON: " + e.getMessage(), e);
    }
  }

  static void reply(RoutingContext ctx, int statusCode, Object json) {
    String encoded = json instanceof JsonObject object ? object.encode() : ((JsonArray) json).encode();
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(encoded);
  }

  static void badRequest(RoutingContext ctx, String message) {
    reply(ctx, 400, ResponseJson.error(message));
  }

  static void internalError(RoutingContext ctx, Logger log, String operation, Throwable err) {
    log.error("{} failed", operation, err);
    reply(ctx, 500, ResponseJson.error(operation + " failed"));
  }
}
