package org.hypertrace.core.panelquery.opentsdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig;
import org.hypertrace.core.panelquery.api.BatchRequest;
import org.hypertrace.core.panelquery.api.BuildException;
import org.hypertrace.core.panelquery.api.ExpressionRequest;
import org.hypertrace.core.panelquery.api.ProtocolException;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.api.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the calls of a panel evaluation to OpenTSDB. All calls of one evaluation are enqueued at
 * once, share a single deadline and are cancelled together as soon as one of them fails or the
 * caller cancels the returned future.
 */
@Singleton
public class OpenTsdbRestClient {

  private static final Logger LOG = LoggerFactory.getLogger(OpenTsdbRestClient.class);

  static final String QUERY_PATH = "api/query";
  static final String GEXP_QUERY_PATH = "api/query/gexp";
  static final String GEXP_INDEX_PARAM = "gexpIndex";
  static final String BATCH_REQUEST_NAME = "batch";

  private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
  private static final int BODY_SNIPPET_LENGTH = 512;
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final HttpUrl baseUrl;
  private final OkHttpClient okHttpClient;
  private final Duration requestTimeout;

  @Inject
  public OpenTsdbRestClient(PanelQueryServiceConfig config, OkHttpClient okHttpClient) {
    this.baseUrl = HttpUrl.get(config.getOpenTsdbConfig().getUrl());
    this.okHttpClient = okHttpClient;
    this.requestTimeout = config.getOpenTsdbConfig().getRequestTimeout();
  }

  /**
   * Runs the batch call, if any, and every expression call concurrently.
   *
   * @return completes once every call succeeded, or exceptionally with the first {@link
   *     TransportException} or {@link ProtocolException}
   */
  public CompletableFuture<DispatchResult> execute(
      Optional<BatchRequest> batchRequest, List<ExpressionRequest> expressionRequests) {
    long deadlineNanos = System.nanoTime() + requestTimeout.toNanos();
    List<PendingCall<List<RawSeries>>> pendingCalls = new ArrayList<>();

    Optional<PendingCall<List<RawSeries>>> batchCall =
        batchRequest.map(
            request ->
                enqueue(
                    BATCH_REQUEST_NAME,
                    toBatchHttpRequest(request),
                    deadlineNanos,
                    response -> parseSeries(BATCH_REQUEST_NAME, response)));
    batchCall.ifPresent(pendingCalls::add);

    List<PendingCall<List<RawSeries>>> expressionCalls =
        expressionRequests.stream()
            .map(
                request -> {
                  String name = expressionRequestName(request.getCorrelationIndex());
                  return enqueue(
                      name,
                      toExpressionHttpRequest(request),
                      deadlineNanos,
                      response -> parseSeries(name, response));
                })
            .collect(Collectors.toUnmodifiableList());
    pendingCalls.addAll(expressionCalls);

    CompletableFuture<DispatchResult> result = new CompletableFuture<>();
    // first failure wins; cancelling the result from outside lands here as well
    result.whenComplete(
        (dispatchResult, error) -> {
          if (error != null) {
            pendingCalls.forEach(pendingCall -> pendingCall.call.cancel());
          }
        });
    pendingCalls.forEach(
        pendingCall ->
            pendingCall.future.whenComplete(
                (series, error) -> {
                  if (error != null) {
                    result.completeExceptionally(error);
                  }
                }));

    CompletableFuture.allOf(
            pendingCalls.stream()
                .map(pendingCall -> pendingCall.future)
                .toArray(CompletableFuture[]::new))
        .thenRun(
            () ->
                result.complete(
                    new DispatchResult(
                        batchCall.map(call -> call.future.join()).orElse(List.of()),
                        expressionCalls.stream()
                            .map(
                                call ->
                                    new ExpressionResponse(call.echoedIndex, call.future.join()))
                            .collect(Collectors.toUnmodifiableList()))));
    return result;
  }

  /** A single GET against one of the autocomplete endpoints. */
  public CompletableFuture<JsonNode> getJson(String path, Map<String, String> queryParameters) {
    HttpUrl.Builder urlBuilder = baseUrl.newBuilder().addPathSegments(path);
    queryParameters.forEach(urlBuilder::addQueryParameter);
    Request request = new Request.Builder().url(urlBuilder.build()).get().build();

    CompletableFuture<JsonNode> result = new CompletableFuture<>();
    PendingCall<JsonNode> pendingCall =
        enqueue(
            path,
            request,
            System.nanoTime() + requestTimeout.toNanos(),
            response -> readTree(path, response));
    result.whenComplete(
        (node, error) -> {
          if (error != null) {
            pendingCall.call.cancel();
          }
        });
    pendingCall.future.whenComplete(
        (node, error) -> {
          if (error != null) {
            result.completeExceptionally(error);
          } else {
            result.complete(node);
          }
        });
    return result;
  }

  static String expressionRequestName(int correlationIndex) {
    return "gexp[" + correlationIndex + "]";
  }

  private Request toBatchHttpRequest(BatchRequest batchRequest) {
    String body;
    try {
      body = OBJECT_MAPPER.writeValueAsString(batchRequest);
    } catch (JsonProcessingException e) {
      throw new BuildException("Failed to serialize batch request", e);
    }
    LOG.debug("OpenTSDB batch request: {}", body);
    return new Request.Builder()
        .url(baseUrl.newBuilder().addPathSegments(QUERY_PATH).build())
        .post(RequestBody.create(body, JSON_MEDIA_TYPE))
        .build();
  }

  private Request toExpressionHttpRequest(ExpressionRequest expressionRequest) {
    HttpUrl.Builder urlBuilder = baseUrl.newBuilder().addPathSegments(GEXP_QUERY_PATH);
    urlBuilder.addQueryParameter(
        "start", String.valueOf(expressionRequest.getWindow().getStartMs()));
    expressionRequest
        .getWindow()
        .getEnd()
        .ifPresent(end -> urlBuilder.addQueryParameter("end", String.valueOf(end)));
    urlBuilder.addQueryParameter("exp", expressionRequest.getExpression());
    urlBuilder.addQueryParameter(
        GEXP_INDEX_PARAM, String.valueOf(expressionRequest.getCorrelationIndex()));
    HttpUrl url = urlBuilder.build();
    LOG.debug("OpenTSDB gexp request: {}", url);
    return new Request.Builder().url(url).get().build();
  }

  private <T> PendingCall<T> enqueue(
      String name, Request request, long deadlineNanos, ResponseHandler<T> responseHandler) {
    Call call = okHttpClient.newCall(request);
    long remainingNanos = Math.max(1L, deadlineNanos - System.nanoTime());
    call.timeout().timeout(remainingNanos, TimeUnit.NANOSECONDS);
    PendingCall<T> pendingCall = new PendingCall<>(call);
    call.enqueue(
        new Callback() {
          @Override
          public void onResponse(Call call, Response response) {
            pendingCall.echoedIndex = readEchoedIndex(response.request().url());
            try (response) {
              pendingCall.future.complete(responseHandler.handle(checkSuccessful(name, response)));
            } catch (IOException e) {
              pendingCall.future.completeExceptionally(new TransportException(name, e));
            } catch (RuntimeException e) {
              pendingCall.future.completeExceptionally(e);
            }
          }

          @Override
          public void onFailure(Call call, IOException e) {
            pendingCall.future.completeExceptionally(new TransportException(name, e));
          }
        });
    return pendingCall;
  }

  private static Response checkSuccessful(String name, Response response) throws IOException {
    if (!response.isSuccessful()) {
      String body = readBody(response);
      LOG.info("OpenTSDB request {} failed with status {}: {}", name, response.code(), body);
      throw new ProtocolException(
          name, response.code(), StringUtils.abbreviate(body, BODY_SNIPPET_LENGTH));
    }
    return response;
  }

  private static List<RawSeries> parseSeries(String name, Response response) throws IOException {
    String body = readBody(response);
    try {
      return OpenTsdbResponseParser.parse(body);
    } catch (JsonParseException e) {
      throw new ProtocolException(
          name,
          "unexpected response body " + StringUtils.abbreviate(body, BODY_SNIPPET_LENGTH),
          e);
    }
  }

  private static JsonNode readTree(String name, Response response) throws IOException {
    String body = readBody(response);
    try {
      return OBJECT_MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ProtocolException(
          name,
          "unexpected response body " + StringUtils.abbreviate(body, BODY_SNIPPET_LENGTH),
          e);
    }
  }

  private static String readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  private static Integer readEchoedIndex(HttpUrl url) {
    String value = url.queryParameter(GEXP_INDEX_PARAM);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      LOG.warn("Malformed {} echoed in {}", GEXP_INDEX_PARAM, url);
      return null;
    }
  }

  @FunctionalInterface
  private interface ResponseHandler<T> {
    T handle(Response response) throws IOException;
  }

  private static class PendingCall<T> {
    private final Call call;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private volatile Integer echoedIndex;

    private PendingCall(Call call) {
      this.call = call;
    }
  }
}
