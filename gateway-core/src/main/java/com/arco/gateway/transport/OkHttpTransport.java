package com.arco.gateway.transport;

import com.arco.gateway.HttpMethod;
import com.arco.gateway.config.GatewayConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpTransport} over one shared {@link OkHttpClient}. The client's connection pool
 * and dispatcher live until {@link #close()}.
 */
public class OkHttpTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(OkHttpTransport.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String userAgent;

    public OkHttpTransport(GatewayConfig config) {
        this(new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build(),
            new ObjectMapper(),
            config.getUserAgent());
        logger.info("HTTP transport initialized - connect timeout {}ms, request timeout {}ms",
            config.getConnectTimeout().toMillis(), config.getRequestTimeout().toMillis());
    }

    OkHttpTransport(OkHttpClient httpClient, ObjectMapper objectMapper, String userAgent) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.userAgent = userAgent;
    }

    @Override
    public TransportResponse execute(TransportRequest request) throws IOException {
        Request httpRequest = buildRequest(request);
        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            logger.debug("{} {} -> {}", request.method(), httpRequest.url().redact(), response.code());
            return new TransportResponse(response.code(), text);
        }
    }

    @Override
    public void checkRequest(TransportRequest request) {
        parseUrl(request.url());
    }

    private static HttpUrl parseUrl(String url) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            throw new InvalidRequestException("Invalid URL: " + url);
        }
        return parsed;
    }

    private Request buildRequest(TransportRequest request) {
        HttpUrl base = parseUrl(request.url());

        Request.Builder builder = new Request.Builder().header("User-Agent", userAgent);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        if (request.method() == HttpMethod.POST) {
            String json;
            try {
                json = objectMapper.writeValueAsString(request.params());
            } catch (JsonProcessingException e) {
                throw new InvalidRequestException("Parameters are not serializable as JSON: " + e.getOriginalMessage(), e);
            }
            return builder.url(base).post(RequestBody.create(json, JSON)).build();
        }

        HttpUrl.Builder url = base.newBuilder();
        for (Map.Entry<String, Object> param : request.params().entrySet()) {
            if (param.getValue() != null) {
                url.addQueryParameter(param.getKey(), String.valueOf(param.getValue()));
            }
        }
        return builder.url(url.build()).get().build();
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        logger.info("HTTP transport closed");
    }
}
