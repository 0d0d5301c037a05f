package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.exceptions.DeliveryException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * PUTs the response to the presigned S3 URL. The URL is signed with an empty Content-Type, so the
 * header has to be sent empty as well or S3 rejects the upload with 403.
 */
public class OkHttpResponseSender implements ResponseSender {
    static final String CONTENT_TYPE = "Content-Type";

    @Override
    public CompletionStage<Void> send(final String responseUrl,
                                      final String body) {
        final CompletableFuture<Void> result = new CompletableFuture<>();

        final HttpUrl url = HttpUrl.parse(responseUrl);
        if (url == null) {
            result.completeExceptionally(new DeliveryException("Invalid response URL", null));
            return result;
        }

        // no media type, otherwise OkHttp fills in its own Content-Type
        final Request request = new Request.Builder()
            .url(url)
            .header(CONTENT_TYPE, "")
            .put(RequestBody.create(body.getBytes(StandardCharsets.UTF_8), null))
            .build();

        // a client per invocation; timeouts are left to the invocation host
        final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ZERO)
            .readTimeout(Duration.ZERO)
            .writeTimeout(Duration.ZERO)
            .retryOnConnectionFailure(false)
            .build();

        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(final Call call, final IOException e) {
                result.completeExceptionally(
                    new DeliveryException(String.format("Response delivery failed: %s", e.getMessage()), e));
                shutdown(client);
            }

            @Override
            public void onResponse(final Call call, final Response response) {
                try (Response r = response) {
                    if (r.isSuccessful()) {
                        result.complete(null);
                    } else {
                        result.completeExceptionally(new DeliveryException(r.code()));
                    }
                } finally {
                    shutdown(client);
                }
            }
        });

        return result;
    }

    private static void shutdown(final OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
