package com.xssvalidator.correlation;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.handler.HttpHandler;
import burp.api.montoya.http.handler.HttpRequestToBeSent;
import burp.api.montoya.http.handler.HttpResponseReceived;
import burp.api.montoya.http.handler.RequestToBeSentAction;
import burp.api.montoya.http.handler.ResponseReceivedAction;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.http.message.requests.HttpRequest;
import com.xssvalidator.model.ToolKind;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Feeds responses received by Intruder into the {@link ResponseCorrelator}.
 * Correlation runs on a dedicated executor so Burp's HTTP thread is never blocked;
 * the response is always passed on unchanged.
 */
public class IntruderResponseHandler implements HttpHandler {

    private final MontoyaApi api;
    private final ResponseCorrelator correlator;
    private final ExecutorService dispatchExecutor;

    public IntruderResponseHandler(MontoyaApi api, ResponseCorrelator correlator) {
        this.api = api;
        this.correlator = correlator;
        this.dispatchExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "XssValidator-Correlator");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public RequestToBeSentAction handleHttpRequestToBeSent(HttpRequestToBeSent request) {
        return RequestToBeSentAction.continueWith(request);
    }

    @Override
    public ResponseReceivedAction handleHttpResponseReceived(HttpResponseReceived response) {
        try {
            ToolKind tool = ToolKind.fromBurp(response.toolSource().toolType());
            if (tool == ToolKind.INTRUDER) {
                HttpRequest request = response.initiatingRequest();
                ResponseEvent event = new ResponseEvent(
                        request.toString(),
                        response.bodyToString(),
                        tool,
                        request.method(),
                        request.url(),
                        HttpRequestResponse.httpRequestResponse(request, response));
                dispatchExecutor.execute(() -> process(event));
            }
        } catch (RejectedExecutionException e) {
            api.logging().logToOutput("[Correlator] Dispatcher stopped, response not correlated");
        } catch (Exception e) {
            api.logging().logToError("[Correlator] Failed to read response: "
                    + e.getClass().getName() + ": " + e.getMessage());
        }
        return ResponseReceivedAction.continueWith(response);
    }

    private void process(ResponseEvent event) {
        try {
            correlator.onResponse(event);
        } catch (Exception e) {
            try {
                api.logging().logToError("[Correlator] Correlation failed for " + event.url() + ": "
                        + e.getClass().getName() + ": " + e.getMessage());
            } catch (NullPointerException ignored) {
                // Burp API proxy becomes null during extension unload
            }
        }
    }

    public void shutdown() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
