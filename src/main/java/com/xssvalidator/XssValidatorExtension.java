package com.xssvalidator;

import burp.api.montoya.BurpExtension;
import burp.api.montoya.MontoyaApi;
import com.xssvalidator.context.ContextClassifier;
import com.xssvalidator.correlation.CorrelationPruner;
import com.xssvalidator.correlation.CorrelationTable;
import com.xssvalidator.correlation.IntruderResponseHandler;
import com.xssvalidator.correlation.ResponseCorrelator;
import com.xssvalidator.framework.ConfigPersistence;
import com.xssvalidator.framework.IssueReporter;
import com.xssvalidator.framework.ResultsStore;
import com.xssvalidator.framework.VerificationExecutor;
import com.xssvalidator.framework.XssContextMenu;
import com.xssvalidator.intruder.XssPayloadGeneratorProvider;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.payload.ContextPayloadSynthesizer;
import com.xssvalidator.payload.HttpPayloadAugmenter;
import com.xssvalidator.payload.PayloadMutator;
import com.xssvalidator.verification.HealthStatus;
import com.xssvalidator.verification.HttpVerificationClient;
import com.xssvalidator.verification.ManualTester;
import com.xssvalidator.verification.VerificationException;

/**
 * XSS Validator 2.0: entry point
 *
 * Generates context-aware XSS payloads for Intruder and verifies the responses they
 * provoke in real browsers through the external verification server.
 *
 * Built exclusively on the Montoya API.
 */
public class XssValidatorExtension implements BurpExtension {

    private ValidatorConfig config;
    private ResultsStore resultsStore;
    private VerificationExecutor executor;
    private IntruderResponseHandler responseHandler;
    private CorrelationTable correlationTable;
    private CorrelationPruner pruner;

    @Override
    public void initialize(MontoyaApi api) {
        api.extension().setName("XSS Validator");
        api.logging().logToOutput("=== XSS Validator 2.0 initializing ===");

        // Configuration, restored from the project file
        config = new ValidatorConfig();
        ConfigPersistence persistence = new ConfigPersistence(api.persistence().extensionData());
        persistence.setErrorLogger(msg -> api.logging().logToError(msg));
        int restored = persistence.load(config);
        api.logging().logToOutput("Configuration: " + restored + " stored setting(s) restored, server "
                + config.getServerBaseUrl() + ", browsers " + config.getEnabledBrowsers());

        // Results and reporting
        resultsStore = new ResultsStore();
        resultsStore.setErrorLogger(msg -> api.logging().logToError(msg));
        resultsStore.addListener(new IssueReporter(api));
        resultsStore.addListener(result -> api.logging().logToOutput("[Result] " + result));

        executor = new VerificationExecutor(3);
        executor.setLogger(msg -> api.logging().logToOutput(msg));

        // Engine
        HttpVerificationClient verificationClient = new HttpVerificationClient(config);
        ContextClassifier classifier = new ContextClassifier();
        classifier.setErrorLogger(msg -> api.logging().logToError(msg));
        ContextPayloadSynthesizer synthesizer =
                new ContextPayloadSynthesizer(new HttpPayloadAugmenter(config), config);
        synthesizer.setErrorLogger(msg -> api.logging().logToError(msg));
        correlationTable = new CorrelationTable();

        ResponseCorrelator correlator = new ResponseCorrelator(correlationTable, verificationClient, config,
                resultsStore, executor);
        correlator.setLogger(msg -> api.logging().logToOutput(msg));
        correlator.setErrorLogger(msg -> api.logging().logToError(msg));

        // Intruder payload source
        api.intruder().registerPayloadGeneratorProvider(new XssPayloadGeneratorProvider(
                api, classifier, synthesizer, new PayloadMutator(), correlationTable, config));
        api.logging().logToOutput("Intruder payload generator registered: " + XssPayloadGeneratorProvider.DISPLAY_NAME);

        // Response correlation
        responseHandler = new IntruderResponseHandler(api, correlator);
        api.http().registerHttpHandler(responseHandler);
        api.logging().logToOutput("Intruder response correlation registered.");

        pruner = new CorrelationPruner(correlationTable, config);
        pruner.setLogger(msg -> api.logging().logToOutput(msg));
        pruner.start();

        // Manual testing from the context menu
        api.userInterface().registerContextMenuItemsProvider(new XssContextMenu(
                api, new ManualTester(verificationClient), config, resultsStore, executor));

        // Check the verification server without blocking Burp's startup
        Thread healthCheck = new Thread(() -> {
            try {
                HealthStatus health = verificationClient.checkHealth();
                api.logging().logToOutput("Verification server healthy at " + config.getServerBaseUrl()
                        + ", browsers " + health.availableBrowsers() + ", active requests " + health.activeRequests());
            } catch (VerificationException e) {
                api.logging().logToError("Verification server not available (" + e.getErrorType() + "): "
                        + e.getMessage() + ". Start it before running an attack.");
            }
        }, "XssValidator-HealthCheck");
        healthCheck.setDaemon(true);
        healthCheck.start();

        // Cleanup on unload
        api.extension().registerUnloadingHandler(() -> {
            api.logging().logToOutput("XSS Validator unloading...");
            pruner.shutdown();
            responseHandler.shutdown();
            executor.shutdown();
            persistence.save(config);
            api.logging().logToOutput("Unloaded with " + correlationTable.attackIds().size()
                    + " attack(s) still pending; " + resultsStore.processedCount() + " result(s), "
                    + resultsStore.vulnerableCount() + " vulnerable.");
        });

        api.logging().logToOutput("=== XSS Validator 2.0 ready ===");
        api.logging().logToOutput("In Intruder, choose payload type \"Extension-generated\" and select \""
                + XssPayloadGeneratorProvider.DISPLAY_NAME + "\".");
    }
}
