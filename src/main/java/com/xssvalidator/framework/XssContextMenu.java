package com.xssvalidator.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.ui.contextmenu.ContextMenuEvent;
import burp.api.montoya.ui.contextmenu.ContextMenuItemsProvider;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.verification.ManualTester;

import javax.swing.JMenuItem;
import java.awt.Component;
import java.util.ArrayList;
import java.util.List;

/**
 * Right-click "Test for XSS" on captured messages: each selected response is verified
 * with the default payload in every enabled browser.
 */
public class XssContextMenu implements ContextMenuItemsProvider {

    private final MontoyaApi api;
    private final ManualTester tester;
    private final ValidatorConfig config;
    private final ResultsStore resultsStore;
    private final VerificationExecutor executor;

    public XssContextMenu(MontoyaApi api, ManualTester tester, ValidatorConfig config,
                          ResultsStore resultsStore, VerificationExecutor executor) {
        this.api = api;
        this.tester = tester;
        this.config = config;
        this.resultsStore = resultsStore;
        this.executor = executor;
    }

    @Override
    public List<Component> provideMenuItems(ContextMenuEvent event) {
        List<HttpRequestResponse> selected = new ArrayList<>(event.selectedRequestResponses());
        event.messageEditorRequestResponse().ifPresent(e -> selected.add(e.requestResponse()));
        if (selected.isEmpty()) return List.of();

        JMenuItem item = new JMenuItem("Test for XSS");
        item.addActionListener(e -> testAll(selected));
        return List.of(item);
    }

    void testAll(List<HttpRequestResponse> messages) {
        for (HttpRequestResponse message : messages) {
            if (message.response() == null) continue;
            String url = message.request().url();
            String body = message.response().bodyToString();
            String method = message.request().method();
            for (String browser : config.getEnabledBrowsers()) {
                executor.submit(() -> tester.testResponse(url, body, ManualTester.DEFAULT_PAYLOAD, browser,
                                method, ManualTester.CONTEXT_MENU_TOOL, message))
                        .thenAccept(resultsStore::addResult)
                        .exceptionally(t -> {
                            api.logging().logToError("[ContextMenu] Test failed for " + url + ": " + t);
                            return null;
                        });
            }
        }
        api.logging().logToOutput("[ContextMenu] Testing " + messages.size() + " message(s) for XSS");
    }
}
