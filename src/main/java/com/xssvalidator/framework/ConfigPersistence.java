package com.xssvalidator.framework;

import burp.api.montoya.persistence.PersistedObject;
import com.xssvalidator.model.ConfigurationException;
import com.xssvalidator.model.ValidatorConfig;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Stores {@link ValidatorConfig} in the Burp project file, one string per key under the
 * {@code xssvalidator.} prefix.
 */
public class ConfigPersistence {

    static final String PREFIX = "xssvalidator.";

    private final PersistedObject store;
    private volatile Consumer<String> errorLogger;

    public ConfigPersistence(PersistedObject store) {
        this.store = store;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    /**
     * Applies persisted values onto {@code config}. If the stored set as a whole is rejected,
     * keys are retried one at a time so one bad stored value leaves only that setting at its
     * default.
     *
     * @return number of settings restored
     */
    public int load(ValidatorConfig config) {
        Map<String, String> stored = new TreeMap<>();
        for (String key : ValidatorConfig.knownKeys()) {
            String value = store.getString(PREFIX + key);
            if (value != null) stored.put(key, value);
        }
        if (stored.isEmpty()) return 0;
        try {
            config.update(stored);
            return stored.size();
        } catch (ConfigurationException e) {
            logError("[ConfigPersistence] Stored settings rejected (" + e.getMessage() + "), restoring key by key");
        }

        int restored = 0;
        for (Map.Entry<String, String> entry : stored.entrySet()) {
            try {
                config.update(Map.of(entry.getKey(), entry.getValue()));
                restored++;
            } catch (ConfigurationException e) {
                logError("[ConfigPersistence] Ignoring stored " + entry.getKey() + "='" + entry.getValue()
                        + "': " + e.getMessage());
            }
        }
        return restored;
    }

    public void save(ValidatorConfig config) {
        for (Map.Entry<String, String> e : config.toRawMap().entrySet()) {
            store.setString(PREFIX + e.getKey(), e.getValue());
        }
    }

    private void logError(String msg) {
        Consumer<String> log = errorLogger;
        if (log != null) log.accept(msg);
    }
}
