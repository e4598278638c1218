package com.tracker.sync.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-fatal configuration errors, each reported once per pass.
 */
public class ConfigurationIssues {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationIssues.class);

    private final Set<String> messages = ConcurrentHashMap.newKeySet();
    private final List<String> ordered = new ArrayList<>();

    /**
     * Records an issue.
     *
     * @return true the first time this message is reported
     */
    public boolean report(String message) {
        if (!messages.add(message)) {
            return false;
        }
        synchronized (ordered) {
            ordered.add(message);
        }
        log.warn("config.error {}", message);
        return true;
    }

    public List<String> getMessages() {
        synchronized (ordered) {
            return List.copyOf(ordered);
        }
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
