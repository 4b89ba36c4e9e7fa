package com.shomee.spices.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

import com.shomee.spices.config.AppConfig;
import com.shomee.spices.dto.DiagnosticsReport;
import com.shomee.spices.store.DocumentStore;

/**
 * Backs the {@code GET /test} probe. Every failure ends up as text in the
 * report; {@link #probe()} itself never throws.
 */
@Service
public class DiagnosticsService {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsService.class);

    static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;

    static final String BACKEND_RUNNING = "✅ Running";
    static final String DATABASE_WORKING = "✅ Connected & Working";
    static final String DATABASE_ERROR_PREFIX = "❌ Error: ";
    static final String DATABASE_PARTIAL_PREFIX = "⚠️  Connected but Error: ";
    static final String CONNECTED = "Connected";
    static final String NOT_CONNECTED = "Not Connected";
    static final String SET = "✅ Set";
    static final String NOT_SET = "❌ Not Set";

    private final DocumentStore documentStore;
    private final AppConfig config;

    public DiagnosticsService(DocumentStore documentStore, AppConfig config) {
        this.documentStore = documentStore;
        this.config = config;
    }

    public DiagnosticsReport probe() {
        String database;
        String connectionStatus = NOT_CONNECTED;
        List<String> collections = List.of();

        try {
            String name = documentStore.databaseName();
            connectionStatus = CONNECTED;
            logger.atDebug().log("Resolved database {}", name);
            try {
                List<String> names = documentStore.listCollectionNames();
                collections = List.copyOf(names.subList(0, Math.min(MAX_COLLECTIONS, names.size())));
                database = DATABASE_WORKING;
            } catch (RuntimeException e) {
                logger.atWarn().log("Collection listing failed: {}", e.getMessage());
                database = DATABASE_PARTIAL_PREFIX + truncate(e);
            }
        } catch (RuntimeException e) {
            logger.atWarn().log("Database connection failed: {}", e.getMessage());
            database = DATABASE_ERROR_PREFIX + truncate(e);
        }

        var store = config.store();
        return new DiagnosticsReport(
            BACKEND_RUNNING,
            database,
            store.urlConfigured() ? SET : NOT_SET,
            store.nameConfigured() ? SET : NOT_SET,
            connectionStatus,
            collections
        );
    }

    // innermost cause carries the driver's message
    static String truncate(Throwable e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
