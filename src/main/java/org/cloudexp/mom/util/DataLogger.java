/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends timestamped records to a global JSON-lines file. Nothing is written until
 * {@link #startDataLogging(Path)} is called.
 */
public class DataLogger {
    private static final Logger LOG = LogManager.getLogger(DataLogger.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Object WRITE_LOCK = new Object();
    private static volatile Path logFilePath = null;

    private final String logType;
    private final String logSource;

    public DataLogger(final String logType, final String logSource) {
        this.logType = logType;
        this.logSource = logSource;
    }

    public void appendData(final Map<String, ?> data, final double sampleStart, final double sampleEnd) {
        appendData(this.logType, this.logSource, data, sampleStart, sampleEnd);
    }

    public static void startDataLogging(final Path path) {
        logFilePath = path;
        LOG.info("Start logging data to: {}", path);
    }

    public static void stopDataLogging() {
        LOG.info("Stop logging data to: {}", logFilePath);
        logFilePath = null;
    }

    public static boolean isLogging() {
        return logFilePath != null;
    }

    public static void appendData(final String logType, final String logSource, final Map<String, ?> data,
            final double sampleStart, final double sampleEnd) {
        final Path path = logFilePath;
        if (path == null) {
            return;
        }

        final Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", logType);
        record.put("source", logSource);
        record.put("sample_start", sampleStart);
        record.put("sample_end", sampleEnd);
        record.put("interval", sampleEnd - sampleStart);
        if (data != null) {
            record.putAll(data);
        }

        synchronized (WRITE_LOCK) {
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(MAPPER.writeValueAsString(record));
                writer.write('\n');
            } catch (final IOException e) {
                LOG.warn("Failed to append {} record from {} to {}: {}", logType, logSource, path, e.toString());
            }
        }
    }

    /**
     * Read every record of a data log.
     *
     * @param path the log file
     * @return the records in write order
     * @throws IOException if the file cannot be read or holds an invalid record
     */
    public static List<Map<String, Object>> readDataLog(final Path path) throws IOException {
        final List<Map<String, Object>> ret = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    ret.add(MAPPER.readValue(line, new TypeReference<Map<String, Object>>() { }));
                }
            }
        }
        return ret;
    }
}
