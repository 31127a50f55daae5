package com.autonomous.gateway.service;

import com.autonomous.gateway.model.CallOutcome;
import com.autonomous.gateway.model.CallRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps every finalized call record and, when a journal path is configured, appends it to
 * {@code calls.jsonl}.
 */
@Slf4j
@Service
public class CallJournalService {

    @Value("${gateway.journal.path:}")
    private String journalPath;

    private final ObjectMapper mapper;
    private final List<CallRecord> records = Collections.synchronizedList(new ArrayList<>());

    public CallJournalService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setJournalPath(String path) {
        this.journalPath = path;
    }

    public void record(CallRecord record) {
        if (!record.isFinalized()) {
            throw new IllegalArgumentException("Only finalized call records are journaled");
        }
        records.add(record);
        if (journalPath != null && !journalPath.isBlank()) {
            persistRecord(record);
        }
    }

    public List<CallRecord> getRecords() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public List<CallRecord> getRecords(String endpointId) {
        synchronized (records) {
            return records.stream()
                .filter(r -> endpointId.equals(r.getEndpointId()))
                .collect(Collectors.toList());
        }
    }

    public double getTotalSpend() {
        synchronized (records) {
            return records.stream()
                .filter(r -> r.getOutcome() == CallOutcome.SUCCESS)
                .mapToDouble(CallRecord::getCostUsd)
                .sum();
        }
    }

    private void persistRecord(CallRecord record) {
        try {
            Path journalFile = Paths.get(journalPath, "calls.jsonl");
            Files.createDirectories(journalFile.getParent());

            String json = mapper.writeValueAsString(record);
            synchronized (this) {
                Files.writeString(journalFile, json + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            log.error("Failed to persist call record for {}: {}", record.getEndpointId(), e.getMessage());
        }
    }
}
