/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mediabridge.sync.cli;

import com.mediabridge.sync.FailedItem;
import com.mediabridge.sync.SyncResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes one CSV row per errored item with the last error recorded for it.
 */
public class ErrorReportWriter {
    private final SimpleDateFormat formatter = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ssZ");

    private final Set<String> errorIds;
    private final Map<String, FailedItem> lastFailures = new HashMap<>();

    public ErrorReportWriter(SyncResult result) {
        this.errorIds = new TreeSet<>(result.getErrorIds());
        for (FailedItem failedItem : result.getFailedItems()) {
            errorIds.add(failedItem.getItemId());
            FailedItem previous = lastFailures.get(failedItem.getItemId());
            if (previous == null || previous.getFailedAt() <= failedItem.getFailedAt())
                lastFailures.put(failedItem.getItemId(), failedItem);
        }
    }

    protected String[] getHeaders() {
        return new String[]{"Item ID", "Variant", "Failed At", "Error Message"};
    }

    protected Object[] getColumns(String itemId) {
        FailedItem failure = lastFailures.get(itemId);
        if (failure == null) return new Object[]{itemId, "", "", ""};
        String variant = failure.getVariant() == null ? "" : failure.getVariant();
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        return new Object[]{itemId, variant, formatter.format(new Date(failure.getFailedAt())), message};
    }

    public int write(Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.EXCEL);
        printer.printRecord((Object[]) getHeaders());
        for (String itemId : errorIds) {
            printer.printRecord(getColumns(itemId));
        }
        printer.flush();
        return errorIds.size();
    }

    public int write(File file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            return write(writer);
        }
    }
}
