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
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

public class ErrorReportWriterTest {
    @Test
    public void testOneRowPerErroredItem() throws Exception {
        SyncResult result = new SyncResult();
        result.setErrorIds(new LinkedHashSet<>(Arrays.asList("item-b", "item-a")));
        result.setFailedItems(Arrays.asList(
                new FailedItem("item-a", "original", "export failed: Timeout"),
                new FailedItem("item-a", "edited", "export failed: Unavailable, \"gone\""),
                new FailedItem("item-c", "video", "upload failed: status 500")));

        StringWriter writer = new StringWriter();
        int rows = new ErrorReportWriter(result).write(writer);
        Assertions.assertEquals(3, rows);

        List<CSVRecord> records = CSVFormat.EXCEL.parse(new StringReader(writer.toString())).getRecords();
        Assertions.assertEquals(4, records.size());
        Assertions.assertEquals("Item ID", records.get(0).get(0));
        Assertions.assertEquals("Error Message", records.get(0).get(3));

        // sorted by id, last failure wins
        Assertions.assertEquals("item-a", records.get(1).get(0));
        Assertions.assertEquals("edited", records.get(1).get(1));
        Assertions.assertEquals("export failed: Unavailable, \"gone\"", records.get(1).get(3));

        // errored without a recorded failure
        Assertions.assertEquals("item-b", records.get(2).get(0));
        Assertions.assertEquals("", records.get(2).get(3));

        Assertions.assertEquals("item-c", records.get(3).get(0));
        Assertions.assertEquals("upload failed: status 500", records.get(3).get(3));
    }

    @Test
    public void testEmptyReport() throws Exception {
        StringWriter writer = new StringWriter();
        Assertions.assertEquals(0, new ErrorReportWriter(new SyncResult()).write(writer));
        Assertions.assertEquals(1, CSVFormat.EXCEL.parse(new StringReader(writer.toString())).getRecords().size());
    }
}
