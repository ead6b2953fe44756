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
package com.mediabridge.sync.config;

import com.mediabridge.sync.config.annotation.Option;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ConfigUtilTest {
    @Test
    public void testHyphenate() {
        Assertions.assertEquals("foo-bar-baz", ConfigUtil.hyphenate("fooBarBaz"));
        Assertions.assertEquals("foo-bar-baz", ConfigUtil.hyphenate("FooBarBaz"));
    }

    @Test
    public void testLabelize() {
        Assertions.assertEquals("Foo Bar Baz", ConfigUtil.labelize("fooBarBaz"));
        Assertions.assertEquals("Foo Bar Baz", ConfigUtil.labelize("FooBarBaz"));
    }

    @Test
    public void testCliOptionGeneration() {
        Options options = ConfigUtil.wrapperFor(Foo.class).getOptions();

        assertOption(options.getOption("my-value"), "my-value", 1, "my-value");
        assertOption(options.getOption("my-num"), "my-num", 1, "number");
        assertOption(options.getOption("my-flag"), "my-flag", -1, null);
        assertOption(options.getOption("no-default-on"), "no-default-on", -1, null);
        assertOption(options.getOption("my-list"), "my-list", org.apache.commons.cli.Option.UNLIMITED_VALUES, "my-list");
        Assertions.assertNull(options.getOption("xml-only"));
    }

    @Test
    public void testAdvancedOptionsCanBeHidden() {
        Options options = ConfigUtil.wrapperFor(Foo.class).getOptions(null, false);
        Assertions.assertNull(options.getOption("my-num"));
        Assertions.assertNotNull(options.getOption("my-value"));
    }

    @Test
    public void testParse() throws Exception {
        String[] args = {"--my-value", "hello", "--my-num", "42", "--my-flag", "--no-default-on", "--my-list", "a", "b"};

        ConfigWrapper<Foo> wrapper = ConfigUtil.wrapperFor(Foo.class);
        CommandLine commandLine = new DefaultParser().parse(wrapper.getOptions(), args);
        Foo foo = wrapper.parse(commandLine);

        Assertions.assertEquals("hello", foo.getMyValue());
        Assertions.assertEquals(42, foo.getMyNum());
        Assertions.assertTrue(foo.isMyFlag());
        Assertions.assertFalse(foo.isDefaultOn());
        Assertions.assertArrayEquals(new String[]{"a", "b"}, foo.getMyList());
    }

    @Test
    public void testParseEnumsAndPrefix() throws Exception {
        String[] args = {"--x-backup-mode", "mirror", "--x-media-filter", "videos", "--x-limit", "10"};

        ConfigWrapper<SyncOptions> wrapper = ConfigUtil.wrapperFor(SyncOptions.class);
        CommandLine commandLine = new DefaultParser().parse(wrapper.getOptions("x-", true), args);
        SyncOptions options = wrapper.parse(commandLine, "x-");

        Assertions.assertEquals(BackupMode.mirror, options.getBackupMode());
        Assertions.assertEquals(MediaFilter.videos, options.getMediaFilter());
        Assertions.assertEquals(10, options.getLimit());
        // untouched defaults
        Assertions.assertEquals(ExportMode.originals, options.getExportMode());
        Assertions.assertEquals(SyncOptions.DEFAULT_RETRY_ATTEMPTS, options.getRetryAttempts());
    }

    @Test
    public void testParseInvalidEnum() throws Exception {
        String[] args = {"--backup-mode", "sometimes"};

        ConfigWrapper<SyncOptions> wrapper = ConfigUtil.wrapperFor(SyncOptions.class);
        CommandLine commandLine = new DefaultParser().parse(wrapper.getOptions(), args);
        Assertions.assertThrows(ConfigurationException.class, () -> wrapper.parse(commandLine));
    }

    @Test
    public void testValidate() {
        UploadOptions upload = new UploadOptions().withServerUrl("http://localhost:2283");
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class, () -> ConfigUtil.validate(upload));
        Assertions.assertTrue(e.getMessage().contains("apiKey"));

        upload.setApiKey("secret");
        ConfigUtil.validate(upload);
    }

    @Test
    public void testSummarizeMasksSensitiveValues() {
        UploadOptions upload = new UploadOptions().withServerUrl("http://localhost:2283").withApiKey("secret");
        String summary = ConfigUtil.summarize(upload);
        Assertions.assertTrue(summary.contains("serverUrl: http://localhost:2283"));
        Assertions.assertFalse(summary.contains("secret"));
        Assertions.assertTrue(summary.contains("apiKey: " + ConfigWrapper.MASKED_VALUE));
        // properties are listed in order
        Assertions.assertTrue(summary.indexOf("serverUrl") < summary.indexOf("apiKey"));
    }

    @Test
    public void testUploadDefaults() {
        UploadOptions upload = new UploadOptions().withUploadConcurrency(1);
        Assertions.assertEquals(UploadOptions.MIN_IN_FLIGHT, upload.effectiveMaxInFlight());
        Assertions.assertEquals(1, upload.effectiveExistCheckConcurrency());

        upload.withUploadConcurrency(10);
        Assertions.assertEquals(40, upload.effectiveMaxInFlight());
        Assertions.assertEquals(UploadOptions.DEFAULT_EXIST_CHECK_CONCURRENCY, upload.effectiveExistCheckConcurrency());

        upload.withMaxInFlight(3);
        Assertions.assertEquals(3, upload.effectiveMaxInFlight());
    }

    private void assertOption(org.apache.commons.cli.Option option, String longOpt, int args, String argName) {
        Assertions.assertNotNull(option);
        Assertions.assertNull(option.getOpt());
        Assertions.assertEquals(longOpt, option.getLongOpt());
        Assertions.assertEquals(args, option.getArgs());
        Assertions.assertEquals(argName, option.getArgName());
    }

    public static class Foo {
        private String myValue;
        private int myNum;
        private boolean myFlag;
        private boolean defaultOn = true;
        private String[] myList;
        private String xmlOnly;

        @Option(orderIndex = 1, description = "my value")
        public String getMyValue() {
            return myValue;
        }

        public void setMyValue(String myValue) {
            this.myValue = myValue;
        }

        @Option(orderIndex = 2, advanced = true, valueHint = "number", description = "my number")
        public int getMyNum() {
            return myNum;
        }

        public void setMyNum(int myNum) {
            this.myNum = myNum;
        }

        @Option(orderIndex = 3, description = "my flag")
        public boolean isMyFlag() {
            return myFlag;
        }

        public void setMyFlag(boolean myFlag) {
            this.myFlag = myFlag;
        }

        @Option(orderIndex = 4, cliInverted = true, description = "on unless disabled")
        public boolean isDefaultOn() {
            return defaultOn;
        }

        public void setDefaultOn(boolean defaultOn) {
            this.defaultOn = defaultOn;
        }

        @Option(orderIndex = 5, description = "my list")
        public String[] getMyList() {
            return myList;
        }

        public void setMyList(String[] myList) {
            this.myList = myList;
        }

        @Option(orderIndex = 6, cli = false, description = "only settable in XML")
        public String getXmlOnly() {
            return xmlOnly;
        }

        public void setXmlOnly(String xmlOnly) {
            this.xmlOnly = xmlOnly;
        }
    }
}
