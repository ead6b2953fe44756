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

import com.mediabridge.sync.config.ConfigUtil;
import com.mediabridge.sync.config.ConfigWrapper;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;

public final class CliHelper {
    private static final CommandLineParser parser = new DefaultParser();

    static final String SERVER_URL_OPTION = "server-url";
    static final String API_KEY_OPTION = "api-key";

    public static CliConfig parseCliConfig(String[] args) throws ParseException {
        ConfigWrapper<CliConfig> wrapper = ConfigUtil.wrapperFor(CliConfig.class);
        CommandLine commandLine = parser.parse(allOptions(), args);
        CliConfig cliConfig = wrapper.parse(commandLine);

        if (cliConfig.isHelp() || cliConfig.isVersion()) {
            if (cliConfig.isHelp()) System.out.print(longHelp());
            return null;
        } else {
            if (cliConfig.getXmlConfig() == null
                    && (cliConfig.getSource() == null || cliConfig.getSource().length == 0)) {
                throw new ParseException("At least one source folder must be specified");
            }
            return cliConfig;
        }
    }

    public static SyncConfig parseSyncConfig(CliConfig cliConfig, String[] args) throws ParseException {
        CommandLine commandLine = parser.parse(allOptions(), args);

        SyncConfig syncConfig = new SyncConfig();
        syncConfig.setJobName(cliConfig.getJobName());
        syncConfig.setFolderBackup(cliConfig.isFolderBackup());
        syncConfig.getSources().addAll(Arrays.asList(cliConfig.getSource()));
        syncConfig.setOptions(ConfigUtil.wrapperFor(SyncOptions.class).parse(commandLine));

        // uploading is enabled by naming a server
        if (commandLine.hasOption(SERVER_URL_OPTION) || commandLine.hasOption(API_KEY_OPTION)) {
            syncConfig.setUpload(ConfigUtil.wrapperFor(UploadOptions.class).parse(commandLine));
        }

        return syncConfig;
    }

    static Options allOptions() {
        // main CLI options
        Options options = ConfigUtil.wrapperFor(CliConfig.class).getOptions();

        // sync options
        for (Option o : ConfigUtil.wrapperFor(SyncOptions.class).getOptions().getOptions()) {
            options.addOption(o);
        }

        // upload options
        for (Option o : ConfigUtil.wrapperFor(UploadOptions.class).getOptions().getOptions()) {
            options.addOption(o);
        }
        return options;
    }

    public static String longHelp() {
        StringWriter helpWriter = new StringWriter();
        PrintWriter pw = new PrintWriter(helpWriter);
        HelpFormatter fmt = new HelpFormatter();
        fmt.setWidth(79);

        String usage = "java -jar media-sync.jar --source <folder> [--destination <folder>] [--server-url <url> --api-key <key>] [options]";
        fmt.printHelp(pw, fmt.getWidth(), usage, "Common options:", ConfigUtil.wrapperFor(CliConfig.class).getOptions(),
                fmt.getLeftPadding(), fmt.getDescPadding(), null);

        pw.write('\n');
        pw.write("Sync options\n");
        fmt.printWrapped(pw, fmt.getWidth(), 4, "    Control which items are processed and where local copies go");
        fmt.printOptions(pw, fmt.getWidth(), ConfigUtil.wrapperFor(SyncOptions.class).getOptions(),
                fmt.getLeftPadding(), fmt.getDescPadding());

        pw.write('\n');
        pw.write("Upload options\n");
        fmt.printWrapped(pw, fmt.getWidth(), 4, "    Uploading is enabled when --" + SERVER_URL_OPTION + " is given; --"
                + API_KEY_OPTION + " is then required");
        fmt.printOptions(pw, fmt.getWidth(), ConfigUtil.wrapperFor(UploadOptions.class).getOptions(),
                fmt.getLeftPadding(), fmt.getDescPadding());

        pw.flush();
        return helpWriter.toString();
    }

    private CliHelper() {
    }
}
