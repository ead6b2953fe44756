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

import com.mediabridge.sync.config.LogLevel;
import com.mediabridge.sync.config.annotation.Option;

public class CliConfig {
    private boolean help;
    private boolean version;
    private String xmlConfig;
    private LogLevel logLevel;
    private String[] source;
    private boolean folderBackup;
    private String jobName;
    private String sessionFile;
    private String errorReport;

    @Option(orderIndex = 10, description = "Displays this help content")
    public boolean isHelp() {
        return help;
    }

    public void setHelp(boolean help) {
        this.help = help;
    }

    @Option(orderIndex = 20, description = "Displays package version")
    public boolean isVersion() {
        return version;
    }

    public void setVersion(boolean version) {
        this.version = version;
    }

    @Option(orderIndex = 30, valueHint = "file", description = "Specifies an XML configuration file. In this mode, the XML file contains all of the configuration for the sync job and the source and sync options on the command line are ignored")
    public String getXmlConfig() {
        return xmlConfig;
    }

    public void setXmlConfig(String xmlConfig) {
        this.xmlConfig = xmlConfig;
    }

    @Option(orderIndex = 40, description = "Sets the verbosity of logging (silent|quiet|verbose|debug|trace). Default is quiet")
    public LogLevel getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(LogLevel logLevel) {
        this.logLevel = logLevel;
    }

    @Option(orderIndex = 50, valueHint = "folder",
            description = "The media library folder to read from. For a folder backup (--folder-backup), one or more plain folders whose files are copied by relative path")
    public String[] getSource() {
        return source;
    }

    public void setSource(String[] source) {
        this.source = source;
    }

    @Option(orderIndex = 60, description = "Copies the source folders file-by-file into the destination instead of treating the source as a media library")
    public boolean isFolderBackup() {
        return folderBackup;
    }

    public void setFolderBackup(boolean folderBackup) {
        this.folderBackup = folderBackup;
    }

    @Option(orderIndex = 70, description = "A name for this job, used in log output")
    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    @Option(orderIndex = 80, valueHint = "file", description = "Where the state of a paused run is kept. If the file exists, the run resumes from it (provided the configuration has not changed). It is removed when a run finishes without pausing")
    public String getSessionFile() {
        return sessionFile;
    }

    public void setSessionFile(String sessionFile) {
        this.sessionFile = sessionFile;
    }

    @Option(orderIndex = 90, valueHint = "file", description = "Writes a CSV report of every item that had an error to this file")
    public String getErrorReport() {
        return errorReport;
    }

    public void setErrorReport(String errorReport) {
        this.errorReport = errorReport;
    }
}
