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

import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlRootElement;
import javax.xml.bind.annotation.XmlType;
import java.util.ArrayList;
import java.util.List;

/**
 * A complete job: where items come from, how they are processed and where they go.
 */
@XmlRootElement
@XmlType(propOrder = {"jobName", "folderBackup", "sources", "options", "upload"})
public class SyncConfig {
    private String jobName;
    private boolean folderBackup;
    private List<String> sources = new ArrayList<>();
    private SyncOptions options = new SyncOptions();
    private UploadOptions upload;

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    /**
     * When true, the sources are copied file-by-file into the destination by relative path instead of being treated
     * as media libraries
     */
    public boolean isFolderBackup() {
        return folderBackup;
    }

    public void setFolderBackup(boolean folderBackup) {
        this.folderBackup = folderBackup;
    }

    @XmlElementWrapper(name = "sources")
    @XmlElement(name = "source")
    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public SyncOptions getOptions() {
        return options;
    }

    public void setOptions(SyncOptions options) {
        this.options = options;
    }

    public UploadOptions getUpload() {
        return upload;
    }

    public void setUpload(UploadOptions upload) {
        this.upload = upload;
    }

    public SyncConfig withJobName(String jobName) {
        setJobName(jobName);
        return this;
    }

    public SyncConfig withFolderBackup(boolean folderBackup) {
        setFolderBackup(folderBackup);
        return this;
    }

    public SyncConfig withSources(List<String> sources) {
        setSources(sources);
        return this;
    }

    public SyncConfig withOptions(SyncOptions options) {
        setOptions(options);
        return this;
    }

    public SyncConfig withUpload(UploadOptions upload) {
        setUpload(upload);
        return this;
    }
}
