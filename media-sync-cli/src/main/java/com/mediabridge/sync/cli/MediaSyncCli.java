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

import com.mediabridge.sync.MediaSync;
import com.mediabridge.sync.RunControl;
import com.mediabridge.sync.SyncResult;
import com.mediabridge.sync.config.ConfigUtil;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.folder.FolderSync;
import com.mediabridge.sync.folder.FolderSyncResult;
import com.mediabridge.sync.remote.RemoteStoreException;
import com.mediabridge.sync.session.RunSession;
import com.mediabridge.sync.session.SessionStore;
import com.mediabridge.sync.storage.file.FilesystemAssetSource;
import com.mediabridge.sync.storage.http.JerseyRemoteStore;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point. Exit codes: 0 success, 1 configuration error, 2 unexpected error, 3 completed with errors.
 */
public class MediaSyncCli {
    private static final Logger log = LoggerFactory.getLogger(MediaSyncCli.class);

    public static final String VERSION = MediaSyncCli.class.getPackage().getImplementationVersion();

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_UNEXPECTED_ERROR = 2;
    public static final int EXIT_COMPLETED_WITH_ERRORS = 3;

    static final long SHUTDOWN_WAIT_SECONDS = 60;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        int exitCode = EXIT_OK;

        System.out.println(versionLine());

        try {
            // the JDK logger defaults to INFO
            java.util.logging.LogManager.getLogManager().getLogger("").setLevel(java.util.logging.Level.WARNING);

            CliConfig cliConfig = CliHelper.parseCliConfig(args);

            if (cliConfig != null) {

                if (cliConfig.getLogLevel() != null) LoggingUtil.setRootLogLevel(cliConfig.getLogLevel());

                // determine sync config
                SyncConfig syncConfig;
                if (cliConfig.getXmlConfig() != null) {
                    syncConfig = loadXmlFile(new File(cliConfig.getXmlConfig()));
                } else {
                    syncConfig = CliHelper.parseSyncConfig(cliConfig, args);
                }

                // this blocks until the run is complete
                exitCode = new MediaSyncCli(cliConfig, syncConfig, System.out).runJob();
            }
        } catch (ParseException | ConfigurationException e) {
            System.err.println(e.getMessage());
            System.out.println("    use --help for a detailed list of options");
            exitCode = EXIT_CONFIG_ERROR;
        } catch (Throwable t) {
            t.printStackTrace();
            exitCode = EXIT_UNEXPECTED_ERROR;
        }

        return exitCode;
    }

    static SyncConfig loadXmlFile(File xmlFile) {
        if (!xmlFile.isFile()) throw new ConfigurationException("XML config file not found: " + xmlFile);
        try {
            return (SyncConfig) JAXBContext.newInstance(SyncConfig.class).createUnmarshaller().unmarshal(xmlFile);
        } catch (JAXBException e) {
            throw new ConfigurationException("could not read XML config " + xmlFile + ": " + e, e);
        }
    }

    private static String versionLine() {
        return "media-sync" + (VERSION == null ? "" : " v" + VERSION);
    }

    private final CliConfig cliConfig;
    private final SyncConfig syncConfig;
    private final PrintStream out;
    private final RunControl runControl = new RunControl();
    private final CountDownLatch finished = new CountDownLatch(1);
    private SyncListener listener;

    public MediaSyncCli(CliConfig cliConfig, SyncConfig syncConfig, PrintStream out) {
        this.cliConfig = cliConfig;
        this.syncConfig = syncConfig;
        this.out = out;
        this.listener = new ConsoleListener(out, System.err);
    }

    public int runJob() throws IOException {
        ConfigUtil.validate(syncConfig.getOptions());
        if (syncConfig.getUpload() != null) ConfigUtil.validate(syncConfig.getUpload());
        if (syncConfig.getJobName() != null) log.info("starting job {}", syncConfig.getJobName());

        Thread hook = new Thread(this::onShutdown, "media-sync-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return syncConfig.isFolderBackup() ? runFolderBackup() : runMediaSync();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("shutdown already in progress");
            }
        }
    }

    /**
     * An interrupted process pauses (so the session can be saved) when a session file is configured, otherwise it
     * cancels. Either way the run gets a chance to wind down.
     */
    private void onShutdown() {
        if (finished.getCount() == 0) return;
        if (cliConfig.getSessionFile() != null) runControl.pause();
        else runControl.cancel();
        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS))
                log.warn("run did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private int runMediaSync() throws IOException {
        SyncOptions options = syncConfig.getOptions();
        if (syncConfig.getSources().size() != 1)
            throw new ConfigurationException("a media library sync reads exactly one source folder (got "
                    + syncConfig.getSources().size() + ")");
        File root = new File(syncConfig.getSources().get(0));
        if (!root.isDirectory()) throw new ConfigurationException("source folder not found: " + root);

        MediaSync sync = new MediaSync();
        sync.setSyncConfig(syncConfig);
        sync.setSource(new FilesystemAssetSource(root));
        sync.setListener(listener);
        sync.setRunControl(runControl);

        UploadOptions upload = syncConfig.getUpload();
        if (upload != null) sync.setRemoteStore(connect(upload, options));

        SessionStore sessionStore = null;
        if (cliConfig.getSessionFile() != null) {
            sessionStore = new SessionStore(new File(cliConfig.getSessionFile()));
            RunSession session = sessionStore.load();
            if (session != null) {
                out.println("Found saved session " + session.getSessionId());
                sync.setResumeSession(session);
            }
        }

        sync.run();
        SyncResult result = sync.getResult();

        // print completion stats
        out.print(sync.getStats().getStatsString());
        if (upload != null)
            out.println("Uploaded: " + result.getUploaded() + " Duplicates: " + result.getDuplicates()
                    + " Already on server: " + result.getSkippedExisting() + " Replaced: " + result.getReplaced()
                    + " Albums: " + result.getAlbumsSynced());
        if (result.getMirrorDeleted() > 0) out.println("Mirror deleted: " + result.getMirrorDeleted());

        if (result.isPaused()) {
            if (sessionStore != null) {
                sessionStore.save(result.getSession());
                out.println("Paused at item " + result.getPauseIndex() + "; run again with the same --session-file to resume");
            } else {
                out.println("Paused at item " + result.getPauseIndex() + " (no session file, progress will not be resumed)");
            }
        } else if (result.isCancelled()) {
            out.println("Cancelled");
        } else if (sessionStore != null) {
            sessionStore.clear();
        }

        if (cliConfig.getErrorReport() != null) {
            int rows = new ErrorReportWriter(result).write(new File(cliConfig.getErrorReport()));
            out.println("Wrote " + rows + " error(s) to " + cliConfig.getErrorReport());
        }

        return result.getErrors() > 0 ? EXIT_COMPLETED_WITH_ERRORS : EXIT_OK;
    }

    private JerseyRemoteStore connect(UploadOptions upload, SyncOptions options) {
        JerseyRemoteStore store = JerseyRemoteStore.fromOptions(upload, options);
        try {
            store.ping();
            log.info("connected to {}", upload.getServerUrl());
            return store;
        } catch (RemoteStoreException e) {
            store.close();
            throw new ConfigurationException("cannot reach server " + upload.getServerUrl() + ": " + e.getMessage(), e);
        }
    }

    private int runFolderBackup() {
        if (cliConfig.getErrorReport() != null) log.warn("--error-report is ignored for folder backups");
        if (cliConfig.getSessionFile() != null) log.warn("--session-file is ignored for folder backups");

        FolderSync folderSync = new FolderSync();
        folderSync.setSyncConfig(syncConfig);
        folderSync.setListener(listener);
        folderSync.setRunControl(runControl);
        folderSync.run();

        FolderSyncResult result = folderSync.getResult();
        out.println(result);
        return result.getErrors() > 0 ? EXIT_COMPLETED_WITH_ERRORS : EXIT_OK;
    }

    public RunControl getRunControl() {
        return runControl;
    }

    public void setListener(SyncListener listener) {
        this.listener = listener;
    }
}
