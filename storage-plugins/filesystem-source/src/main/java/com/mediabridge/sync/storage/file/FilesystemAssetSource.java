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
package com.mediabridge.sync.storage.file;

import com.mediabridge.sync.MediaSync;
import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.MediaKind;
import com.mediabridge.sync.model.SourceAlbum;
import com.mediabridge.sync.model.Variant;
import com.mediabridge.sync.model.VariantType;
import com.mediabridge.sync.placement.OutputLayout;
import com.mediabridge.sync.source.AssetSource;
import com.mediabridge.sync.source.ExportException;
import com.mediabridge.sync.source.ExportProgress;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Media library backed by a directory tree. Images and videos become items; a video sharing an image's base name in
 * the same folder is that image's paired (live) video, a same-named {@code .aae} file its adjustment data and a
 * {@code {base}_edited.*} image its edited rendition. Every sub-folder holding media is an album.
 */
public class FilesystemAssetSource implements AssetSource {
    private static final Logger log = LoggerFactory.getLogger(FilesystemAssetSource.class);

    public static final String NAME = "filesystem";
    public static final String EDITED_SUFFIX = "_edited";

    static final Set<String> IMAGE_EXTENSIONS = new HashSet<>(Arrays.asList(
            "jpg", "jpeg", "heic", "heif", "png", "gif", "tif", "tiff", "dng", "webp"));
    static final Set<String> VIDEO_EXTENSIONS = new HashSet<>(Arrays.asList(
            "mov", "mp4", "m4v", "3gp", "avi"));
    static final String ADJUSTMENTS_EXTENSION = "aae";

    private static final int BUFFER_SIZE = 128 * 1024;

    private final File root;
    private boolean followLinks;
    private boolean includeHiddenFiles;

    private Map<String, ItemFiles> index;

    public FilesystemAssetSource(File root) {
        this.root = root;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public synchronized List<CandidateItem> listItems() throws ExportException {
        index = scan();
        List<CandidateItem> items = new ArrayList<>();
        for (ItemFiles files : index.values()) {
            items.add(files.toItem());
        }
        log.info("found {} item(s) under {}", items.size(), root);
        return items;
    }

    @Override
    public synchronized List<SourceAlbum> listAlbums() throws ExportException {
        if (index == null) index = scan();
        Map<String, Set<String>> membersByFolder = new LinkedHashMap<>();
        for (ItemFiles files : index.values()) {
            if (files.folder.isEmpty()) continue;
            membersByFolder.computeIfAbsent(files.folder, k -> new LinkedHashSet<>()).add(files.id);
        }
        List<SourceAlbum> albums = new ArrayList<>();
        membersByFolder.forEach((folder, ids) ->
                albums.add(new SourceAlbum(folder, new File(folder).getName(), ids)));
        return albums;
    }

    @Override
    public void export(CandidateItem item, Variant variant, File target, ExportProgress progress)
            throws ExportException {
        ItemFiles files;
        synchronized (this) {
            files = index == null ? null : index.get(item.getId());
        }
        if (files == null) throw new ExportException(ExportException.Type.Unavailable, "unknown item " + item.getId());

        File file = files.fileFor(variant.getType());
        if (file == null) {
            throw new ExportException(ExportException.Type.Unavailable,
                    "item " + item.getId() + " has no " + variant.getType() + " variant");
        }
        if (!file.isFile()) throw new ExportException(ExportException.Type.Unavailable, file + " no longer exists");

        long total = file.length(), copied = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file.toPath());
             OutputStream out = Files.newOutputStream(target.toPath())) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted())
                    throw new ExportException(ExportException.Type.Cancelled, "export of " + file + " interrupted");
                out.write(buffer, 0, read);
                copied += read;
                if (progress != null && total > 0) progress.onProgress((double) copied / total);
            }
        } catch (IOException e) {
            throw new ExportException(ExportException.Type.Failed, "could not read " + file + ": " + e.getMessage(), e);
        }
        if (progress != null) progress.onProgress(1.0);
    }

    private Map<String, ItemFiles> scan() throws ExportException {
        if (!root.isDirectory()) throw new ExportException(ExportException.Type.Unavailable, "source folder " + root + " does not exist");

        Map<String, ItemFiles> groups = new LinkedHashMap<>();
        try {
            scanDirectory(root.toPath(), groups);
        } catch (IOException e) {
            throw new ExportException(ExportException.Type.Failed, "could not scan " + root + ": " + e.getMessage(), e);
        }

        // orphaned sidecars and edits without a primary file are folded in or dropped here
        Map<String, ItemFiles> byId = new LinkedHashMap<>();
        for (ItemFiles files : groups.values()) {
            if (files.primary() == null) {
                if (files.edited == null) {
                    log.debug("ignoring {} without a matching image or video", files.adjustments);
                    continue;
                }
                files.still = files.edited;
                files.edited = null;
            }
            files.id = idFor(files.primary());
            byId.put(files.id, files);
        }
        return byId;
    }

    private void scanDirectory(Path dir, Map<String, ItemFiles> groups) throws IOException {
        String folder = root.toPath().relativize(dir).toString().replace('\\', '/');
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, new SourceFilter())) {
            for (Path child : stream) {
                children.add(child);
            }
        }
        Collections.sort(children);

        for (Path child : children) {
            if (Files.isDirectory(child, linkOptions())) {
                scanDirectory(child, groups);
                continue;
            }
            if (!Files.isRegularFile(child, linkOptions())) continue;

            File file = child.toFile();
            String name = file.getName();
            String ext = OutputLayout.extension(name, "");
            int dot = name.lastIndexOf('.');
            String base = dot > 0 ? name.substring(0, dot) : name;
            boolean edited = base.toLowerCase(Locale.ROOT).endsWith(EDITED_SUFFIX) && IMAGE_EXTENSIONS.contains(ext);
            if (edited) base = base.substring(0, base.length() - EDITED_SUFFIX.length());
            String key = folder + "/" + base.toLowerCase(Locale.ROOT);

            ItemFiles files = groups.computeIfAbsent(key, k -> new ItemFiles(folder));
            if (edited) {
                files.edited = file;
            } else if (IMAGE_EXTENSIONS.contains(ext)) {
                if (files.still != null) files = groups.computeIfAbsent(key + "." + ext, k -> new ItemFiles(folder));
                files.still = file;
            } else if (VIDEO_EXTENSIONS.contains(ext)) {
                if (files.video != null) files = groups.computeIfAbsent(key + "." + ext, k -> new ItemFiles(folder));
                files.video = file;
            } else if (ADJUSTMENTS_EXTENSION.equals(ext)) {
                files.adjustments = file;
            } else {
                log.debug("skipping non-media file {}", file);
            }
        }
    }

    String idFor(File primary) {
        String relPath = SyncUtil.relativePath(root, primary);
        return UUID.nameUUIDFromBytes(relPath.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private class SourceFilter implements DirectoryStream.Filter<Path> {
        @Override
        public boolean accept(Path path) {
            String name = path.getFileName().toString();
            if (MediaSync.MANIFEST_DIR.equals(name) || MediaSync.WORK_DIR.equals(name)) return false;
            if (!includeHiddenFiles && name.startsWith(".")) return false;
            return followLinks || !Files.isSymbolicLink(path);
        }
    }

    private class ItemFiles {
        final String folder;
        String id;
        File still, video, adjustments, edited;

        ItemFiles(String folder) {
            this.folder = folder;
        }

        File primary() {
            return still != null ? still : video;
        }

        File fileFor(VariantType type) {
            switch (type) {
                case original:
                    return still;
                case pairedVideo:
                    return still != null ? video : null;
                case video:
                    return still == null ? video : null;
                case adjustments:
                    return adjustments;
                case edited:
                    // without an edited rendition the original is the rendering
                    return edited != null ? edited : still;
                default:
                    return null;
            }
        }

        CandidateItem toItem() {
            List<Variant> variants = new ArrayList<>();
            MediaKind kind;
            if (still != null) {
                kind = MediaKind.image;
                variants.add(new Variant(VariantType.original, still.getName()));
                if (video != null) variants.add(new Variant(VariantType.pairedVideo, video.getName()));
                if (adjustments != null) variants.add(new Variant(VariantType.adjustments, adjustments.getName()));
                if (edited != null) variants.add(new Variant(VariantType.edited, edited.getName()));
            } else {
                kind = MediaKind.video;
                variants.add(new Variant(VariantType.video, video.getName()));
            }

            Instant createdAt = null, modifiedAt = null;
            try {
                BasicFileAttributes attrs = Files.readAttributes(primary().toPath(), BasicFileAttributes.class,
                        linkOptions());
                modifiedAt = attrs.lastModifiedTime().toInstant();
                // creation time falls back to mtime where the filesystem does not keep one
                createdAt = attrs.creationTime() == null ? modifiedAt : attrs.creationTime().toInstant();
                if (createdAt.isAfter(modifiedAt)) createdAt = modifiedAt;
            } catch (IOException e) {
                log.warn("could not read attributes of {}: {}", primary(), e.toString());
            }
            return new CandidateItem(id, kind, createdAt, modifiedAt, still != null && video != null, false, null,
                    variants);
        }
    }

    public File getRoot() {
        return root;
    }

    public boolean isFollowLinks() {
        return followLinks;
    }

    public void setFollowLinks(boolean followLinks) {
        this.followLinks = followLinks;
    }

    public boolean isIncludeHiddenFiles() {
        return includeHiddenFiles;
    }

    public void setIncludeHiddenFiles(boolean includeHiddenFiles) {
        this.includeHiddenFiles = includeHiddenFiles;
    }
}
