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
package com.mediabridge.sync.storage.http;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;
import com.mediabridge.sync.placement.OutputLayout;
import com.mediabridge.sync.remote.BulkCheckItem;
import com.mediabridge.sync.remote.BulkCheckResult;
import com.mediabridge.sync.remote.RemoteAlbum;
import com.mediabridge.sync.remote.RemoteAsset;
import com.mediabridge.sync.remote.RemoteStore;
import com.mediabridge.sync.remote.RemoteStoreException;
import com.mediabridge.sync.remote.ServerStats;
import com.mediabridge.sync.remote.UploadRequest;
import com.mediabridge.sync.remote.UploadResult;
import com.sun.jersey.api.client.Client;
import com.sun.jersey.api.client.ClientHandlerException;
import com.sun.jersey.api.client.ClientResponse;
import com.sun.jersey.api.client.WebResource;
import com.sun.jersey.api.client.config.ClientConfig;
import com.sun.jersey.api.client.config.DefaultClientConfig;
import com.sun.jersey.core.header.FormDataContentDisposition;
import com.sun.jersey.multipart.FormDataMultiPart;
import com.sun.jersey.multipart.file.FileDataBodyPart;
import com.sun.jersey.multipart.impl.MultiPartWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.UriBuilder;
import java.io.File;
import java.net.URI;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link RemoteStore} speaking the photo server's JSON-over-HTTP API through a Jersey client. Every request carries
 * the API key header; uploads are multipart with the content checksum in a request header. The instance keeps no
 * per-request state and is shared by all upload, hash and check workers.
 */
public class JerseyRemoteStore implements RemoteStore {
    private static final Logger log = LoggerFactory.getLogger(JerseyRemoteStore.class);

    public static final String API_KEY_HEADER = "x-api-key";
    public static final String CHECKSUM_HEADER = "x-immich-checksum";
    public static final String ASSET_DATA_FIELD = "assetData";
    public static final int CHUNK_SIZE = 64 * 1024;

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final MediaType JSON = MediaType.APPLICATION_JSON_TYPE;

    /**
     * Builds a store from the upload settings; the read timeout follows the per-request timeout of the run.
     */
    public static JerseyRemoteStore fromOptions(UploadOptions upload, SyncOptions options) {
        if (upload.getServerUrl() == null || upload.getServerUrl().trim().isEmpty())
            throw new ConfigurationException("upload server URL is required");
        if (upload.getApiKey() == null || upload.getApiKey().trim().isEmpty())
            throw new ConfigurationException("upload API key is required");
        return new JerseyRemoteStore(upload.getServerUrl(), upload.getApiKey(), upload.getConnectTimeoutSeconds(),
                options.getRequestTimeoutSeconds());
    }

    /**
     * Accepts either the server root or the API root; {@code /api} is appended when missing.
     */
    static URI apiBase(String serverUrl) {
        String url = serverUrl.trim();
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        if (!url.endsWith("/api")) url += "/api";
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid server URL: " + serverUrl, e);
        }
    }

    static String mimeType(String filename) {
        switch (OutputLayout.extension(filename, "")) {
            case "jpg":
            case "jpeg":
                return "image/jpeg";
            case "heic":
                return "image/heic";
            case "heif":
                return "image/heif";
            case "png":
                return "image/png";
            case "gif":
                return "image/gif";
            case "tif":
            case "tiff":
                return "image/tiff";
            case "dng":
                return "image/x-adobe-dng";
            case "mov":
                return "video/quicktime";
            case "mp4":
            case "m4v":
                return "video/mp4";
            case "aae":
                return "application/xml";
            default:
                return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private final URI apiBase;
    private final String apiKey;
    private final Client client;
    private final Gson gson = new Gson();

    public JerseyRemoteStore(String serverUrl, String apiKey, int connectTimeoutSeconds, int readTimeoutSeconds) {
        this.apiBase = apiBase(serverUrl);
        this.apiKey = apiKey;

        ClientConfig cc = new DefaultClientConfig();
        cc.getClasses().add(MultiPartWriter.class);
        cc.getProperties().put(ClientConfig.PROPERTY_CONNECT_TIMEOUT, connectTimeoutSeconds * 1000);
        cc.getProperties().put(ClientConfig.PROPERTY_READ_TIMEOUT, readTimeoutSeconds * 1000);
        // stream large media instead of buffering it in memory
        cc.getProperties().put(ClientConfig.PROPERTY_CHUNKED_ENCODING_SIZE, CHUNK_SIZE);
        this.client = Client.create(cc);
        log.info("remote store API at {}", apiBase);
    }

    @Override
    public void ping() {
        JsonObject response = call("ping", "GET", resource("server", "ping"), null, JsonObject.class);
        log.debug("ping response: {}", response);
    }

    @Override
    public ServerStats getStatistics() {
        return call("asset statistics", "GET", resource("assets", "statistics"), null, ServerStats.class);
    }

    @Override
    public Set<String> checkExisting(String deviceId, List<String> deviceAssetIds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deviceId", deviceId);
        body.put("deviceAssetIds", deviceAssetIds);
        ExistResponse response = call("existence check", "POST", resource("assets", "exist"), body,
                ExistResponse.class);
        return response == null || response.existingIds == null
                ? new HashSet<>() : new HashSet<>(response.existingIds);
    }

    @Override
    public List<BulkCheckResult> bulkUploadCheck(List<BulkCheckItem> items) {
        BulkCheckResponse response = call("bulk upload check", "POST", resource("assets", "bulk-upload-check"),
                Collections.singletonMap("assets", items), BulkCheckResponse.class);
        return response == null || response.results == null ? new ArrayList<>() : response.results;
    }

    @Override
    public UploadResult upload(UploadRequest request) {
        File file = request.getFile();
        FormDataMultiPart form = new FormDataMultiPart();
        try {
            form.field("deviceId", request.getDeviceId());
            form.field("deviceAssetId", request.getDeviceAssetId());
            form.field("fileCreatedAt", TIMESTAMP_FORMAT.format(request.getFileCreatedAt()));
            form.field("fileModifiedAt", TIMESTAMP_FORMAT.format(request.getFileModifiedAt()));
            form.field("filename", request.getFilename());
            if (request.getDurationSeconds() != null)
                form.field("duration", String.valueOf(request.getDurationSeconds()));
            if (request.getFavorite() != null) form.field("isFavorite", String.valueOf(request.getFavorite()));
            if (request.getLivePhotoVideoId() != null) form.field("livePhotoVideoId", request.getLivePhotoVideoId());
            form.field("metadata", gson.toJson(request.getMetadata() == null
                    ? Collections.emptyList() : request.getMetadata()));

            FileDataBodyPart filePart = new FileDataBodyPart(ASSET_DATA_FIELD, file,
                    MediaType.valueOf(mimeType(request.getFilename())));
            filePart.setContentDisposition(FormDataContentDisposition.name(ASSET_DATA_FIELD)
                    .fileName(request.getFilename()).size(file.length()).build());
            form.bodyPart(filePart);

            WebResource.Builder builder = resource("assets")
                    .type(MediaType.MULTIPART_FORM_DATA_TYPE)
                    .accept(JSON)
                    .header(API_KEY_HEADER, apiKey);
            if (request.getChecksum() != null) builder = builder.header(CHECKSUM_HEADER, request.getChecksum());

            log.debug("uploading {} ({} bytes) as {}", file, file.length(), request.getDeviceAssetId());
            ClientResponse response;
            try {
                response = builder.post(ClientResponse.class, form);
            } catch (ClientHandlerException e) {
                throw new RemoteStoreException("upload of " + request.getDeviceAssetId() + " failed: "
                        + e.getMessage(), e);
            }
            return readEntity("upload", response, UploadResult.class);
        } finally {
            try {
                form.cleanup();
            } catch (RuntimeException e) {
                log.debug("could not clean up multipart form", e);
            }
        }
    }

    @Override
    public List<RemoteAlbum> listAlbums() {
        List<RemoteAlbum> albums = call("list albums", "GET", resource("albums"), null,
                new TypeToken<List<RemoteAlbum>>() {
                }.getType());
        return albums == null ? new ArrayList<>() : albums;
    }

    @Override
    public RemoteAlbum createAlbum(String albumName) {
        return call("create album", "POST", resource("albums"), Collections.singletonMap("albumName", albumName),
                RemoteAlbum.class);
    }

    @Override
    public void putAlbumAssets(String albumId, List<String> assetIds) {
        call("add album assets", "PUT", resource("albums", albumId, "assets"),
                Collections.singletonMap("ids", assetIds), null);
    }

    @Override
    public void postAlbumAssets(String albumId, List<String> assetIds) {
        call("add album assets", "POST", resource("albums", albumId, "assets"),
                Collections.singletonMap("ids", assetIds), null);
    }

    /**
     * Tries the current lookup route first and the legacy one second; any failure of a route moves on to the next.
     */
    @Override
    public RemoteAsset findByDeviceAssetId(String deviceId, String deviceAssetId) {
        List<WebResource> routes = new ArrayList<>();
        routes.add(resource("assets", "device", deviceId, deviceAssetId));
        routes.add(resource("assets", "assetByDeviceId", deviceId, deviceAssetId));
        for (WebResource route : routes) {
            try {
                RemoteAsset asset = call("asset lookup", "GET", route, null, RemoteAsset.class);
                if (asset != null && asset.getId() != null) return asset;
            } catch (RemoteStoreException | JsonParseException e) {
                log.debug("lookup of {} via {} failed: {}", deviceAssetId, route.getURI(), e.toString());
            }
        }
        return null;
    }

    @Override
    public void deleteAssets(List<String> assetIds) {
        call("delete assets", "DELETE", resource("assets"), Collections.singletonMap("ids", assetIds), null);
    }

    @Override
    public RemoteAsset getAsset(String assetId) {
        return call("get asset", "GET", resource("assets", assetId), null, RemoteAsset.class);
    }

    @Override
    public RemoteAsset updateAsset(String assetId, Map<String, Object> fields) {
        return call("update asset", "PUT", resource("assets", assetId), fields, RemoteAsset.class);
    }

    @Override
    public void close() {
        client.destroy();
    }

    /**
     * each segment is encoded on its own, so ids containing slashes stay one path segment
     */
    WebResource resource(String... segments) {
        return client.resource(UriBuilder.fromUri(apiBase).segment(segments).build());
    }

    private <T> T call(String operation, String method, WebResource resource, Object body, java.lang.reflect.Type type) {
        WebResource.Builder builder = resource.accept(JSON).header(API_KEY_HEADER, apiKey);
        ClientResponse response;
        try {
            if (body == null) {
                response = builder.method(method, ClientResponse.class);
            } else {
                response = builder.type(JSON).method(method, ClientResponse.class, gson.toJson(body));
            }
        } catch (ClientHandlerException e) {
            throw new RemoteStoreException(operation + " failed: " + e.getMessage(), e);
        }
        return readEntity(operation, response, type);
    }

    private <T> T readEntity(String operation, ClientResponse response, java.lang.reflect.Type type) {
        try {
            int status = response.getStatus();
            // getEntity() refuses to read a 204 body
            String entity = status != ClientResponse.Status.NO_CONTENT.getStatusCode() && response.hasEntity()
                    ? response.getEntity(String.class) : null;
            if (status < 200 || status > 299) throw new RemoteStoreException(operation, status, entity);
            log.trace("{} -> {}: {}", operation, status, entity);
            if (type == null || entity == null || entity.trim().isEmpty()) return null;
            return gson.fromJson(entity, type);
        } catch (ClientHandlerException e) {
            throw new RemoteStoreException(operation + " failed reading response: " + e.getMessage(), e);
        } finally {
            response.close();
        }
    }

    public URI getApiBase() {
        return apiBase;
    }

    private static class ExistResponse {
        List<String> existingIds;
    }

    private static class BulkCheckResponse {
        List<BulkCheckResult> results;
    }
}
