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
package com.mediabridge.sync.util;

import javax.xml.bind.DatatypeConverter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * A content digest of a file together with the number of bytes that went into it.
 */
public class Checksum {
    public static final String SHA1 = "SHA-1";
    public static final String SHA256 = "SHA-256";

    public static Checksum of(String algorithm, File file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("unsupported digest algorithm " + algorithm, e);
        }
        long size = 0;
        byte[] buffer = new byte[SyncUtil.DEFAULT_BUFFER_SIZE];
        try (InputStream in = new DigestInputStream(Files.newInputStream(file.toPath()), digest)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                size += read;
            }
        }
        return new Checksum(algorithm, digest.digest(), size);
    }

    public static Checksum sha1(File file) throws IOException {
        return of(SHA1, file);
    }

    public static Checksum sha256(File file) throws IOException {
        return of(SHA256, file);
    }

    private final String algorithm;
    private final byte[] value;
    private final long size;

    private Checksum(String algorithm, byte[] value, long size) {
        this.algorithm = algorithm;
        this.value = value;
        this.size = size;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public byte[] getValue() {
        return value;
    }

    public long getSize() {
        return size;
    }

    public String getHexValue() {
        return DatatypeConverter.printHexBinary(value).toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checksum)) return false;

        Checksum checksum = (Checksum) o;

        if (size != checksum.size) return false;
        if (!algorithm.equals(checksum.algorithm)) return false;
        return Arrays.equals(value, checksum.value);
    }

    @Override
    public int hashCode() {
        int result = algorithm.hashCode();
        result = 31 * result + Arrays.hashCode(value);
        result = 31 * result + Long.hashCode(size);
        return result;
    }

    @Override
    public String toString() {
        return algorithm + ":" + getHexValue();
    }
}
