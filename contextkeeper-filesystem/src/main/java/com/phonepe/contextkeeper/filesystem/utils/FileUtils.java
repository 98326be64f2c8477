/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.contextkeeper.filesystem.utils;


import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable, writable directory. If the path does not exist and
     * createIfNotExists is true, the directory and its parents are created.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized directory path
     * @throws IllegalArgumentException If the path is not a usable directory
     */
    public static Path ensurePath(Path path, boolean createIfNotExists) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.debug("Created directory {}", absolutePath);
            }
            catch (IOException e) {
                throw new IllegalArgumentException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException("Sanity check for %s failed. Please check it is a directory and has the required permissions"
                    .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Writes data to a dot-prefixed temporary file next to the target and moves it into place, so a reader never
     * sees a partially written file.
     */
    public static void writeAtomically(Path filePath, byte[] data) throws IOException {
        final var tmpPath = filePath.resolveSibling("." + filePath.getFileName() + ".tmp");
        Files.write(tmpPath, data,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tmpPath, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (IOException e) {
            Files.deleteIfExists(tmpPath);
            throw e;
        }
    }

    /**
     * Makes an id safe to use as a file name
     */
    public static String sanitize(String id) {
        return id.replace("..", "_")
                .replace("/", "_")
                .replace("\\", "_")
                .replace("\0", "_");
    }
}
