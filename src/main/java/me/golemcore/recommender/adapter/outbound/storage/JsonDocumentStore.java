package me.golemcore.recommender.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.recommender.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * JSON (de)serialization on top of {@link StoragePort}. Shared by the
 * file-backed port adapters.
 */
@Component
@RequiredArgsConstructor
public class JsonDocumentStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public <T> Optional<T> read(String directory, String path, TypeReference<T> type) {
        String json = storagePort.getText(directory, path).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse " + directory + "/" + path, e);
        }
    }

    public <T> List<T> readList(String directory, String path, TypeReference<List<T>> type) {
        return read(directory, path, type).orElse(List.of());
    }

    public void writeAtomic(String directory, String path, Object value) {
        storagePort.putTextAtomic(directory, path, serialize(directory, path, value), true).join();
    }

    public void delete(String directory, String path) {
        storagePort.deleteObject(directory, path).join();
    }

    public List<String> list(String directory, String suffix) {
        return storagePort.listObjects(directory, "").join().stream()
                .filter(name -> name.endsWith(suffix))
                .toList();
    }

    private String serialize(String directory, String path, Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + directory + "/" + path, e);
        }
    }
}
