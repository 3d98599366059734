package com.drugbox.recognition.feature;

import com.drugbox.recognition.core.model.FeatureType;
import com.drugbox.recognition.core.model.FeatureVector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of stored images, for handing the visual store to external persistence.
 */
public class FeatureVectorCodec {

    private final ObjectMapper objectMapper;

    public FeatureVectorCodec() {
        this(new ObjectMapper());
    }

    public FeatureVectorCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(List<StoredImage> images) {
        try {
            return objectMapper.writeValueAsString(toDtos(images));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize visual store", e);
        }
    }

    public void write(List<StoredImage> images, OutputStream out) {
        try {
            objectMapper.writeValue(out, toDtos(images));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write visual store", e);
        }
    }

    public List<StoredImage> fromJson(String json) {
        try {
            return fromDtos(objectMapper.readValue(json, new TypeReference<List<ImageDto>>() {}));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse visual store", e);
        }
    }

    public List<StoredImage> read(InputStream in) {
        try {
            return fromDtos(objectMapper.readValue(in, new TypeReference<List<ImageDto>>() {}));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read visual store", e);
        }
    }

    private static List<ImageDto> toDtos(List<StoredImage> images) {
        List<ImageDto> out = new ArrayList<>(images.size());
        for (StoredImage image : images) {
            List<VectorDto> vectors = new ArrayList<>();
            for (FeatureVector v : image.features()) {
                vectors.add(new VectorDto(v.type(), v.values(), v.confidence()));
            }
            out.add(new ImageDto(image.imageId(), image.drugName(), vectors));
        }
        return out;
    }

    private static List<StoredImage> fromDtos(List<ImageDto> dtos) {
        List<StoredImage> out = new ArrayList<>(dtos.size());
        for (ImageDto dto : dtos) {
            List<FeatureVector> vectors = new ArrayList<>();
            if (dto.features() != null) {
                for (VectorDto v : dto.features()) {
                    vectors.add(new FeatureVector(v.type(), v.values(), v.confidence()));
                }
            }
            out.add(new StoredImage(dto.imageId(), dto.drugName(), vectors));
        }
        return out;
    }

    record ImageDto(String imageId, String drugName, List<VectorDto> features) {
    }

    record VectorDto(FeatureType type, double[] values, double confidence) {
    }
}
