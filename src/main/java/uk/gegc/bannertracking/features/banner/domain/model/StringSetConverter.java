package uk.gegc.bannertracking.features.banner.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stores a targeting facet as a JSON array of strings.
 */
@Converter
public class StringSetConverter implements AttributeConverter<Set<String>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashSet<String>> TYPE_REF = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Set<String> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize targeting facet", e);
        }
    }

    @Override
    public Set<String> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new LinkedHashSet<>();
        }
        try {
            Set<String> parsed = OBJECT_MAPPER.readValue(dbData, TYPE_REF);
            return parsed != null ? parsed : new LinkedHashSet<>();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize targeting facet", e);
        }
    }
}
