package uk.gegc.interviewledger.features.interview.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;

@Converter
public class ScoreReportConverter implements AttributeConverter<ScoreReport, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(ScoreReport attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize score report", e);
        }
    }

    @Override
    public ScoreReport convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, ScoreReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize score report", e);
        }
    }
}
