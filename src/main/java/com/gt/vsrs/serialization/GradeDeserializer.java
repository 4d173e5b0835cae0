package com.gt.vsrs.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.vsrs.model.Grade;
import org.springframework.stereotype.Component;

import java.io.IOException;

// Accepts the quality score written by GradeSerializer as well as the grade label ("Good")
@Component
public class GradeDeserializer extends JsonDeserializer<Grade> {
    @Override
    public Grade deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        try {
            if (jsonParser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
                return Grade.fromQuality(jsonParser.getIntValue());
            }

            return Grade.fromLabel(jsonParser.getValueAsString(""));
        } catch (IllegalArgumentException ex) {
            return (Grade) deserializationContext.handleWeirdStringValue(Grade.class, jsonParser.getText(), ex.getMessage());
        }
    }
}
