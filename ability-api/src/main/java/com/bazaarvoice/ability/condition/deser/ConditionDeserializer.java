package com.bazaarvoice.ability.condition.deser;

import com.bazaarvoice.ability.condition.Condition;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;

public class ConditionDeserializer extends JsonDeserializer<Condition> {

    @Override
    public Condition deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
        Object raw = jp.readValueAs(Object.class);
        try {
            return ConditionParser.toCondition(raw);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(jp, e.getMessage(), e);
        }
    }
}
