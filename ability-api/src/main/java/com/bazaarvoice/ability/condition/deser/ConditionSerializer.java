package com.bazaarvoice.ability.condition.deser;

import com.bazaarvoice.ability.condition.Condition;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes a condition as its JSON form rather than as a bean.
 */
public class ConditionSerializer extends JsonSerializer<Condition> {

    @Override
    public void serialize(Condition condition, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeRawValue(condition.toString());
    }
}
