package com.bazaarvoice.ability.condition;

import com.bazaarvoice.ability.condition.deser.ConditionDeserializer;
import com.bazaarvoice.ability.condition.deser.ConditionSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * A requirement an object, or one of its attributes, must satisfy to be permitted.  Conditions are immutable and
 * evaluating them has no side effects.
 * <p>
 * Use {@link Conditions} to create {@code Condition} objects.
 */
@JsonSerialize(using = ConditionSerializer.class)
@JsonDeserialize(using = ConditionDeserializer.class)
public interface Condition {

    <T, V> V visit(ConditionVisitor<T, V> visitor, @Nullable T context);

    /**
     * Returns the JSON form of the condition, parseable by {@link Conditions#fromJson(String)}.
     */
    String toString();

    void appendTo(Appendable buf) throws IOException;

    /**
     * A rough estimate of the cost of evaluating this condition.  Used only to order the attribute checks of a
     * {@link MapCondition} so cheap checks can short-circuit expensive ones.
     */
    int weight();

    boolean equals(@Nullable Object o);

    int hashCode();
}
