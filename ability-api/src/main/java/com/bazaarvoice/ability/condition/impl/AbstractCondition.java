package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.json.JsonHelper;
import com.google.common.base.Throwables;

import javax.annotation.Nullable;
import java.io.IOException;

public abstract class AbstractCondition implements Condition {

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        try {
            appendTo(buf);
        } catch (IOException e) {
            Throwables.throwIfUnchecked(e);
            throw new RuntimeException(e);
        }
        return buf.toString();
    }

    /**
     * Default weight for all conditions is 1.  Conditions which are more complex than a trivial check should return
     * a higher value.
     */
    @Override
    public int weight() {
        return 1;
    }

    protected static void appendJson(Appendable buf, @Nullable Object value) throws IOException {
        buf.append(JsonHelper.asJson(value));
    }
}
