package com.bazaarvoice.ability.condition;

import javax.annotation.Nullable;

public interface EqualCondition extends Condition {

    @Nullable
    Object getValue();
}
