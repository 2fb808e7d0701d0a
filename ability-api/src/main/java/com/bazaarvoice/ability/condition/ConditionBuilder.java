package com.bazaarvoice.ability.condition;

public interface ConditionBuilder {

    Condition build();
}
