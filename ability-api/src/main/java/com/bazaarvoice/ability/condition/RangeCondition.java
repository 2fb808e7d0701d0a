package com.bazaarvoice.ability.condition;

import com.google.common.collect.Range;

/**
 * Matches numbers or strings that fall within a range.  Numbers are only ever compared with numbers and strings
 * with strings; a value of any other type is never in range.
 */
public interface RangeCondition extends Condition {

    Range<?> getRange();
}
