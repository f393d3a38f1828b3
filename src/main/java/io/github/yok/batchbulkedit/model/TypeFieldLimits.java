package io.github.yok.batchbulkedit.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Maximum number of populated type fields accepted per node variant.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class TypeFieldLimits {

    /**
     * Defaults: a Parameter carries exactly one data type; a deferred FormulaValue carries its
     * {@code Defer} reference next to its data type.
     */
    public static final TypeFieldLimits DEFAULT = new TypeFieldLimits(1, 2);

    // Upper bound for Real / Integer / String / EnumerationSet on a Parameter.
    private final int parameterMax;

    // Upper bound for Real / Integer / String / EnumerationSet / Defer on a FormulaValue.
    private final int formulaValueMax;
}
