package com.debtchecker.model;

import java.math.BigDecimal;

/**
 * One row of the input file.
 *
 * @param line        1-based line number in the source file, header excluded
 * @param identifier  enforcement-procedure number
 * @param knownAmount amount already present in the file, null if none
 */
public record InputRow(int line, String identifier, BigDecimal knownAmount) {
}
