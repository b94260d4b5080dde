/**
 * Arithmetic over a mixture of native Java numbers and
 * {@code BigDecimal}s. The entry point is
 * {@link uk.co.farowl.decarith.MixedArithmetic}, which decides for each
 * operation whether native or decimal arithmetic applies, promoting a
 * native operand where necessary. Decimal arithmetic itself is
 * delegated to a {@link uk.co.farowl.decarith.DecimalEngine}.
 */
package uk.co.farowl.decarith;
