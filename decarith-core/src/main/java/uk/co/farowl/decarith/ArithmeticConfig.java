// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.decarith;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default decimal context, resolved from system properties when
 * this class is initialised. The properties are:
 * <table>
 * <caption>Properties read</caption>
 * <tr>
 * <th>Property</th>
 * <th>Default</th>
 * </tr>
 * <tr>
 * <td>{@value #PRECISION_PROPERTY}</td>
 * <td>{@value #DEFAULT_PRECISION} (0 means unlimited)</td>
 * </tr>
 * <tr>
 * <td>{@value #ROUNDING_PROPERTY}</td>
 * <td>{@code HALF_UP} (any {@link RoundingMode} name)</td>
 * </tr>
 * </table>
 * A value that cannot be used is reported and the default applies.
 */
public final class ArithmeticConfig {

    private ArithmeticConfig() {} // no instances and static members only

    /** Logger for configuration of the arithmetic. */
    static final Logger logger =
            LoggerFactory.getLogger(ArithmeticConfig.class);

    /** System property giving the decimal precision in digits. */
    public static final String PRECISION_PROPERTY = "decarith.precision";

    /** System property naming the decimal rounding mode. */
    public static final String ROUNDING_PROPERTY = "decarith.rounding";

    /** Precision used when none (or an invalid one) is configured. */
    public static final int DEFAULT_PRECISION = 28;

    /** Rounding used when none (or an invalid one) is configured. */
    public static final RoundingMode DEFAULT_ROUNDING =
            RoundingMode.HALF_UP;

    /** The context resolved from the system properties. */
    public static final MathContext DEFAULT_CONTEXT;

    static {
        DEFAULT_CONTEXT = resolve(System.getProperties());
        logger.atInfo().setMessage("Decimal arithmetic context is {}")
                .addArgument(DEFAULT_CONTEXT).log();
    }

    /**
     * Resolve a decimal context from the given properties, which are
     * normally the system properties.
     *
     * @param props in which to look up the settings
     * @return the context they specify
     */
    static MathContext resolve(Properties props) {
        int precision =
                precision(props.getProperty(PRECISION_PROPERTY));
        RoundingMode rounding =
                rounding(props.getProperty(ROUNDING_PROPERTY));
        return new MathContext(precision, rounding);
    }

    /**
     * Interpret the precision setting.
     *
     * @param text of the setting or {@code null}
     * @return precision to use
     */
    static int precision(String text) {
        if (text == null) { return DEFAULT_PRECISION; }
        try {
            int p = Integer.parseInt(text.strip());
            if (p >= 0) { return p; }
        } catch (NumberFormatException e) {
            // Report it below
        }
        logger.atWarn().setMessage(BAD_SETTING)
                .addArgument(PRECISION_PROPERTY).addArgument(text)
                .addArgument(DEFAULT_PRECISION).log();
        return DEFAULT_PRECISION;
    }

    /**
     * Interpret the rounding setting.
     *
     * @param text of the setting or {@code null}
     * @return rounding mode to use
     */
    static RoundingMode rounding(String text) {
        if (text == null) { return DEFAULT_ROUNDING; }
        try {
            return RoundingMode
                    .valueOf(text.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.atWarn().setMessage(BAD_SETTING)
                    .addArgument(ROUNDING_PROPERTY).addArgument(text)
                    .addArgument(DEFAULT_ROUNDING).log();
            return DEFAULT_ROUNDING;
        }
    }

    private static final String BAD_SETTING =
            "Ignoring {}='{}': using {}";
}
