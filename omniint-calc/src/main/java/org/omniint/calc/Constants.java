package org.omniint.calc;

public class Constants {

    public static final String INPUT_CONFIGURATION_NAME = "omniint.calc.input";

    public static final String TIMING_CONFIGURATION_NAME = "omniint.calc.timing";

    public static final String BRIEF_CONFIGURATION_NAME = "omniint.calc.brief";

    public static final String DEFAULT_RESOURCE = "omniint-calc-default.xml";

    public static final String STDIN = "-";

    public static final boolean DEFAULT_TIMING = false;

    public static final boolean DEFAULT_BRIEF = false;

    public static final int EXIT_SUCCESS = 0;

    public static final int EXIT_FAILURE = 1;

    public static final int EXIT_USAGE = 2;
}
