package org.omniint.calc;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.util.StopWatch;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.omniint.math.DivisionByZeroException;
import org.omniint.math.OmniInt;
import org.omniint.math.OmniMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.omniint.calc.Constants.*;


/**
 * Command line calculator over arbitrary-precision integers.
 *
 * <pre>
 *   omnicalc [-D omniint.calc.timing=true] a op b     op is one of + - x * / %
 *   omnicalc sqrt n | gcd a b | pow a e
 *   omnicalc demo
 *   omnicalc -                                     one expression per line from stdin
 *   omnicalc -D omniint.calc.input=file            one expression per line from file
 * </pre>
 */
public class OmniCalc extends Configured implements Tool {

    private static Logger LOG = LoggerFactory.getLogger(OmniCalc.class);

    static {
        Configuration.addDefaultResource(DEFAULT_RESOURCE);
    }

    private final PrintStream out;

    public OmniCalc() {
        this(System.out);
    }

    public OmniCalc(PrintStream out) {
        this.out = out;
    }

    /**
     * Evaluate an expression given as tokens.
     * @param tokens expression tokens.
     * @return the value of the expression.
     * @throws IllegalArgumentException if the expression is malformed, or an operand
     *         is not a decimal integer.
     * @throws ArithmeticException if the operation is undefined for the operands.
     */
    public static OmniInt evaluate(List<String> tokens) {
        if (tokens.size() == 2 && "sqrt".equals(tokens.get(0))) {
            return OmniMath.sqrt(OmniInt.valueOf(tokens.get(1)));
        } else if (tokens.size() == 3 && "gcd".equals(tokens.get(0))) {
            return OmniMath.gcd(OmniInt.valueOf(tokens.get(1)), OmniInt.valueOf(tokens.get(2)));
        } else if (tokens.size() == 3 && "pow".equals(tokens.get(0))) {
            return OmniMath.pow(OmniInt.valueOf(tokens.get(1)), OmniInt.valueOf(tokens.get(2)).intValueExact());
        } else if (tokens.size() == 3) {
            final OmniInt a = OmniInt.valueOf(tokens.get(0));
            final OmniInt b = OmniInt.valueOf(tokens.get(2));
            final String op = tokens.get(1);
            switch (op) {
                case "+":
                    return a.plusEqual(b);
                case "-":
                    return a.minusEqual(b);
                case "x":
                case "*":
                    return a.multiplyEqual(b);
                case "/":
                    return a.divideEqual(b);
                case "%":
                    return a.modEqual(b);
                default:
                    throw new IllegalArgumentException("Unknown operator: " + op);
            }
        }
        throw new IllegalArgumentException("Malformed expression: " + String.join(" ", tokens));
    }

    /**
     * Run method.
     * @param args arguments
     * @return 0 if every expression is evaluated, 1 if some failed, 2 for usage errors.
     * @throws Exception exception.
     */
    public int run(String[] args) throws Exception {
        final Configuration conf = getConf();
        final String input = conf.getTrimmed(INPUT_CONFIGURATION_NAME, "");

        if (args.length == 1 && "demo".equals(args[0])) {
            demo();
            return EXIT_SUCCESS;
        } else if (args.length == 1 && STDIN.equals(args[0])) {
            return evaluateLines(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } else if (args.length == 0 && STDIN.equals(input)) {
            return evaluateLines(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } else if (args.length == 0 && !input.isEmpty()) {
            LOG.info("Evaluating expressions from " + input);
            try (BufferedReader in = Files.newBufferedReader(Paths.get(input), StandardCharsets.UTF_8)) {
                return evaluateLines(in);
            }
        } else if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }

        try {
            out.println(format(evaluateTimed(Arrays.asList(args))));
            return EXIT_SUCCESS;
        } catch (IllegalArgumentException e) {
            LOG.error(describe(e));
            printUsage();
            return EXIT_USAGE;
        } catch (ArithmeticException e) {
            LOG.error(describe(e));
            return EXIT_FAILURE;
        }
    }

    /**
     * Evaluate one expression per line; blank lines and lines starting with # are skipped.
     * A failed expression is logged and does not stop the remaining ones.
     */
    int evaluateLines(BufferedReader in) throws IOException {
        int lineNumber = 0;
        int failures = 0;
        for (String line; (line = in.readLine()) != null; ) {
            lineNumber++;
            final String expression = line.trim();
            if (expression.isEmpty() || expression.startsWith("#")) {
                continue;
            }
            try {
                out.println(expression + " = " + format(evaluateTimed(Arrays.asList(expression.split("\\s+")))));
            } catch (IllegalArgumentException | ArithmeticException e) {
                failures++;
                LOG.error("line " + lineNumber + ": " + describe(e));
                out.println(expression + " : " + e.getClass().getSimpleName());
            }
        }
        LOG.info(lineNumber + " line(s) read, " + failures + " failure(s)");
        return failures == 0 ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    private OmniInt evaluateTimed(List<String> tokens) {
        if (!getConf().getBoolean(TIMING_CONFIGURATION_NAME, DEFAULT_TIMING)) {
            return evaluate(tokens);
        }
        final StopWatch watch = new StopWatch().start();
        final OmniInt result = evaluate(tokens);
        watch.stop();
        LOG.info(String.join(" ", tokens) + " took " + watch.now(TimeUnit.MILLISECONDS) + "ms");
        return result;
    }

    private String format(OmniInt value) {
        return getConf().getBoolean(BRIEF_CONFIGURATION_NAME, DEFAULT_BRIEF) ? value.toBrief() : value.toString();
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * The demonstration sequence: construction, sum, product, square root,
     * a division by zero and a counter.
     */
    void demo() {
        final OmniInt num1 = OmniInt.valueOf("12345678901234567890");
        final OmniInt num2 = OmniInt.valueOf(54321);
        out.println("num1: " + num1);
        out.println("num2: " + num2);
        out.println("num1 + num2 = " + num1.plus(num2));
        out.println("num1 * num2 = " + num1.multiply(num2));

        final OmniInt n = OmniInt.valueOf("98765432109876543210");
        out.println("sqrt(" + n + ") = " + OmniMath.sqrt(n));

        try {
            out.println("Result of division by zero: " + num1.divide(new OmniInt()));
        } catch (DivisionByZeroException e) {
            LOG.warn("Expected: " + describe(e));
            out.println("Error: " + e.getMessage());
        }

        final OmniInt counter = OmniInt.valueOf(10);
        out.println("Counter initially: " + counter);
        counter.incrementEqual();
        out.println("Counter after increment: " + counter);
        counter.minusEqual(5);
        out.println("Counter after decrement: " + counter);
    }

    private void printUsage() {
        out.println("Usage: omnicalc [generic options] <a> <op> <b>   (op: + - x * / %)");
        out.println("       omnicalc [generic options] sqrt <n> | gcd <a> <b> | pow <a> <e>");
        out.println("       omnicalc [generic options] demo");
        out.println("       omnicalc [generic options] -   (expressions from stdin)");
        out.println("       omnicalc -D " + INPUT_CONFIGURATION_NAME + "=<file>");
        ToolRunner.printGenericCommandUsage(out);
    }

    /**
     * Main method.
     * @param args input arguments.
     * @throws Exception exception.
     */
    public static void main(String[] args) throws Exception {
        System.exit(ToolRunner.run(new Configuration(), new OmniCalc(), args));
    }
}
