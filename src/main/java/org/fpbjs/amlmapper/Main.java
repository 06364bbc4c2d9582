package org.fpbjs.amlmapper;

import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.config.MapperConfigHelper;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.util.UuidIdGenerator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;

/**
 * Command line converter.
 * <pre>
 *   [--config &lt;mapper.json&gt;] to-aml  &lt;input.json&gt; [output.aml]
 *   [--config &lt;mapper.json&gt;] to-json &lt;input.aml&gt;  [output.json]
 * </pre>
 * Without an output path the result goes to stdout.
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private static final String CONFIG_OPTION = "--config";

    private final FpbAmlConversionService conversionService;
    private final PrintStream out;
    private final PrintStream err;

    Main(FpbAmlConversionService conversionService, PrintStream out, PrintStream err) {
        this.conversionService = conversionService;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        String[] commandArgs = args;
        MapperConfig config;
        try {
            if (args.length >= 2 && args[0].equals(CONFIG_OPTION)) {
                config = MapperConfigHelper.loadConfigFile(args[1]);
                commandArgs = Arrays.copyOfRange(args, 2, args.length);
            } else {
                config = MapperConfigHelper.loadDefault();
            }
        } catch (MappingException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_FAILED);
            return;
        }

        FpbAmlConversionService service = new FpbAmlConversionService(config, new UuidIdGenerator(), Clock.systemUTC());
        System.exit(new Main(service, System.out, System.err).run(commandArgs));
    }

    int run(String[] args) {
        if (args.length < 2) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args[0];
        if (!command.equals("to-aml") && !command.equals("to-json")) {
            err.println("Unknown command: " + command);
            return EXIT_USAGE;
        }

        Path inputPath = Path.of(args[1]);
        String input;
        try {
            input = Files.readString(inputPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read " + inputPath + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        String output;
        try {
            output = command.equals("to-aml") ? conversionService.toAml(input) : conversionService.toJson(input);
        } catch (MappingException e) {
            log.debug("Conversion of {} failed", inputPath, e);
            err.println("Conversion failed: " + e.getMessage());
            return EXIT_FAILED;
        }

        if (args.length < 3) {
            out.print(output);
            return EXIT_OK;
        }

        Path outputPath = Path.of(args[2]);
        try {
            Files.writeString(outputPath, output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to write " + outputPath + ": " + e.getMessage());
            return EXIT_FAILED;
        }
        out.println("Written to " + outputPath);
        return EXIT_OK;
    }

    private void printUsage() {
        err.println("Usage:");
        err.println("  [--config <mapper.json>] to-aml <input.json> [output.aml]");
        err.println("  [--config <mapper.json>] to-json <input.aml> [output.json]");
    }
}
