package com.minilex.playground;

import com.minilex.playground.service.ScannerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Logs the token stream of a small built-in program at startup.
 */
@Component
@ConditionalOnProperty(prefix = "minilex.scanner", name = "sample-on-startup", havingValue = "true")
public class SampleScanRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(SampleScanRunner.class);

    static final String SAMPLE_PROGRAM =
            "function fib(int n) : int {\n"
            + "    if (n == 0) return 0;\n"
            + "    else if (n == 1) return 1;\n"
            + "    return fib(n - 1) + fib(n - 2);\n"
            + "}\n"
            + "function main() {\n"
            + "    print(\"fibonacci 10 = \", fib(10));\n"
            + "}";

    private final ScannerService scannerService;

    public SampleScanRunner(ScannerService scannerService) {
        this.scannerService = scannerService;
    }

    @Override
    public void run(String... args) throws Exception {
        logger.info("=== Sample program tokens ===");
        for (String line : scannerService.render(SAMPLE_PROGRAM).split("\n")) {
            logger.info(line);
        }
        logger.info("=== End of sample program ===");
    }
}
